package dumb.clarity;

import java.util.*;

import static dumb.clarity.util.Log.debug;

/**
 * Deletion-based minimal unsatisfiable core over propositions: each candidate's clauses are withdrawn
 * together and the remainder re-solved; a proposition stays out when the remainder is still unsatisfiable.
 * Passes repeat until one completes without a removal, which also re-confirms that every member is essential.
 */
public final class MinimalCore {

    private final Cnf.Formula formula;
    private final Budget budget;
    private int solverCalls;

    public MinimalCore(Cnf.Formula formula, Budget budget) {
        this.formula = formula;
        this.budget = budget;
    }

    /**
     * @param candidates propositions whose clauses form an unsatisfiable set, in request order
     * @param hint       the refutation of that set, used to try dropping every proposition it never touched at once
     */
    public Result extract(List<String> candidates, Solver.Unsat hint) {
        var core = new ArrayList<>(candidates);
        try {
            var clauses = formula.within(new HashSet<>(core));
            var touched = new HashSet<String>();
            hint.conflicts().forEach(i -> touched.addAll(formula.clauses().get(clauses.get(i)).propositionIds()));
            var reduced = core.stream().filter(touched::contains).toList();
            if (reduced.size() < core.size() && unsat(reduced)) {
                core = new ArrayList<>(reduced);
            }

            var changed = true;
            while (changed) {
                changed = false;
                for (var id : List.copyOf(core)) {
                    budget.check();
                    var rest = new ArrayList<>(core);
                    rest.remove(id);
                    if (!contributes(id, core) || unsat(rest)) {
                        core = rest;
                        changed = true;
                    }
                }
            }
            debug("Minimal core of " + core.size() + " from " + candidates.size() + " propositions after " + solverCalls + " solver calls");
            return new Found(List.copyOf(core), formula.within(new HashSet<>(core)));
        } catch (Budget.Exhausted e) {
            return new Unknown(e.cancelled, e.getMessage());
        }
    }

    public int solverCalls() {
        return solverCalls;
    }

    private boolean contributes(String id, List<String> core) {
        var ids = new HashSet<>(core);
        for (var c : formula.clauses())
            if (c.propositionIds().contains(id) && c.within(ids)) return true;
        return false;
    }

    private boolean unsat(List<String> ids) {
        solverCalls++;
        var clauses = formula.within(new HashSet<>(ids));
        var r = new Solver(budget).solve(formula.vars().size(), formula.lits(clauses));
        if (r instanceof Solver.Unknown u) throw new Budget.Exhausted(u.cancelled(), u.reason());
        return r instanceof Solver.Unsat;
    }

    sealed public interface Result permits Found, Unknown {
    }

    /**
     * @param propositionIds the core, in request order
     * @param clauses        indices into the formula of the clauses belonging to the core
     */
    public record Found(List<String> propositionIds, List<Integer> clauses) implements Result {
    }

    public record Unknown(boolean cancelled, String reason) implements Result {
    }
}
