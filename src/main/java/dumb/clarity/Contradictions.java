package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

import static dumb.clarity.util.Log.message;
import static dumb.clarity.util.Log.warning;

/**
 * The satisfiability half of an analysis: encode, decide, and for every unsatisfiable remainder extract a
 * minimal core and its proof. Once a core is reported its propositions are withdrawn and the rest re-solved,
 * so independent contradictions are each reported with their own core.
 */
public final class Contradictions {

    private Contradictions() {
    }

    public static Outcome detect(Batch batch, Config config, Budget budget) {
        var encoding = Encoder.encode(batch, config);
        var warnings = new ArrayList<>(encoding.warnings());
        var formula = encoding.formula();
        if (formula.isEmpty()) return new Outcome(Status.SAT, List.of(), false, warnings);

        var remaining = new LinkedHashSet<String>();
        batch.propositions.forEach(p -> remaining.add(p.id()));
        var found = new ArrayList<Contradiction>();
        Status status = null;
        var degraded = false;

        while (found.size() < config.maxContradictions()) {
            var clauses = formula.within(remaining);
            var result = new Solver(budget).solve(formula.vars().size(), formula.lits(clauses));
            if (status == null)
                status = result instanceof Solver.Sat ? Status.SAT : result instanceof Solver.Unsat ? Status.UNSAT : Status.UNKNOWN;
            if (result instanceof Solver.Sat) break;
            if (result instanceof Solver.Unknown u) {
                degraded = true;
                warnings.add(exhausted(u.cancelled(), "satisfiability undecided: " + u.reason()));
                break;
            }
            var candidates = List.copyOf(remaining);
            var core = new MinimalCore(formula, budget).extract(candidates, (Solver.Unsat) result);
            if (core instanceof MinimalCore.Unknown u) {
                degraded = true;
                warnings.add(exhausted(u.cancelled(), "core minimization stopped: " + u.reason()));
                break;
            }
            var f = (MinimalCore.Found) core;
            Proof proof;
            try {
                proof = prove(formula, f, budget);
            } catch (Budget.Exhausted e) {
                degraded = true;
                warnings.add(exhausted(e.cancelled, "proof of core " + f.propositionIds() + " stopped: " + e.getMessage()));
                break;
            }
            found.add(contradiction(found.size() + 1, batch, formula, f, proof, remaining));
            f.propositionIds().forEach(remaining::remove);
        }
        message("Satisfiability " + status.label() + ", " + found.size() + " contradiction(s) over " + batch.size() + " propositions");
        return new Outcome(status, found, degraded, warnings);
    }

    private static Warning exhausted(boolean cancelled, String detail) {
        var w = new Warning("request", cancelled ? Warning.Reason.CANCELLED : Warning.Reason.SOLVER_BUDGET, detail);
        warning(w.toString());
        return w;
    }

    static Proof prove(Cnf.Formula formula, MinimalCore.Found core, Budget budget) {
        var builder = new Proof.Builder(formula.vars(), core.clauses().stream().map(i -> formula.clauses().get(i)).toList());
        // Replayed without pure-literal elimination so that every step is a derivation.
        var r = new Solver(budget, false, builder).solve(formula.vars().size(), builder.clauses());
        if (r instanceof Solver.Unknown u) throw new Budget.Exhausted(u.cancelled(), u.reason());
        return builder.build();
    }

    private static Contradiction contradiction(int n, Batch batch, Cnf.Formula formula, MinimalCore.Found core, Proof proof, Set<String> remaining) {
        var clauses = core.clauses().stream().map(i -> formula.clauses().get(i)).toList();
        var props = core.propositionIds().stream().map(id -> batch.get(id).orElseThrow()).toList();
        return new Contradiction("contradiction-" + n, Contradiction.TYPE_LOGICAL,
                touched(batch, formula, clauses, remaining), core.propositionIds(), severity(props), proof, explain(props));
    }

    // The core and every remaining proposition whose clauses share a variable with the core's clauses.
    private static List<String> touched(Batch batch, Cnf.Formula formula, List<Cnf.Clause> core, Set<String> remaining) {
        var vars = new HashSet<Integer>();
        var ids = new HashSet<String>();
        for (var c : core) {
            for (var l : c.lits()) vars.add(Math.abs(l));
            ids.addAll(c.propositionIds());
        }
        for (var c : formula.clauses()) {
            if (!c.within(remaining)) continue;
            for (var l : c.lits())
                if (vars.contains(Math.abs(l))) {
                    ids.addAll(c.propositionIds());
                    break;
                }
        }
        return batch.inOrder(ids);
    }

    static Contradiction.Severity severity(List<Proposition> core) {
        if (core.stream().allMatch(Proposition::isAssertive) || core.stream().anyMatch(Proposition::loadBearing))
            return Contradiction.Severity.CRITICAL;
        return core.size() <= 3 ? Contradiction.Severity.MAJOR : Contradiction.Severity.MINOR;
    }

    static String explain(List<Proposition> core) {
        var quoted = core.stream().map(p -> "\"" + p.label() + "\"").toList();
        return switch (quoted.size()) {
            case 1 -> quoted.get(0) + " is inconsistent on its own.";
            case 2 -> quoted.get(0) + " and " + quoted.get(1) + " cannot both be true. Withdrawing either one removes the conflict.";
            default -> String.join(", ", quoted.subList(0, quoted.size() - 1)) + " and " + quoted.get(quoted.size() - 1)
                    + " cannot all be true at once. Withdrawing any one of these " + quoted.size() + " statements removes the conflict.";
        };
    }

    public enum Status {
        SAT, UNSAT, UNKNOWN;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record Outcome(Status status, List<Contradiction> contradictions, boolean degraded, List<Warning> warnings) {
        public Outcome {
            contradictions = List.copyOf(contradictions);
            warnings = List.copyOf(warnings);
        }
    }
}
