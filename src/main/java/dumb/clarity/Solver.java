package dumb.clarity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * DPLL satisfiability search: unit propagation to fixpoint, optional pure-literal elimination, then a branch on
 * the unassigned variable occurring most often in unsatisfied clauses (ties to the earliest created variable),
 * true before false. Every choice is a total order over clause and variable indices, so runs are reproducible.
 */
public final class Solver {

    private final Budget budget;
    private final boolean pureLiterals;
    private final Trace trace;

    private int[][] clauses;
    private int[] value;
    private int[] trail;
    private int trailSize;
    private Set<Integer> conflicts;

    public Solver(Budget budget) {
        this(budget, true, Trace.NONE);
    }

    /**
     * @param pureLiterals whether to assign pure literals; disabled when the trace must be a refutation
     * @param trace        receives every decision, propagation and conflict
     */
    public Solver(Budget budget, boolean pureLiterals, Trace trace) {
        this.budget = requireNonNull(budget);
        this.pureLiterals = pureLiterals;
        this.trace = requireNonNull(trace);
    }

    /**
     * @param varCount highest variable index that may occur
     * @param input    clauses as literal arrays; indices reported in results and traces refer to this list
     */
    public Result solve(int varCount, List<int[]> input) {
        clauses = input.toArray(new int[0][]);
        value = new int[varCount + 1];
        trail = new int[varCount + 1];
        trailSize = 0;
        conflicts = new LinkedHashSet<>();
        try {
            budget.check();
            if (search(0)) {
                var model = new boolean[varCount + 1];
                for (var v = 1; v <= varCount; v++) model[v] = value[v] > 0;
                return new Sat(model);
            }
            return new Unsat(List.copyOf(conflicts));
        } catch (Budget.Exhausted e) {
            return new Unknown(e.cancelled, e.getMessage());
        }
    }

    private boolean search(int level) {
        budget.tick();
        var conflict = propagate(level);
        if (conflict >= 0) {
            conflicts.add(conflict);
            trace.conflict(conflict, level);
            return false;
        }
        if (pureLiterals) assignPure();
        var v = pickBranch();
        if (v == 0) return true;
        var mark = trailSize;
        for (var lit : new int[]{v, -v}) {
            trace.decide(lit, level + 1);
            assign(lit);
            if (search(level + 1)) return true;
            undo(mark);
        }
        trace.refuted(level);
        return false;
    }

    // Unit propagation in clause order until nothing changes. Returns a falsified clause index, or -1.
    private int propagate(int level) {
        var changed = true;
        while (changed) {
            changed = false;
            budget.tick();
            for (var i = 0; i < clauses.length; i++) {
                var unassigned = 0;
                var last = 0;
                var sat = false;
                for (var l : clauses[i]) {
                    var val = valueOf(l);
                    if (val > 0) {
                        sat = true;
                        break;
                    }
                    if (val == 0) {
                        unassigned++;
                        last = l;
                    }
                }
                if (sat) continue;
                if (unassigned == 0) return i;
                if (unassigned == 1) {
                    assign(last);
                    trace.propagate(last, i, level);
                    changed = true;
                }
            }
        }
        return -1;
    }

    private void assignPure() {
        var polarity = new int[value.length];
        for (var c : clauses) {
            if (satisfied(c)) continue;
            for (var l : c) {
                var v = Math.abs(l);
                if (value[v] != 0) continue;
                var sign = l > 0 ? 1 : 2;
                polarity[v] |= sign;
            }
        }
        for (var v = 1; v < polarity.length; v++) {
            if (polarity[v] == 1) assign(v);
            else if (polarity[v] == 2) assign(-v);
        }
    }

    private int pickBranch() {
        var counts = new int[value.length];
        for (var c : clauses) {
            if (satisfied(c)) continue;
            for (var l : c)
                if (value[Math.abs(l)] == 0) counts[Math.abs(l)]++;
        }
        var best = 0;
        for (var v = 1; v < counts.length; v++)
            if (counts[v] > counts[best]) best = v;
        return best;
    }

    private boolean satisfied(int[] c) {
        for (var l : c)
            if (valueOf(l) > 0) return true;
        return false;
    }

    private int valueOf(int lit) {
        var v = value[Math.abs(lit)];
        return lit > 0 ? v : -v;
    }

    private void assign(int lit) {
        value[Math.abs(lit)] = lit > 0 ? 1 : -1;
        trail[trailSize++] = Math.abs(lit);
    }

    private void undo(int mark) {
        while (trailSize > mark) value[trail[--trailSize]] = 0;
    }

    sealed public interface Result permits Sat, Unsat, Unknown {
    }

    public record Sat(boolean[] model) implements Result {
    }

    /** @param conflicts indices of every clause found falsified during the search, first occurrence order */
    public record Unsat(List<Integer> conflicts) implements Result {
    }

    public record Unknown(boolean cancelled, String reason) implements Result {
    }

    /** Search events, in the order the solver performs them. */
    public interface Trace {
        Trace NONE = new Trace() {
        };

        default void decide(int lit, int level) {
        }

        default void propagate(int lit, int clause, int level) {
        }

        default void conflict(int clause, int level) {
        }

        default void refuted(int level) {
        }
    }
}
