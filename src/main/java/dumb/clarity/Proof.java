package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A refutation of a minimal core: the core's clauses as numbered premises, followed by the solver's own
 * propagation trace on those premises (case splits included), ending in ⊥. Built by {@link Builder} while
 * {@link Solver} runs; {@link #verify()} re-checks every step against the premises alone.
 */
public final class Proof {

    private final List<Step> steps;

    private Proof(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    /**
     * Replays the derivation from its premises: each forced literal's clause must have every other literal false,
     * each conflict clause must be entirely false, every case split must be closed for both polarities before
     * the proof leaves its depth, and the last line must be ⊥ at depth 0.
     */
    public boolean verify() {
        var premises = new HashMap<Integer, int[]>();
        var assigned = new HashMap<Integer, Integer>();
        var levelOf = new HashMap<Integer, Integer>();
        // depth, variable, 1 once the negative case has been seen
        var splits = new ArrayDeque<int[]>();
        for (var s : steps) {
            switch (s.kind) {
                case PREMISE -> premises.put(s.number, s.clause);
                case CASE -> {
                    levelOf.entrySet().removeIf(e -> {
                        if (e.getValue() >= s.depth) {
                            assigned.remove(e.getKey());
                            return true;
                        }
                        return false;
                    });
                    var v = Math.abs(s.literal);
                    while (!splits.isEmpty() && splits.peek()[0] > s.depth) {
                        if (splits.pop()[2] == 0) return false;
                    }
                    if (s.literal > 0) {
                        if (!splits.isEmpty() && splits.peek()[0] == s.depth && splits.pop()[2] == 0) return false;
                        splits.push(new int[]{s.depth, v, 0});
                    } else {
                        var open = splits.peek();
                        if (open == null || open[0] != s.depth || open[1] != v || open[2] != 0) return false;
                        open[2] = 1;
                    }
                    assigned.put(v, s.literal);
                    levelOf.put(v, s.depth);
                }
                case FORCED -> {
                    var c = premises.get(s.premise);
                    if (c == null || Arrays.stream(c).noneMatch(l -> l == s.literal)) return false;
                    for (var l : c)
                        if (l != s.literal && !isFalse(l, assigned)) return false;
                    if (assigned.containsKey(Math.abs(s.literal))) return false;
                    assigned.put(Math.abs(s.literal), s.literal);
                    levelOf.put(Math.abs(s.literal), s.depth);
                }
                case CONFLICT -> {
                    var c = premises.get(s.premise);
                    if (c == null) return false;
                    for (var l : c)
                        if (!isFalse(l, assigned)) return false;
                }
                case BOTTOM -> {
                }
            }
        }
        if (steps.isEmpty() || splits.stream().anyMatch(x -> x[2] == 0)) return false;
        var last = steps.get(steps.size() - 1);
        return last.kind == Kind.BOTTOM && last.depth == 0;
    }

    private static boolean isFalse(int lit, Map<Integer, Integer> assigned) {
        var a = assigned.get(Math.abs(lit));
        return a != null && a == -lit;
    }

    @JsonValue
    public List<Step> steps() {
        return steps;
    }

    public List<String> lines() {
        return steps.stream().map(Step::toString).toList();
    }

    public boolean isComplete() {
        return !steps.isEmpty() && steps.get(steps.size() - 1).kind == Kind.BOTTOM && steps.get(steps.size() - 1).depth == 0;
    }

    @Override
    public String toString() {
        return String.join("\n", lines());
    }

    public enum Kind {
        PREMISE, CASE, FORCED, CONFLICT, BOTTOM;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * One numbered line.
     *
     * @param formula       the clause, literal or pair stated on this line
     * @param justification why it holds, citing earlier line numbers
     * @param premise       for forced and conflict lines, the line number of the clause used
     * @param literal       for case and forced lines, the literal asserted
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Step(int number, int depth, Kind kind, String formula, String justification,
                       List<String> propositionIds,
                       @JsonIgnore int premise, @JsonIgnore int literal, @JsonIgnore int[] clause) {
        public Step {
            requireNonNull(kind);
            requireNonNull(formula);
            requireNonNull(justification);
            propositionIds = List.copyOf(propositionIds);
        }

        @Override
        public String toString() {
            var indent = "  ".repeat(depth);
            return number + ". " + indent + formula + (justification.isEmpty() ? "" : "    [" + justification + "]");
        }
    }

    /** Records a {@link Solver} run over a core's clauses as proof lines. */
    public static final class Builder implements Solver.Trace {
        private final Cnf.Vars vars;
        private final List<Cnf.Clause> core;
        private final List<Step> steps = new ArrayList<>();
        private final int[] premiseLine;
        // variable to the line that assigned it and that line's depth
        private final Map<Integer, int[]> assignedAt = new HashMap<>();
        private final Deque<Integer> cases = new ArrayDeque<>();

        public Builder(Cnf.Vars vars, List<Cnf.Clause> core) {
            this.vars = vars;
            this.core = List.copyOf(core);
            this.premiseLine = new int[core.size()];
            for (var i = 0; i < core.size(); i++) {
                var c = core.get(i);
                premiseLine[i] = add(0, Kind.PREMISE, vars.show(c.lits()), "premise, " + c.source(), c.propositionIds(), 0, 0, c.lits());
            }
        }

        public List<int[]> clauses() {
            return core.stream().map(Cnf.Clause::lits).toList();
        }

        @Override
        public void decide(int lit, int level) {
            assignedAt.entrySet().removeIf(e -> e.getValue()[1] >= level);
            var line = add(level, Kind.CASE, "case " + vars.show(lit), lit > 0 ? "assumption" : "assumption, other case of " + cases.peek(), List.of(), 0, lit, null);
            if (lit > 0) cases.push(line);
            assignedAt.put(Math.abs(lit), new int[]{line, level});
        }

        @Override
        public void propagate(int lit, int clause, int level) {
            var c = core.get(clause).lits();
            var uses = cite(c, lit);
            var why = uses.isEmpty() ? "unit clause " + premiseLine[clause] : "from " + premiseLine[clause] + " with " + uses;
            var line = add(level, Kind.FORCED, vars.show(lit), why, core.get(clause).propositionIds(), premiseLine[clause], lit, null);
            assignedAt.put(Math.abs(lit), new int[]{line, level});
        }

        @Override
        public void conflict(int clause, int level) {
            var c = core.get(clause).lits();
            if (c.length == 0) {
                add(level, Kind.CONFLICT, Expr.BOTTOM, "premise " + premiseLine[clause] + " is empty", core.get(clause).propositionIds(), premiseLine[clause], 0, null);
            } else {
                // The most recently assigned literal is the one this clause would force against its earlier assignment.
                var latest = Arrays.stream(c).boxed().max(Comparator.comparingInt(l -> assignedAt.get(Math.abs(l))[0])).orElseThrow();
                var against = assignedAt.get(Math.abs(latest))[0];
                var others = cite(c, latest);
                var why = (others.isEmpty() ? "unit clause " + premiseLine[clause] : "from " + premiseLine[clause] + " with " + others) + " against " + against;
                add(level, Kind.CONFLICT, vars.show(latest) + ", " + vars.show(-latest), why, core.get(clause).propositionIds(), premiseLine[clause], 0, null);
            }
            add(level, Kind.BOTTOM, Expr.BOTTOM, "", List.of(), 0, 0, null);
        }

        @Override
        public void refuted(int level) {
            var opened = cases.isEmpty() ? null : cases.pop();
            add(level, Kind.BOTTOM, Expr.BOTTOM, opened == null ? "both cases" : "both cases of " + opened, List.of(), 0, 0, null);
        }

        private String cite(int[] c, int lit) {
            return Arrays.stream(c).filter(l -> l != lit).map(l -> assignedAt.get(Math.abs(l))[0]).sorted().mapToObj(String::valueOf).collect(Collectors.joining(", "));
        }

        private int add(int depth, Kind kind, String formula, String why, List<String> ids, int premise, int literal, @Nullable int[] clause) {
            var n = steps.size() + 1;
            steps.add(new Step(n, depth, kind, formula, why, ids, premise, literal, clause));
            return n;
        }

        public Proof build() {
            return new Proof(steps);
        }
    }
}
