package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.*;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Clause-level representation: a shared variable namespace, DIMACS-style integer literals
 * ({@code +v} / {@code -v}) and clauses tagged with the propositions they came from.
 */
public final class Cnf {

    private Cnf() {
    }

    /**
     * Lowers a formula to clauses by implication elimination, negation pushing and distribution.
     * Literals inside a clause are sorted, duplicate literals, tautologies and duplicate clauses removed,
     * so lowering the same tree twice yields the same list.
     */
    public static List<int[]> lower(Expr e, Vars vars, int maxClauses) throws TooLargeException {
        var out = new ArrayList<int[]>();
        var seen = new HashSet<String>();
        for (var c : clauses(e, true, vars, maxClauses)) {
            if (seen.add(Arrays.toString(c))) out.add(c);
        }
        return out;
    }

    private static List<int[]> clauses(Expr e, boolean positive, Vars vars, int max) throws TooLargeException {
        if (e instanceof Expr.Const c)
            return c.value() == positive ? List.of() : List.of(new int[0]);
        if (e instanceof Expr.Atom a) {
            var v = vars.id(a.name());
            return List.of(new int[]{positive ? v : -v});
        }
        if (e instanceof Expr.Not n)
            return clauses(n.arg(), !positive, vars, max);
        if (e instanceof Expr.And and)
            return positive ? conjoin(and.args(), true, vars, max) : disjoin(and.args(), false, vars, max);
        if (e instanceof Expr.Or or)
            return positive ? disjoin(or.args(), true, vars, max) : conjoin(or.args(), false, vars, max);
        if (e instanceof Expr.Implies i) {
            return positive
                    ? product(clauses(i.antecedent(), false, vars, max), clauses(i.consequent(), true, vars, max), max)
                    : concat(clauses(i.antecedent(), true, vars, max), clauses(i.consequent(), false, vars, max), max);
        }
        var iff = (Expr.Iff) e;
        var l = iff.left();
        var r = iff.right();
        return positive
                ? concat(product(clauses(l, false, vars, max), clauses(r, true, vars, max), max),
                product(clauses(l, true, vars, max), clauses(r, false, vars, max), max), max)
                : concat(product(clauses(l, true, vars, max), clauses(r, true, vars, max), max),
                product(clauses(l, false, vars, max), clauses(r, false, vars, max), max), max);
    }

    private static List<int[]> conjoin(List<Expr> args, boolean positive, Vars vars, int max) throws TooLargeException {
        var out = new ArrayList<int[]>();
        for (var a : args) out = concat(out, clauses(a, positive, vars, max), max);
        return out;
    }

    private static List<int[]> disjoin(List<Expr> args, boolean positive, Vars vars, int max) throws TooLargeException {
        List<int[]> acc = List.of(new int[0]);
        for (var a : args) acc = product(acc, clauses(a, positive, vars, max), max);
        return acc;
    }

    private static ArrayList<int[]> concat(List<int[]> a, List<int[]> b, int max) throws TooLargeException {
        if (a.size() + b.size() > max) throw new TooLargeException(a.size() + b.size());
        var out = new ArrayList<int[]>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    private static List<int[]> product(List<int[]> a, List<int[]> b, int max) throws TooLargeException {
        if ((long) a.size() * b.size() > max) throw new TooLargeException((long) a.size() * b.size());
        var out = new ArrayList<int[]>(a.size() * b.size());
        for (var x : a)
            for (var y : b) {
                var merged = merge(x, y);
                if (merged != null) out.add(merged);
            }
        return out;
    }

    static int[] merge(int[] x, int[] y) {
        var lits = new TreeSet<Integer>(Cnf::compareLits);
        for (var l : x) lits.add(l);
        for (var l : y) lits.add(l);
        for (var l : lits)
            if (l > 0 && lits.contains(-l)) return null;
        return lits.stream().mapToInt(Integer::intValue).toArray();
    }

    static int compareLits(int a, int b) {
        var c = Integer.compare(Math.abs(a), Math.abs(b));
        return c != 0 ? c : Integer.compare(a, b);
    }

    public static int[] clause(int... lits) {
        return merge(lits, new int[0]);
    }

    public static final class Vars {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> ids = new HashMap<>();

        public int id(String name) {
            var v = ids.get(requireNonNull(name));
            if (v != null) return v;
            names.add(name);
            ids.put(name, names.size());
            return names.size();
        }

        public OptionalInt find(String name) {
            var v = ids.get(name);
            return v == null ? OptionalInt.empty() : OptionalInt.of(v);
        }

        public String name(int var) {
            return names.get(Math.abs(var) - 1);
        }

        public int size() {
            return names.size();
        }

        public String show(int lit) {
            var n = name(lit);
            return lit < 0 ? Expr.NOT + (n.indexOf(' ') >= 0 ? "(" + n + ")" : n) : n;
        }

        public String show(int[] clause) {
            if (clause.length == 0) return Expr.BOTTOM;
            return Arrays.stream(clause).mapToObj(this::show).collect(Collectors.joining(" " + Expr.OR + " "));
        }
    }

    public enum Origin {
        FORMULA, DEFINITION, ASSERTION, RELATIONSHIP
    }

    /** A clause and the propositions it belongs to. Removing any one of them removes the clause. */
    public record Clause(@JsonIgnore int[] lits, List<String> propositionIds, Origin origin, String source) {
        public Clause {
            requireNonNull(lits);
            propositionIds = List.copyOf(propositionIds);
            requireNonNull(origin);
            requireNonNull(source);
        }

        public boolean within(Set<String> ids) {
            return ids.containsAll(propositionIds);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Clause c && Arrays.equals(lits, c.lits) && propositionIds.equals(c.propositionIds) && origin == c.origin);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(lits) + propositionIds.hashCode();
        }
    }

    public record Formula(Vars vars, List<Clause> clauses) {
        public Formula {
            requireNonNull(vars);
            clauses = List.copyOf(clauses);
        }

        public boolean isEmpty() {
            return clauses.isEmpty();
        }

        public List<Integer> within(Set<String> ids) {
            var out = new ArrayList<Integer>();
            for (var i = 0; i < clauses.size(); i++)
                if (clauses.get(i).within(ids)) out.add(i);
            return out;
        }

        public List<int[]> lits(List<Integer> indices) {
            return indices.stream().map(i -> clauses.get(i).lits()).toList();
        }

        public boolean satisfiedBy(boolean[] model) {
            for (var c : clauses) {
                var sat = false;
                for (var l : c.lits())
                    if (model[Math.abs(l)] == (l > 0)) {
                        sat = true;
                        break;
                    }
                if (!sat) return false;
            }
            return true;
        }
    }

    public static class TooLargeException extends Exception {
        public TooLargeException(long clauses) {
            super("Expression expands to " + clauses + " clauses, over the configured limit");
        }
    }
}
