package dumb.clarity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Propositional formula tree produced by {@link ExprParser}. */
sealed public interface Expr permits Expr.Const, Expr.Atom, Expr.Not, Expr.And, Expr.Or, Expr.Implies, Expr.Iff {

    String NOT = "¬", AND = "∧", OR = "∨", IMPLIES = "→", IFF = "↔", TOP = "⊤", BOTTOM = "⊥";

    static Expr and(List<Expr> args) {
        return args.size() == 1 ? args.get(0) : new And(args);
    }

    static Expr or(List<Expr> args) {
        return args.size() == 1 ? args.get(0) : new Or(args);
    }

    // Symbolic rendering; re-parsing it yields an equal tree.
    String symbolic();

    default boolean isCompound() {
        return !(this instanceof Atom || this instanceof Const || this instanceof Not);
    }

    default List<Expr> disjuncts() {
        var out = new ArrayList<Expr>();
        flattenOr(this, out);
        return out;
    }

    private static void flattenOr(Expr e, List<Expr> out) {
        if (e instanceof Or o) o.args.forEach(a -> flattenOr(a, out));
        else out.add(e);
    }

    private static String wrap(Expr e) {
        return e.isCompound() ? "(" + e.symbolic() + ")" : e.symbolic();
    }

    record Const(boolean value) implements Expr {
        public static final Const TRUE = new Const(true), FALSE = new Const(false);

        @Override
        public String symbolic() {
            return value ? TOP : BOTTOM;
        }
    }

    record Atom(String name) implements Expr {
        public Atom {
            requireNonNull(name);
            if (name.isBlank()) throw new IllegalArgumentException("Empty atom");
        }

        @Override
        public String symbolic() {
            return name;
        }
    }

    record Not(Expr arg) implements Expr {
        public Not {
            requireNonNull(arg);
        }

        @Override
        public String symbolic() {
            return NOT + wrap(arg);
        }
    }

    record And(List<Expr> args) implements Expr {
        public And {
            args = List.copyOf(args);
            if (args.size() < 2) throw new IllegalArgumentException("Conjunction needs at least two operands");
        }

        @Override
        public String symbolic() {
            return args.stream().map(Expr::wrap).collect(Collectors.joining(" " + AND + " "));
        }
    }

    record Or(List<Expr> args) implements Expr {
        public Or {
            args = List.copyOf(args);
            if (args.size() < 2) throw new IllegalArgumentException("Disjunction needs at least two operands");
        }

        @Override
        public String symbolic() {
            return args.stream().map(Expr::wrap).collect(Collectors.joining(" " + OR + " "));
        }
    }

    record Implies(Expr antecedent, Expr consequent) implements Expr {
        public Implies {
            requireNonNull(antecedent);
            requireNonNull(consequent);
        }

        @Override
        public String symbolic() {
            return wrap(antecedent) + " " + IMPLIES + " " + wrap(consequent);
        }
    }

    record Iff(Expr left, Expr right) implements Expr {
        public Iff {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public String symbolic() {
            return wrap(left) + " " + IFF + " " + wrap(right);
        }
    }
}
