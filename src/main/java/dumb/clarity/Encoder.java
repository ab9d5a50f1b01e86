package dumb.clarity;

import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.clarity.util.Log.warning;

/**
 * Lowers a {@link Batch} into one {@link Cnf.Formula}.
 * <p>
 * Every proposition owns a truth variable {@code ⟨id⟩}. A proposition with a formal expression asserts the
 * expression and defines its truth variable as the expression's conclusion (the consequent of an implication,
 * otherwise the whole expression). A proposition without a usable expression asserts its truth variable.
 * Relationships constrain truth variables only.
 */
public final class Encoder {

    private final Config config;
    private final Cnf.Vars vars = new Cnf.Vars();
    private final List<Cnf.Clause> clauses = new ArrayList<>();
    private final List<Warning> warnings = new ArrayList<>();
    private final Map<String, Expr> parsed = new LinkedHashMap<>();

    private Encoder(Config config) {
        this.config = config;
    }

    public static Encoding encode(Batch batch, Config config) {
        var e = new Encoder(config);
        batch.propositions.forEach(e::proposition);
        batch.relationships.forEach(e::relationship);
        return new Encoding(new Cnf.Formula(e.vars, e.clauses), e.parsed, e.warnings);
    }

    // Name of a proposition's truth variable; the angle brackets cannot occur in a parsed atom.
    public static String truthVar(String propositionId) {
        return "⟨" + propositionId + "⟩";
    }

    public static Expr conclusion(Expr e) {
        return e instanceof Expr.Implies i ? i.consequent() : e;
    }

    @Nullable
    public static Expr parseOrNull(Proposition p) {
        if (!p.hasFormalExpression()) return null;
        try {
            return ExprParser.parse(p.formalExpression());
        } catch (ExprParser.ParseException e) {
            return null;
        }
    }

    private void proposition(Proposition p) {
        var id = p.id();
        var truth = vars.id(truthVar(id));
        var expr = parse(p);
        if (expr != null) {
            try {
                var own = Cnf.lower(expr, vars, config.maxCnfClauses());
                var def = Cnf.lower(new Expr.Iff(new Expr.Atom(truthVar(id)), conclusion(expr)), vars, config.maxCnfClauses());
                parsed.put(id, expr);
                var text = id + ": " + expr.symbolic();
                own.forEach(c -> clauses.add(new Cnf.Clause(c, List.of(id), Cnf.Origin.FORMULA, text)));
                def.forEach(c -> clauses.add(new Cnf.Clause(c, List.of(id), Cnf.Origin.DEFINITION, truthVar(id) + " " + Expr.IFF + " " + conclusion(expr).symbolic())));
                return;
            } catch (Cnf.TooLargeException e) {
                warn(id, Warning.Reason.PARSE_FAILURE, e.getMessage());
            }
        }
        clauses.add(new Cnf.Clause(new int[]{truth}, List.of(id), Cnf.Origin.ASSERTION, id + " asserted"));
    }

    @Nullable
    private Expr parse(Proposition p) {
        if (!p.hasFormalExpression()) return null;
        try {
            return ExprParser.parse(p.formalExpression());
        } catch (ExprParser.ParseException e) {
            warn(p.id(), Warning.Reason.PARSE_FAILURE, e.getMessage());
            return null;
        }
    }

    private void relationship(Relationship r) {
        var a = vars.id(truthVar(r.fromId()));
        var b = vars.id(truthVar(r.toId()));
        int[] lits = switch (r.kind()) {
            case SUPPORTS -> r.strength().atLeast(config.minSupportStrength()) ? Cnf.clause(-a, b) : null;
            case DEPENDS_ON, ASSUMES -> Cnf.clause(-a, b);
            case CONTRADICTS -> Cnf.clause(-a, -b);
            case ATTACKS -> config.attacksPolicy() == Config.AttacksPolicy.CONTRADICTS ? Cnf.clause(-a, -b) : null;
        };
        if (lits == null) return;
        var ids = r.isSelfLoop() ? List.of(r.fromId()) : List.of(r.fromId(), r.toId());
        clauses.add(new Cnf.Clause(lits, ids, Cnf.Origin.RELATIONSHIP, r.fromId() + " " + r.kind().label() + " " + r.toId() + " (" + r.id() + ")"));
    }

    private void warn(String id, Warning.Reason reason, String detail) {
        var w = new Warning(id, reason, detail);
        warning(w.toString());
        warnings.add(w);
    }

    public record Encoding(Cnf.Formula formula, Map<String, Expr> parsed, List<Warning> warnings) {
        public Encoding {
            parsed = Collections.unmodifiableMap(new LinkedHashMap<>(parsed));
            warnings = List.copyOf(warnings);
        }
    }
}
