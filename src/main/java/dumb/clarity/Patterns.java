package dumb.clarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Rule-based fallacy patterns over the graph and proposition metadata. */
public final class Patterns {

    private static final List<String> AUTHORITY_WORDS = List.of("says", "according", "expert", "authority", "believes",
            "argues", "claims", "stated");

    private Patterns() {
    }

    public static List<Fallacy> hastyGeneralizations(Graph g) {
        var out = new ArrayList<Fallacy>();
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.CLAIM || !p.isAssertive()) continue;
            var evidence = Arrays.stream(g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS))
                    .filter(u -> g.node(u).kind() == Proposition.Kind.EVIDENCE).count();
            if (evidence > 1) continue;
            var pattern = Fallacy.Pattern.HASTY_GENERALIZATION;
            out.add(new Fallacy("fallacy-" + pattern.label() + "-" + (out.size() + 1), pattern.title, pattern,
                    "Claim stated with " + p.confidence().label().replace('_', ' ') + " confidence but supported by "
                            + evidence + " piece(s) of evidence: \"" + p.label() + "\"",
                    List.of(p.id()), null, null, null));
        }
        return out;
    }

    /**
     * A proposition whose expression is a two-way disjunction at the top level and which has exactly two incoming
     * supports or depends_on edges.
     */
    public static List<Fallacy> falseDilemmas(Graph g) {
        var out = new ArrayList<Fallacy>();
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            var expr = Encoder.parseOrNull(p);
            if (!(expr instanceof Expr.Or) || expr.disjuncts().size() != 2) continue;
            var incoming = g.incoming(v).stream().filter(e -> e.kind().isJustification() && e.from() != e.to()).toList();
            if (incoming.size() != 2) continue;
            var affected = new ArrayList<String>();
            affected.add(p.id());
            for (var u : g.predecessors(v, Relationship.Kind::isJustification)) affected.add(g.id(u));
            var d = expr.disjuncts();
            var pattern = Fallacy.Pattern.FALSE_DILEMMA;
            out.add(new Fallacy("fallacy-" + pattern.label() + "-" + (out.size() + 1), pattern.title, pattern,
                    "Only two options are considered, " + d.get(0).symbolic() + " or " + d.get(1).symbolic()
                            + ", when others may exist: \"" + p.label() + "\"",
                    affected, null, null, null));
        }
        return out;
    }

    public static List<Fallacy> appealsToAuthority(Graph g) {
        var out = new ArrayList<Fallacy>();
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.EVIDENCE) continue;
            var text = (p.statement() + " " + (p.hasFormalExpression() ? p.formalExpression() : "")).toLowerCase(Locale.ROOT);
            var word = AUTHORITY_WORDS.stream().filter(text::contains).findFirst();
            if (word.isEmpty() || g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS).length > 0) continue;
            var pattern = Fallacy.Pattern.APPEAL_TO_AUTHORITY;
            out.add(new Fallacy("fallacy-" + pattern.label() + "-" + (out.size() + 1), pattern.title, pattern,
                    "Evidence cites a source ('" + word.get() + "') instead of data and nothing supports it: \"" + p.label() + "\"",
                    List.of(p.id()), null, null, null));
        }
        return out;
    }
}
