package dumb.clarity;

import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Structural signatures of cognitive biases: anchoring, confirmation bias, the planning fallacy and attribute
 * substitution. Each rule reads only the graph and proposition metadata; severity follows the centrality of
 * the biased proposition.
 */
public final class Biases {

    private static final Set<String> NOISE = Set.of("true", "false", "and", "or", "not");

    private Biases() {
    }

    public static List<Bias> detect(Graph g, Map<String, Double> centrality) {
        var out = new ArrayList<Bias>();
        anchoring(g, centrality, out);
        confirmation(g, centrality, out);
        planningFallacy(g, centrality, out);
        attributeSubstitution(g, centrality, out);
        return out;
    }

    static void anchoring(Graph g, Map<String, Double> centrality, List<Bias> out) {
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.ASSUMPTION || p.confidence() != Proposition.Confidence.UNSTATED_AS_ABSOLUTE) continue;
            if (g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS).length > 0) continue;
            out.add(bias(out, Bias.Kind.ANCHORING, p, centrality,
                    "Assumption taken as absolute without support; later reasoning adjusts from it instead of testing it: \""
                            + p.label() + "\"",
                    List.of(p.id())));
        }
    }

    static void confirmation(Graph g, Map<String, Double> centrality, List<Bias> out) {
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.CLAIM) continue;
            var supporters = g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS);
            if (supporters.length < 2) continue;
            if (g.predecessors(v, k -> k == Relationship.Kind.CONTRADICTS || k == Relationship.Kind.ATTACKS).length > 0) continue;
            var affected = new ArrayList<String>();
            affected.add(p.id());
            for (var u : supporters) affected.add(g.id(u));
            out.add(bias(out, Bias.Kind.CONFIRMATION, p, centrality,
                    "Claim backed by " + supporters.length + " supporting propositions and no counter-evidence: \"" + p.label() + "\"",
                    affected));
        }
    }

    static void planningFallacy(Graph g, Map<String, Double> centrality, List<Bias> out) {
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.CLAIM || !p.loadBearing() || p.confidence() != Proposition.Confidence.HIGH) continue;
            if (g.successors(v, k -> k == Relationship.Kind.DEPENDS_ON || k == Relationship.Kind.ASSUMES).length > 0) continue;
            var guarded = g.incoming(v).stream().map(e -> g.node(e.from()).kind())
                    .anyMatch(k -> k == Proposition.Kind.CONSTRAINT || k == Proposition.Kind.RISK);
            if (guarded) continue;
            out.add(bias(out, Bias.Kind.PLANNING_FALLACY, p, centrality,
                    "Load-bearing claim held with high confidence but never broken into dependencies or weighed against a constraint or risk: \""
                            + p.label() + "\"",
                    List.of(p.id())));
        }
    }

    static void attributeSubstitution(Graph g, Map<String, Double> centrality, List<Bias> out) {
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            if (p.kind() != Proposition.Kind.CLAIM) continue;
            var claimVars = variables(p.formalExpression());
            if (claimVars.isEmpty()) continue;
            for (var u : g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS)) {
                var s = g.node(u);
                var supportVars = variables(s.formalExpression());
                if (supportVars.isEmpty() || !Collections.disjoint(claimVars, supportVars)) continue;
                out.add(bias(out, Bias.Kind.ATTRIBUTE_SUBSTITUTION, p, centrality,
                        "Claim is about [" + String.join(", ", claimVars) + "] but \"" + s.label() + "\" measures ["
                                + String.join(", ", supportVars) + "]: \"" + p.label() + "\"",
                        List.of(p.id(), s.id())));
            }
        }
    }

    /**
     * The variables a formula talks about: every argument of a predicate, and bare lower-case or snake_case
     * identifiers. Predicate names, constants, connective words and single letters are left out.
     */
    static List<String> variables(@Nullable String formula) {
        var found = new TreeSet<String>();
        if (formula == null) return List.of();
        var depth = 0;
        var i = 0;
        while (i < formula.length()) {
            var c = formula.charAt(i);
            if (isWordChar(c)) {
                var start = i;
                while (i < formula.length() && isWordChar(formula.charAt(i))) i++;
                var word = formula.substring(start, i);
                var predicate = i < formula.length() && formula.charAt(i) == '(';
                if (!predicate && (depth > 0 || isVariableName(word))) found.add(word);
                continue;
            }
            if (c == '(') depth++;
            else if (c == ')' && depth > 0) depth--;
            i++;
        }
        return found.stream().filter(w -> w.length() > 1 && !NOISE.contains(w.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isVariableName(String word) {
        return word.indexOf('_') >= 0 || word.chars().allMatch(Character::isLowerCase);
    }

    private static Bias bias(List<Bias> out, Bias.Kind kind, Proposition p, Map<String, Double> centrality,
                             String description, List<String> affected) {
        var n = out.stream().filter(b -> b.kind() == kind).count() + 1;
        return new Bias("bias-" + kind.label() + "-" + n, kind.title, kind, kind.reference, description, affected,
                Bias.Severity.of(centrality.getOrDefault(p.id(), 0.0)), 1);
    }
}
