package dumb.clarity;

import java.util.*;

import static dumb.clarity.util.Log.message;
import static dumb.clarity.util.Log.warning;

/**
 * The structural half of an analysis: circular reasoning, load-bearing assumptions, the rule-based patterns and
 * bias signatures, plus the dependency order and centrality scores the result carries for diagnostics.
 */
public final class Fallacies {

    private Fallacies() {
    }

    public static Outcome detect(Batch batch, Config config, Budget budget) {
        var graph = new Graph(batch);
        var fallacies = new ArrayList<Fallacy>();
        var warnings = new ArrayList<Warning>();
        var degraded = false;

        var cycles = new Cycles(graph, config.maxCycleLength(), config.maxCycles(), budget).enumerate();
        var n = 0;
        for (var cycle : cycles.cycles()) {
            var pattern = Fallacy.Pattern.CIRCULAR;
            var nodes = cycle.subList(0, cycle.size() - 1);
            fallacies.add(new Fallacy("fallacy-" + pattern.label() + "-" + ++n, pattern.title, pattern,
                    "Each step is justified by the next and the chain returns to its start: " + String.join(" → ", cycle),
                    nodes, cycle, null, null));
        }
        if (cycles.truncated()) {
            degraded = true;
            warnings.add(warn(new Warning("request", cycles.cancelled() ? Warning.Reason.CANCELLED : Warning.Reason.CYCLE_BUDGET,
                    "cycle enumeration stopped: " + cycles.reason())));
        }

        fallacies.addAll(Patterns.hastyGeneralizations(graph));
        fallacies.addAll(Patterns.falseDilemmas(graph));
        fallacies.addAll(Patterns.appealsToAuthority(graph));

        var scores = new LinkedHashMap<String, Double>();
        var loadBearing = new ArrayList<String>();
        try {
            var centrality = new Centrality(graph, budget);
            n = 0;
            for (var v = 0; v < graph.size(); v++) {
                var p = graph.node(v);
                var score = centrality.score(v);
                scores.put(p.id(), score);
                if (p.kind() != Proposition.Kind.ASSUMPTION || score <= config.loadBearingThreshold()) continue;
                loadBearing.add(p.id());
                var dependents = centrality.dependents(v);
                var pattern = Fallacy.Pattern.LOAD_BEARING;
                fallacies.add(new Fallacy("fallacy-" + pattern.label() + "-" + ++n, pattern.title, pattern,
                        String.format(Locale.ROOT, "Unguarded assumption carries %.0f%% of the shortest reasoning paths, %d proposition(s) depend on it: \"%s\"",
                                score * 100, dependents.size(), p.label()),
                        List.of(p.id()), null, dependents, score));
            }
        } catch (Budget.Exhausted e) {
            degraded = true;
            scores.clear();
            warnings.add(warn(new Warning("request", e.cancelled ? Warning.Reason.CANCELLED : Warning.Reason.CENTRALITY_BUDGET,
                    "centrality stopped: " + e.getMessage())));
        }

        var biases = Biases.detect(graph, scores);

        message(fallacies.size() + " fallacy pattern(s) and " + biases.size() + " bias signature(s) over " + graph.size()
                + " propositions and " + graph.edges().size() + " relationships");
        return new Outcome(fallacies, biases, scores, loadBearing, graph.dependencyOrder(), degraded, warnings);
    }

    private static Warning warn(Warning w) {
        warning(w.toString());
        return w;
    }

    public record Outcome(List<Fallacy> fallacies, List<Bias> biases, Map<String, Double> centrality, List<String> loadBearing,
                          Graph.Order order, boolean degraded, List<Warning> warnings) {
        public Outcome {
            fallacies = List.copyOf(fallacies);
            biases = List.copyOf(biases);
            centrality = Collections.unmodifiableMap(new LinkedHashMap<>(centrality));
            loadBearing = List.copyOf(loadBearing);
            warnings = List.copyOf(warnings);
        }
    }
}
