package dumb.clarity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The result of one request.
 *
 * @param status          satisfiability of the whole batch; {@code unknown} when the solver ran out of budget
 * @param degraded        some half stopped early; absent findings are then not evidence of absence
 * @param warnings        skipped inputs and budget exhaustion, in the order they were recorded
 * @param dependencyOrder propositions ordered along supports, depends_on and assumes edges, source before target
 * @param orderComplete   false when dependency cycles forced part of the order
 * @param centrality      normalized betweenness per proposition
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Analysis(Contradictions.Status status, List<Contradiction> contradictions, List<Fallacy> fallacies,
                       List<Bias> biases, boolean degraded, List<Warning> warnings, List<String> dependencyOrder,
                       boolean orderComplete, Map<String, Double> centrality, List<Scores.Score> scores) {

    public Analysis {
        requireNonNull(status);
        contradictions = List.copyOf(contradictions);
        fallacies = List.copyOf(fallacies);
        biases = List.copyOf(biases);
        warnings = List.copyOf(warnings);
        dependencyOrder = List.copyOf(dependencyOrder);
        centrality = Collections.unmodifiableMap(new LinkedHashMap<>(centrality));
        scores = List.copyOf(scores);
    }
}
