package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A structural reasoning defect found in the relationship graph.
 *
 * @param cyclePath       for circular reasoning, the cycle with its first node repeated at the end
 * @param dependentClaims for load-bearing assumptions, the nodes whose shortest paths run through it
 * @param centrality      for load-bearing assumptions, the normalized betweenness score
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Fallacy(String id, String name, Pattern patternType, String description, List<String> affectedNodeIds,
                      @Nullable List<String> cyclePath, @Nullable List<String> dependentClaims,
                      @Nullable Double centrality) {

    public Fallacy {
        requireNonNull(id);
        requireNonNull(name);
        requireNonNull(patternType);
        requireNonNull(description);
        affectedNodeIds = List.copyOf(affectedNodeIds);
        if (cyclePath != null) cyclePath = List.copyOf(cyclePath);
        if (dependentClaims != null) dependentClaims = List.copyOf(dependentClaims);
    }

    public enum Pattern {
        CIRCULAR("Circular Reasoning (Begging the Question)"),
        HASTY_GENERALIZATION("Hasty Generalization"),
        FALSE_DILEMMA("False Dilemma (False Dichotomy)"),
        LOAD_BEARING("Load-Bearing Assumption"),
        APPEAL_TO_AUTHORITY("Appeal to Authority");

        public final String title;

        Pattern(String title) {
            this.title = title;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
