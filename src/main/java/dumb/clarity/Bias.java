package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A cognitive-bias signature in the relationship graph.
 *
 * @param kahnemanReference the chapter of Thinking, Fast and Slow describing the bias
 * @param severity          scaled by the centrality of the biased proposition
 * @param system            the thinking system the bias belongs to; every signature detected here is System 1
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Bias(String id, String name, Kind kind, String kahnemanReference, String description,
                   List<String> affectedNodeIds, Severity severity, int system) {

    public Bias {
        requireNonNull(id);
        requireNonNull(kind);
        requireNonNull(description);
        requireNonNull(severity);
        affectedNodeIds = List.copyOf(affectedNodeIds);
    }

    public enum Kind {
        ANCHORING("Anchoring Effect", "Thinking, Fast and Slow, Chapter 11: Anchors"),
        CONFIRMATION("Confirmation Bias", "Thinking, Fast and Slow, Chapter 7: A Machine for Jumping to Conclusions"),
        PLANNING_FALLACY("Planning Fallacy", "Thinking, Fast and Slow, Chapter 23: The Outside View"),
        ATTRIBUTE_SUBSTITUTION("Attribute Substitution", "Thinking, Fast and Slow, Chapter 9: Answering an Easier Question");

        public final String title;
        public final String reference;

        Kind(String title, String reference) {
            this.title = title;
            this.reference = reference;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Severity {
        LOW, MEDIUM, HIGH;

        static Severity of(double centrality) {
            return centrality > 0.3 ? HIGH : centrality > 0.1 ? MEDIUM : LOW;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
