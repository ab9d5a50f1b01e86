package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A proven inconsistency.
 *
 * @param propositionIds   the core plus every proposition sharing a variable with it
 * @param minimalCore      propositions that are jointly unsatisfiable, none of them redundant
 * @param formalProof      refutation of the core
 * @param humanExplanation templated summary of the core's statements
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Contradiction(String id, String type, List<String> propositionIds, List<String> minimalCore,
                            Severity severity, Proof formalProof, String humanExplanation) {

    public static final String TYPE_LOGICAL = "logical";

    public Contradiction {
        requireNonNull(id);
        requireNonNull(type);
        propositionIds = List.copyOf(propositionIds);
        minimalCore = List.copyOf(minimalCore);
        requireNonNull(severity);
        requireNonNull(formalProof);
        requireNonNull(humanExplanation);
    }

    public enum Severity {
        CRITICAL, MAJOR, MINOR;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
