package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/** A recovered, non-fatal problem: the offending input id (or request-level subject) and why it was skipped. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Warning(String subjectId, Reason reason, String detail) {

    public Warning {
        requireNonNull(subjectId);
        requireNonNull(reason);
        requireNonNull(detail);
    }

    @Override
    public String toString() {
        return reason.label() + " [" + subjectId + "]: " + detail;
    }

    public enum Reason {
        PARSE_FAILURE, DANGLING_REFERENCE, DUPLICATE_ID, INVALID_FIELD, SOLVER_BUDGET, CYCLE_BUDGET, CENTRALITY_BUDGET, CANCELLED, INTERNAL_ERROR;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
