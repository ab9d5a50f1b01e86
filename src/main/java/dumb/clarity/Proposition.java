package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * A validated proposition. Built once at the engine boundary by {@link Batch}; components downstream
 * never re-check field presence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Proposition(String id, String statement, @Nullable String formalExpression, Kind kind,
                          Confidence confidence, boolean implicit, boolean loadBearing) {

    public Proposition {
        requireNonNull(id);
        requireNonNull(kind);
        requireNonNull(confidence);
        statement = statement == null ? "" : statement;
        if (formalExpression != null && formalExpression.isBlank()) formalExpression = null;
    }

    public static Proposition of(String id, Kind kind, Confidence confidence, @Nullable String formalExpression) {
        return new Proposition(id, "", formalExpression, kind, confidence, false, false);
    }

    @JsonIgnore
    public boolean hasFormalExpression() {
        return formalExpression != null;
    }

    @JsonIgnore
    public boolean isAssertive() {
        return confidence == Confidence.HIGH || confidence == Confidence.UNSTATED_AS_ABSOLUTE;
    }

    public String label() {
        return statement.isBlank() ? (formalExpression != null ? formalExpression : id) : statement;
    }

    public enum Kind {
        CLAIM, EVIDENCE, ASSUMPTION, CONSTRAINT, RISK;

        @Nullable
        @JsonCreator
        public static Kind parse(@Nullable String s) {
            return Labels.parse(Kind.class, s);
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Confidence {
        HIGH, MEDIUM, LOW, UNSTATED_AS_ABSOLUTE;

        @Nullable
        @JsonCreator
        public static Confidence parse(@Nullable String s) {
            return Labels.parse(Confidence.class, s);
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    static final class Labels {
        private Labels() {
        }

        @Nullable
        static <E extends Enum<E>> E parse(Class<E> type, @Nullable String s) {
            if (s == null || s.isBlank()) return null;
            var key = s.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
            try {
                return Enum.valueOf(type, key);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }
}
