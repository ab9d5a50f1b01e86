package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

import static java.util.Objects.requireNonNull;

/** A directed, typed edge between two propositions. Parallel edges and self-loops are legal. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Relationship(String id, String fromId, String toId, Kind kind, Strength strength, @Nullable String label) {

    public Relationship {
        requireNonNull(id);
        requireNonNull(fromId);
        requireNonNull(toId);
        requireNonNull(kind);
        requireNonNull(strength);
    }

    public static Relationship of(String id, String fromId, String toId, Kind kind) {
        return new Relationship(id, fromId, toId, kind, Strength.STRONG, null);
    }

    @JsonIgnore
    public boolean isSelfLoop() {
        return fromId.equals(toId);
    }

    public enum Kind {
        SUPPORTS, CONTRADICTS, DEPENDS_ON, ATTACKS, ASSUMES;

        @Nullable
        @JsonCreator
        public static Kind parse(@Nullable String s) {
            return Proposition.Labels.parse(Kind.class, s);
        }

        // Edges that read as "X holds because Y": the only ones that can make reasoning circular.
        public boolean isJustification() {
            return this == SUPPORTS || this == DEPENDS_ON;
        }

        public boolean isDependency() {
            return this == SUPPORTS || this == DEPENDS_ON || this == ASSUMES;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Strength {
        WEAK, MODERATE, STRONG;

        @Nullable
        @JsonCreator
        public static Strength parse(@Nullable String s) {
            return Proposition.Labels.parse(Strength.class, s);
        }

        public boolean atLeast(Strength other) {
            return compareTo(other) >= 0;
        }

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
