package dumb.clarity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One analysis request as the extraction collaborator emits it: loosely typed, every field optional.
 * {@link Batch#of(Request)} turns it into validated {@link Proposition}s and {@link Relationship}s.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Request(List<RawProposition> propositions, List<RawRelationship> relationships) {

    public Request {
        // Null entries are kept so that Batch can report them.
        propositions = propositions == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(propositions));
        relationships = relationships == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(relationships));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RawProposition(@Nullable String id,
                                 @Nullable String statement,
                                 @JsonAlias("formal_expression") @Nullable String formalExpression,
                                 @JsonAlias("type") @Nullable String kind,
                                 @Nullable String confidence,
                                 @JsonAlias("is_implicit") @Nullable Boolean isImplicit,
                                 @JsonAlias("is_load_bearing") @Nullable Boolean isLoadBearing) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RawRelationship(@Nullable String id,
                                  @JsonAlias({"from_id", "source"}) @Nullable String fromId,
                                  @JsonAlias({"to_id", "target"}) @Nullable String toId,
                                  @JsonAlias("type") @Nullable String kind,
                                  @Nullable String strength,
                                  @Nullable String label) {
    }
}
