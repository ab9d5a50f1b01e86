package dumb.clarity;

import org.jetbrains.annotations.Nullable;

import java.util.*;

import static dumb.clarity.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * The validated input of one analysis: propositions in request order, relationships whose endpoints
 * both exist, and the warnings produced while validating. Immutable.
 */
public final class Batch {

    public final List<Proposition> propositions;
    public final List<Relationship> relationships;
    public final List<Warning> warnings;
    private final Map<String, Integer> index;

    private Batch(List<Proposition> propositions, List<Relationship> relationships, List<Warning> warnings) {
        this.propositions = List.copyOf(propositions);
        this.relationships = List.copyOf(relationships);
        this.warnings = List.copyOf(warnings);
        var idx = new HashMap<String, Integer>(propositions.size() * 2);
        for (var i = 0; i < this.propositions.size(); i++) idx.put(this.propositions.get(i).id(), i);
        this.index = idx;
    }

    public static Batch of(List<Proposition> propositions, List<Relationship> relationships) {
        var warnings = new ArrayList<Warning>();
        var props = dedupe(propositions, warnings);
        var ids = new HashSet<String>();
        props.forEach(p -> ids.add(p.id()));
        var rels = new ArrayList<Relationship>(relationships.size());
        for (var r : relationships) {
            if (checkEndpoints(r.id(), r.fromId(), r.toId(), ids, warnings)) rels.add(r);
        }
        return new Batch(props, rels, warnings);
    }

    public static Batch of(Request request) {
        requireNonNull(request);
        var warnings = new ArrayList<Warning>();
        var props = new ArrayList<Proposition>(request.propositions().size());
        var n = 0;
        for (var raw : request.propositions()) {
            n++;
            if (raw == null || raw.id() == null || raw.id().isBlank()) {
                warn(warnings, "proposition#" + n, Warning.Reason.INVALID_FIELD, "proposition without id skipped");
                continue;
            }
            var id = raw.id();
            var kind = Proposition.Kind.parse(raw.kind());
            if (kind == null) {
                warn(warnings, id, Warning.Reason.INVALID_FIELD, "unknown kind '" + raw.kind() + "', treated as claim");
                kind = Proposition.Kind.CLAIM;
            }
            var confidence = Proposition.Confidence.parse(raw.confidence());
            if (confidence == null) {
                if (raw.confidence() != null)
                    warn(warnings, id, Warning.Reason.INVALID_FIELD, "unknown confidence '" + raw.confidence() + "', treated as medium");
                confidence = Proposition.Confidence.MEDIUM;
            }
            props.add(new Proposition(id, raw.statement(), raw.formalExpression(), kind, confidence,
                    Boolean.TRUE.equals(raw.isImplicit()), Boolean.TRUE.equals(raw.isLoadBearing())));
        }
        var unique = dedupe(props, warnings);
        var ids = new HashSet<String>();
        unique.forEach(p -> ids.add(p.id()));

        var rels = new ArrayList<Relationship>(request.relationships().size());
        n = 0;
        for (var raw : request.relationships()) {
            n++;
            if (raw == null) {
                warn(warnings, "relationship#" + n, Warning.Reason.INVALID_FIELD, "null relationship skipped");
                continue;
            }
            var id = raw.id() == null || raw.id().isBlank() ? "relationship#" + n : raw.id();
            var kind = Relationship.Kind.parse(raw.kind());
            if (kind == null) {
                warn(warnings, id, Warning.Reason.INVALID_FIELD, "unknown relationship kind '" + raw.kind() + "', dropped");
                continue;
            }
            if (!checkEndpoints(id, raw.fromId(), raw.toId(), ids, warnings)) continue;
            var strength = Relationship.Strength.parse(raw.strength());
            if (strength == null) {
                if (raw.strength() != null)
                    warn(warnings, id, Warning.Reason.INVALID_FIELD, "unknown strength '" + raw.strength() + "', treated as moderate");
                strength = Relationship.Strength.MODERATE;
            }
            rels.add(new Relationship(id, raw.fromId(), raw.toId(), kind, strength, raw.label()));
        }
        return new Batch(unique, rels, warnings);
    }

    private static List<Proposition> dedupe(List<Proposition> propositions, List<Warning> warnings) {
        var seen = new HashSet<String>();
        var out = new ArrayList<Proposition>(propositions.size());
        for (var p : propositions) {
            if (seen.add(p.id())) out.add(p);
            else warn(warnings, p.id(), Warning.Reason.DUPLICATE_ID, "later proposition with the same id dropped");
        }
        return out;
    }

    private static boolean checkEndpoints(String id, @Nullable String from, @Nullable String to, Set<String> ids, List<Warning> warnings) {
        if (from == null || !ids.contains(from)) {
            warn(warnings, id, Warning.Reason.DANGLING_REFERENCE, "unknown source proposition '" + from + "'");
            return false;
        }
        if (to == null || !ids.contains(to)) {
            warn(warnings, id, Warning.Reason.DANGLING_REFERENCE, "unknown target proposition '" + to + "'");
            return false;
        }
        return true;
    }

    private static void warn(List<Warning> warnings, String subject, Warning.Reason reason, String detail) {
        var w = new Warning(subject, reason, detail);
        warning(w.toString());
        warnings.add(w);
    }

    public boolean isEmpty() {
        return propositions.isEmpty();
    }

    public int size() {
        return propositions.size();
    }

    public int indexOf(String id) {
        var i = index.get(id);
        return i == null ? -1 : i;
    }

    public Optional<Proposition> get(String id) {
        var i = index.get(id);
        return i == null ? Optional.empty() : Optional.of(propositions.get(i));
    }

    public List<String> inOrder(Collection<String> ids) {
        return ids.stream().distinct().filter(index::containsKey).sorted(Comparator.comparingInt(index::get)).toList();
    }
}
