package dumb.clarity;

import dumb.clarity.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchTest extends AbstractTest {

    private static Request.RawProposition raw(String id, String kind, String confidence) {
        return new Request.RawProposition(id, "statement " + id, null, kind, confidence, null, null);
    }

    private static Request.RawRelationship raw(String id, String from, String kind, String to) {
        return new Request.RawRelationship(id, from, to, kind, "strong", null);
    }

    @Test
    void danglingRelationshipIsDropped() {
        var b = Batch.of(new Request(
                List.of(raw("A", "claim", "medium"), raw("B", "evidence", "high")),
                List.of(raw("r1", "B", "supports", "A"), raw("r2", "A", "supports", "ghost"))));
        assertEquals(2, b.size());
        assertEquals(1, b.relationships.size());
        assertEquals("r1", b.relationships.get(0).id());
        assertEquals(1, b.warnings.size());
        var w = b.warnings.get(0);
        assertEquals("r2", w.subjectId());
        assertEquals(Warning.Reason.DANGLING_REFERENCE, w.reason());
        assertTrue(w.detail().contains("ghost"));
    }

    @Test
    void laterDuplicatesAreDropped() {
        var b = Batch.of(new Request(List.of(raw("A", "claim", "high"), raw("A", "evidence", "low")), List.of()));
        assertEquals(1, b.size());
        assertEquals(Proposition.Kind.CLAIM, b.propositions.get(0).kind());
        assertEquals(Warning.Reason.DUPLICATE_ID, b.warnings.get(0).reason());
    }

    @Test
    void unknownLabelsDefaultLeniently() {
        var b = Batch.of(new Request(
                List.of(raw("A", "hunch", "sort-of"), raw(null, "claim", "high"), raw("B", "Evidence", "Unstated-As-Absolute")),
                List.of(raw("r1", "A", "refutes", "B"), new Request.RawRelationship(null, "B", "A", "supports", "very", null))));
        assertEquals(List.of("A", "B"), b.propositions.stream().map(Proposition::id).toList());
        var a = b.get("A").orElseThrow();
        assertEquals(Proposition.Kind.CLAIM, a.kind());
        assertEquals(Proposition.Confidence.MEDIUM, a.confidence());
        var bb = b.get("B").orElseThrow();
        assertEquals(Proposition.Kind.EVIDENCE, bb.kind());
        assertEquals(Proposition.Confidence.UNSTATED_AS_ABSOLUTE, bb.confidence());
        assertEquals(1, b.relationships.size());
        var r = b.relationships.get(0);
        assertEquals("relationship#2", r.id());
        assertEquals(Relationship.Strength.MODERATE, r.strength());
        assertTrue(b.warnings.stream().allMatch(w -> w.reason() == Warning.Reason.INVALID_FIELD), b.warnings::toString);
        assertEquals(5, b.warnings.size(), b.warnings::toString);
    }

    @Test
    void parsesTheCollaboratorsJson() throws Exception {
        var request = Json.obj("""
                {
                  "propositions": [
                    {"id": "p1", "statement": "Milk is good", "formal_expression": "good(milk)", "type": "claim",
                     "confidence": "unstated_as_absolute", "is_implicit": false, "is_load_bearing": true, "extra": 1},
                    {"id": "p2", "statement": "Cows make milk", "formalExpression": "", "kind": "evidence",
                     "confidence": "high", "isImplicit": true}
                  ],
                  "relationships": [
                    {"id": "r1", "fromId": "p2", "toId": "p1", "type": "supports", "strength": "strong"},
                    {"id": "r2", "from_id": "p1", "to_id": "p2", "kind": "depends_on"}
                  ]
                }
                """, Request.class);
        var b = Batch.of(request);
        assertTrue(b.warnings.isEmpty(), b.warnings::toString);
        var p1 = b.get("p1").orElseThrow();
        assertEquals("good(milk)", p1.formalExpression());
        assertTrue(p1.loadBearing());
        assertEquals(Proposition.Confidence.UNSTATED_AS_ABSOLUTE, p1.confidence());
        var p2 = b.get("p2").orElseThrow();
        assertFalse(p2.hasFormalExpression());
        assertTrue(p2.implicit());
        assertEquals(Relationship.Kind.DEPENDS_ON, b.relationships.get(1).kind());
        assertEquals(Relationship.Strength.MODERATE, b.relationships.get(1).strength());
    }

    @Test
    void nullEntriesAreSkippedWithWarnings() throws Exception {
        var request = Json.obj("{\"propositions\":[null,{\"id\":\"A\",\"type\":\"claim\"}],\"relationships\":[null]}", Request.class);
        assertEquals(2, request.propositions().size());
        var b = Batch.of(request);
        assertEquals(List.of("A"), b.propositions.stream().map(Proposition::id).toList());
        assertTrue(b.relationships.isEmpty());
        assertEquals(List.of("proposition#1", "relationship#1"), b.warnings.stream().map(Warning::subjectId).toList());
        assertTrue(b.warnings.stream().allMatch(w -> w.reason() == Warning.Reason.INVALID_FIELD));
    }

    @Test
    void lookups() {
        var b = batch(List.of(claim("x", null), claim("y", null), claim("z", null)));
        assertEquals(1, b.indexOf("y"));
        assertEquals(-1, b.indexOf("w"));
        assertTrue(b.get("w").isEmpty());
        assertEquals(List.of("x", "z"), b.inOrder(java.util.Set.of("z", "x")));
    }

    @Test
    void emptyRequest() {
        var b = Batch.of(new Request(null, null));
        assertTrue(b.isEmpty());
        assertTrue(b.warnings.isEmpty());
    }
}
