package dumb.clarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CyclesTest extends AbstractTest {

    private static List<Proposition> claims(String... ids) {
        return java.util.Arrays.stream(ids).map(id -> claim(id, null)).toList();
    }

    private static Cycles.Result cycles(Batch b, int maxLength, int maxCycles) {
        return new Cycles(new Graph(b), maxLength, maxCycles, Budget.unlimited()).enumerate();
    }

    /** Closed, simple, and every step is a justification edge. */
    private static void assertValid(Batch b, List<String> cycle) {
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
        var inner = cycle.subList(0, cycle.size() - 1);
        assertEquals(inner.size(), new HashSet<>(inner).size(), "internal nodes must be distinct: " + cycle);
        assertTrue(inner.size() >= 2);
        for (var i = 0; i + 1 < cycle.size(); i++) {
            var from = cycle.get(i);
            var to = cycle.get(i + 1);
            assertTrue(b.relationships.stream().anyMatch(r -> r.fromId().equals(from) && r.toId().equals(to) && r.kind().isJustification()),
                    "missing edge " + from + " → " + to);
        }
    }

    @Test
    void threeWayCircularSupport() {
        var b = batch(claims("A", "B", "C"), rel("A", "supports", "B"), rel("B", "supports", "C"), rel("C", "supports", "A"));
        var r = cycles(b, 8, 256);
        assertEquals(List.of(List.of("A", "B", "C", "A")), r.cycles());
        assertFalse(r.truncated());
    }

    @Test
    void selfLoopsAreNotCycles() {
        var r = cycles(batch(claims("A"), rel("A", "supports", "A"), rel("A", "depends_on", "A")), 8, 256);
        assertTrue(r.cycles().isEmpty());
    }

    @Test
    void mutualDependency() {
        var r = cycles(batch(claims("A", "B"), rel("B", "depends_on", "A"), rel("A", "depends_on", "B"), rel("A", "depends_on", "B")), 8, 256);
        assertEquals(List.of(List.of("A", "B", "A")), r.cycles());
    }

    @Test
    void onlyJustificationEdgesCount() {
        var b = batch(claims("A", "B", "C"), rel("A", "supports", "B"), rel("B", "assumes", "A"),
                rel("B", "contradicts", "C"), rel("C", "attacks", "B"));
        assertTrue(cycles(b, 8, 256).cycles().isEmpty());
    }

    @Test
    void longerCyclesThanTheLimitAreSkipped() {
        var b = batch(claims("A", "B", "C", "D"), rel("A", "supports", "B"), rel("B", "supports", "C"),
                rel("C", "supports", "D"), rel("D", "supports", "A"));
        assertTrue(cycles(b, 3, 256).cycles().isEmpty());
        assertEquals(1, cycles(b, 4, 256).cycles().size());
    }

    private static Batch complete(int n) {
        var ids = new ArrayList<String>();
        for (var i = 0; i < n; i++) ids.add("N" + i);
        var rels = new ArrayList<Relationship>();
        for (var a : ids)
            for (var c : ids)
                if (!a.equals(c)) rels.add(rel(a, "supports", c));
        return batch(claims(ids.toArray(String[]::new)), rels.toArray(Relationship[]::new));
    }

    @Test
    void everySimpleCycleOnce() {
        var b = complete(4);
        var r = cycles(b, 8, 0);
        // 6 of length two, 8 of length three, 6 of length four
        assertEquals(20, r.cycles().size());
        assertEquals(20, new HashSet<>(r.cycles()).size());
        r.cycles().forEach(c -> assertValid(b, c));
    }

    @Test
    void cycleLimitTruncates() {
        var r = cycles(complete(4), 8, 3);
        assertEquals(3, r.cycles().size());
        assertTrue(r.truncated());
        assertFalse(r.cancelled());
    }

    @Test
    void cancellationStopsEnumeration() {
        var cancellation = new Budget.Cancellation();
        cancellation.cancel();
        var r = new Cycles(new Graph(complete(5)), 8, 0, new Budget(0, 0, cancellation)).enumerate();
        assertTrue(r.truncated());
        assertTrue(r.cancelled());
    }

    @ParameterizedTest
    @ValueSource(longs = {3, 17, 29, 71})
    void randomGraphsYieldValidCycles(long seed) {
        var rng = new java.util.Random(seed);
        var ids = List.of("a", "b", "c", "d", "e", "f");
        var rels = new ArrayList<Relationship>();
        for (var i = 0; i < 14; i++) {
            var kind = rng.nextBoolean() ? "supports" : rng.nextBoolean() ? "depends_on" : "contradicts";
            rels.add(rel(ids.get(rng.nextInt(6)), kind, ids.get(rng.nextInt(6))));
        }
        var b = batch(claims(ids.toArray(String[]::new)), rels.toArray(Relationship[]::new));
        var r = cycles(b, 6, 0);
        assertEquals(r.cycles().size(), new HashSet<>(r.cycles()).size());
        for (var c : r.cycles()) {
            assertValid(b, c);
            // rooted at its earliest proposition, so no rotation is reported twice
            var root = b.indexOf(c.get(0));
            assertTrue(c.stream().allMatch(id -> b.indexOf(id) >= root), c::toString);
        }
    }
}
