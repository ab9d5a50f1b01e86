package dumb.clarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CentralityTest extends AbstractTest {

    private static final double EPS = 1e-9;

    private static Centrality centrality(Batch b) {
        return new Centrality(new Graph(b), Budget.unlimited());
    }

    @Test
    void hubOfAStar() {
        var b = batch(List.of(prop("H", Proposition.Kind.ASSUMPTION, Proposition.Confidence.MEDIUM),
                        claim("L1", null), claim("L2", null), claim("L3", null), claim("L4", null)),
                rel("L1", "assumes", "H"), rel("H", "supports", "L2"), rel("L3", "contradicts", "H"), rel("H", "attacks", "L4"));
        var c = centrality(b);
        assertEquals(1.0, c.score("H"), EPS);
        assertEquals(0.0, c.score("L1"), EPS);
        assertEquals(List.of("L1", "L2", "L3", "L4"), c.dependents(0));
        assertTrue(c.dependents(1).isEmpty());
    }

    @Test
    void middleOfAPath() {
        var b = batch(List.of(claim("A", null), claim("B", null), claim("C", null), claim("D", null)),
                rel("A", "supports", "B"), rel("C", "supports", "B"), rel("C", "depends_on", "D"));
        var c = centrality(b);
        // B lies on A-C and A-D, C on A-D and B-D: 4 of the 6 ordered-pair slots each, out of (n-1)(n-2) = 6
        assertEquals(4.0 / 6, c.score("B"), EPS);
        assertEquals(4.0 / 6, c.score("C"), EPS);
        assertEquals(0.0, c.score("A"), EPS);
        assertEquals(List.of("A", "C", "D"), c.dependents(1));
    }

    @Test
    void parallelPathsShareTheLoad() {
        // two routes from S to T, one through X and one through Y
        var b = batch(List.of(claim("S", null), claim("X", null), claim("Y", null), claim("T", null)),
                rel("S", "supports", "X"), rel("X", "supports", "T"), rel("S", "supports", "Y"), rel("Y", "supports", "T"));
        var c = centrality(b);
        assertEquals(c.score("X"), c.score("Y"), EPS);
        assertEquals(1.0 / 6, c.score("X"), EPS);
    }

    @Test
    void selfLoopsAndIsolatedNodes() {
        var b = batch(List.of(claim("A", null), claim("B", null), claim("Z", null)),
                rel("A", "supports", "A"), rel("A", "supports", "B"));
        var c = centrality(b);
        for (var id : List.of("A", "B", "Z")) assertEquals(0.0, c.score(id), EPS);
        assertTrue(c.dependents(2).isEmpty());
    }

    @Test
    void emptyGraph() {
        assertDoesNotThrow(() -> centrality(batch(List.of())));
    }
}
