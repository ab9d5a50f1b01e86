package dumb.clarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoresTest extends AbstractTest {

    private static Scores.Score score(List<Scores.Score> scores, String id) {
        return scores.stream().filter(s -> s.propositionId().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void evidenceVulnerabilityAndCentrality() {
        var b = batch(List.of(
                        prop("E", Proposition.Kind.EVIDENCE, Proposition.Confidence.MEDIUM),
                        claim("C", null),
                        new Proposition("H", "Markets stay stable", null, Proposition.Kind.ASSUMPTION, Proposition.Confidence.MEDIUM, true, true)),
                rel("E", "supports", "C"), rel("C", "depends_on", "H"));
        var fallacies = Fallacies.detect(b, Config.DEFAULT, Budget.unlimited());
        var scores = Scores.of(b, List.of(), fallacies);
        assertEquals(List.of("E", "C", "H"), scores.stream().map(Scores.Score::propositionId).toList());

        var c = score(scores, "C");
        assertEquals(1, c.evidencePaths());
        assertEquals(1, c.vulnerableAssumptions());
        assertEquals(0, c.contradictionCount());
        // 1/2 - 0.2 + 0.1 * 1.0
        assertEquals(0.4, c.score(), 1e-9);

        assertEquals(0.0, score(scores, "E").score(), 1e-9);
        assertEquals(0, score(scores, "H").vulnerableAssumptions());
    }

    @Test
    void supportedAssumptionsAreNotVulnerable() {
        var b = batch(List.of(
                        prop("E", Proposition.Kind.EVIDENCE, Proposition.Confidence.MEDIUM),
                        claim("C", null),
                        new Proposition("H", "", null, Proposition.Kind.ASSUMPTION, Proposition.Confidence.MEDIUM, false, true)),
                rel("C", "assumes", "H"), rel("E", "supports", "H"));
        var scores = Scores.of(b, List.of(), Fallacies.detect(b, Config.DEFAULT, Budget.unlimited()));
        assertEquals(0, score(scores, "C").vulnerableAssumptions());
    }

    @Test
    void contradictionsLowerTheScore() {
        var b = batch(List.of(claim("A", "x"), claim("B", "¬x"), prop("E1", Proposition.Kind.EVIDENCE, Proposition.Confidence.MEDIUM),
                        prop("E2", Proposition.Kind.EVIDENCE, Proposition.Confidence.MEDIUM), prop("E3", Proposition.Kind.EVIDENCE, Proposition.Confidence.MEDIUM)),
                rel("E1", "supports", "A"), rel("E2", "supports", "A"), rel("E3", "supports", "A"));
        var contradictions = Contradictions.detect(b, Config.DEFAULT, Budget.unlimited()).contradictions();
        var scores = Scores.of(b, contradictions, Fallacies.detect(b, Config.DEFAULT, Budget.unlimited()));
        var a = score(scores, "A");
        assertEquals(1, a.contradictionCount());
        assertEquals(3, a.evidencePaths());
        assertTrue(a.score() < 0.75 - 0.3 + 0.1 + 1e-9);
        assertTrue(a.score() >= 0.75 - 0.3 - 1e-9);
        assertEquals(0.0, score(scores, "B").score(), 1e-9);
    }
}
