package dumb.clarity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.*;

/**
 * Heuristic argument strength per proposition: rewarded for supporting edges and centrality, penalized for
 * involvement in contradictions and for resting on unguarded load-bearing assumptions.
 */
public final class Scores {

    static final double CONTRADICTION_PENALTY = 0.3, VULNERABILITY_PENALTY = 0.2, CENTRALITY_BONUS = 0.1;

    private Scores() {
    }

    public static List<Score> of(Batch batch, List<Contradiction> contradictions, Fallacies.Outcome fallacies) {
        var g = new Graph(batch);
        var involved = new HashMap<String, Integer>();
        for (var c : contradictions)
            for (var id : c.propositionIds()) involved.merge(id, 1, Integer::sum);
        var flagged = new HashSet<>(fallacies.loadBearing());

        var vulnerable = new boolean[g.size()];
        for (var v = 0; v < g.size(); v++) {
            var p = g.node(v);
            vulnerable[v] = p.kind() == Proposition.Kind.ASSUMPTION && (p.loadBearing() || flagged.contains(p.id()))
                    && g.predecessors(v, k -> k == Relationship.Kind.SUPPORTS).length == 0;
        }

        var out = new ArrayList<Score>(g.size());
        for (var v = 0; v < g.size(); v++) {
            var id = g.id(v);
            var evidence = (int) g.incoming(v).stream().filter(e -> e.kind() == Relationship.Kind.SUPPORTS && e.from() != e.to()).count();
            var linked = new TreeSet<Integer>();
            for (var u : g.successors(v, k -> k == Relationship.Kind.DEPENDS_ON || k == Relationship.Kind.ASSUMES)) linked.add(u);
            for (var u : g.predecessors(v, k -> k == Relationship.Kind.DEPENDS_ON || k == Relationship.Kind.ASSUMES)) linked.add(u);
            var vulnerableCount = (int) linked.stream().filter(u -> vulnerable[u]).count();
            var contradictionCount = involved.getOrDefault(id, 0);
            var centrality = fallacies.centrality().getOrDefault(id, 0.0);
            var s = evidence / (evidence + 1.0) - CONTRADICTION_PENALTY * contradictionCount
                    - VULNERABILITY_PENALTY * vulnerableCount + CENTRALITY_BONUS * centrality;
            out.add(new Score(id, Math.max(0, Math.min(1, s)), evidence, contradictionCount, vulnerableCount));
        }
        return out;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Score(String propositionId, double score, int evidencePaths, int contradictionCount,
                        int vulnerableAssumptions) {
    }
}
