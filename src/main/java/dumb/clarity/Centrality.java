package dumb.clarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Betweenness centrality (Brandes) over all relationship edges taken as undirected, counting parallel edges as
 * distinct paths, normalized to [0, 1] by {@code (n-1)(n-2)}.
 */
public final class Centrality {

    private final Graph graph;
    private final int[][] adj;
    private final int[][] dist;
    private final double[] score;

    public Centrality(Graph graph, Budget budget) {
        this.graph = graph;
        this.adj = graph.undirected();
        var n = graph.size();
        this.dist = new int[n][];
        this.score = new double[n];
        var raw = new double[n];
        budget.check();
        for (var s = 0; s < n; s++) accumulate(s, raw, budget);
        var norm = n > 2 ? (double) (n - 1) * (n - 2) : 1;
        for (var v = 0; v < n; v++) score[v] = Math.min(1, raw[v] / norm);
    }

    private void accumulate(int s, double[] raw, Budget budget) {
        var n = adj.length;
        var sigma = new double[n];
        var d = new int[n];
        Arrays.fill(d, -1);
        var preds = new ArrayList<List<Integer>>(n);
        for (var i = 0; i < n; i++) preds.add(new ArrayList<>());
        var order = new int[n];
        var visited = 0;
        sigma[s] = 1;
        d[s] = 0;
        var queue = new ArrayDeque<Integer>();
        queue.add(s);
        while (!queue.isEmpty()) {
            budget.tick();
            int v = queue.poll();
            order[visited++] = v;
            for (var w : adj[v]) {
                if (d[w] < 0) {
                    d[w] = d[v] + 1;
                    queue.add(w);
                }
                if (d[w] == d[v] + 1) {
                    sigma[w] += sigma[v];
                    preds.get(w).add(v);
                }
            }
        }
        var delta = new double[n];
        for (var i = visited - 1; i > 0; i--) {
            var w = order[i];
            for (var v : preds.get(w)) delta[v] += sigma[v] / sigma[w] * (1 + delta[w]);
            raw[w] += delta[w];
        }
        dist[s] = d;
    }

    public double score(int v) {
        return score[v];
    }

    public double score(String id) {
        return score[graph.batch.indexOf(id)];
    }

    // Nodes with a shortest path to some other node that runs through v, in request order.
    public List<String> dependents(int v) {
        var n = adj.length;
        var through = new boolean[n];
        for (var s = 0; s < n; s++) {
            if (s == v || dist[s][v] < 0) continue;
            for (var t = 0; t < n; t++) {
                if (t == v || t == s || dist[v][t] < 0) continue;
                if (dist[s][v] + dist[v][t] == dist[s][t]) {
                    through[s] = true;
                    through[t] = true;
                }
            }
        }
        var out = new ArrayList<String>();
        for (var i = 0; i < n; i++)
            if (through[i]) out.add(graph.id(i));
        return out;
    }
}
