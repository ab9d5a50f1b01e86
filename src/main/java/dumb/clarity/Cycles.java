package dumb.clarity;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates simple cycles of length 2 to {@code maxLength} over justification edges (supports, depends_on).
 * <p>
 * Each cycle is rooted at its lowest request position: the search from root {@code s} only visits higher
 * positions inside the strongly connected component of {@code s}, so every cycle is produced exactly once and in
 * edge direction. Parallel edges collapse; self-loops are not cycles.
 */
public final class Cycles {

    private final Graph graph;
    private final int maxLength;
    private final int maxCycles;
    private final Budget budget;
    private final int[][] succ;
    private final List<List<String>> found = new ArrayList<>();
    private int[] component;
    private boolean truncated;

    public Cycles(Graph graph, int maxLength, int maxCycles, Budget budget) {
        this.graph = graph;
        this.maxLength = maxLength;
        this.maxCycles = maxCycles <= 0 ? Integer.MAX_VALUE : maxCycles;
        this.budget = budget;
        var n = graph.size();
        this.succ = new int[n][];
        for (var v = 0; v < n; v++) succ[v] = graph.successors(v, Relationship.Kind::isJustification);
    }

    public Result enumerate() {
        component = components();
        var n = graph.size();
        var onPath = new boolean[n];
        var path = new int[maxLength];
        String stopped = null;
        try {
            budget.check();
            for (var s = 0; s < n && !truncated; s++) {
                onPath[s] = true;
                path[0] = s;
                search(s, s, 1, path, onPath);
                onPath[s] = false;
            }
            if (truncated) stopped = "cycle limit of " + maxCycles + " reached";
        } catch (Budget.Exhausted e) {
            truncated = true;
            stopped = e.getMessage();
            return new Result(found, true, e.cancelled, stopped);
        }
        return new Result(found, truncated, false, stopped);
    }

    private void search(int root, int v, int length, int[] path, boolean[] onPath) {
        budget.tick();
        for (var w : succ[v]) {
            if (truncated) return;
            if (w == root) {
                if (length >= 2) record(path, length);
            } else if (w > root && !onPath[w] && component[w] == component[root] && length < maxLength) {
                onPath[w] = true;
                path[length] = w;
                search(root, w, length + 1, path, onPath);
                onPath[w] = false;
            }
        }
    }

    private void record(int[] path, int length) {
        var cycle = new ArrayList<String>(length + 1);
        for (var i = 0; i < length; i++) cycle.add(graph.id(path[i]));
        cycle.add(graph.id(path[0]));
        found.add(List.copyOf(cycle));
        if (found.size() >= maxCycles) truncated = true;
    }

    private int[] components() {
        var n = graph.size();
        var index = new int[n];
        var low = new int[n];
        var comp = new int[n];
        var onStack = new boolean[n];
        var stack = new int[n];
        var sp = 0;
        var counter = 1;
        var comps = 0;
        var callStack = new int[n];
        var edgePos = new int[n];
        for (var start = 0; start < n; start++) {
            if (index[start] != 0) continue;
            var csp = 0;
            callStack[csp++] = start;
            index[start] = low[start] = counter++;
            stack[sp++] = start;
            onStack[start] = true;
            while (csp > 0) {
                var v = callStack[csp - 1];
                if (edgePos[v] < succ[v].length) {
                    var w = succ[v][edgePos[v]++];
                    if (index[w] == 0) {
                        index[w] = low[w] = counter++;
                        stack[sp++] = w;
                        onStack[w] = true;
                        callStack[csp++] = w;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                } else {
                    csp--;
                    if (low[v] == index[v]) {
                        int w;
                        do {
                            w = stack[--sp];
                            onStack[w] = false;
                            comp[w] = comps;
                        } while (w != v);
                        comps++;
                    }
                    if (csp > 0) {
                        var parent = callStack[csp - 1];
                        low[parent] = Math.min(low[parent], low[v]);
                    }
                }
            }
        }
        return comp;
    }

    public record Result(List<List<String>> cycles, boolean truncated, boolean cancelled, String reason) {
        public Result {
            cycles = List.copyOf(cycles);
        }
    }
}
