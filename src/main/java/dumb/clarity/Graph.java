package dumb.clarity;

import java.util.*;
import java.util.function.Predicate;

/**
 * Directed multigraph over the propositions of a {@link Batch}. Nodes are request positions; parallel edges and
 * self-loops are kept as given.
 */
public final class Graph {

    public final Batch batch;
    private final List<Edge> edges;
    private final List<List<Edge>> out;
    private final List<List<Edge>> in;

    public Graph(Batch batch) {
        this.batch = batch;
        var n = batch.size();
        this.out = new ArrayList<>(n);
        this.in = new ArrayList<>(n);
        for (var i = 0; i < n; i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        var all = new ArrayList<Edge>(batch.relationships.size());
        for (var r : batch.relationships) {
            var e = new Edge(batch.indexOf(r.fromId()), batch.indexOf(r.toId()), r);
            all.add(e);
            out.get(e.from).add(e);
            in.get(e.to).add(e);
        }
        this.edges = List.copyOf(all);
    }

    public int size() {
        return batch.size();
    }

    public List<Edge> edges() {
        return edges;
    }

    public Proposition node(int i) {
        return batch.propositions.get(i);
    }

    public String id(int i) {
        return node(i).id();
    }

    public List<Edge> incoming(int v) {
        return Collections.unmodifiableList(in.get(v));
    }

    public List<Edge> outgoing(int v) {
        return Collections.unmodifiableList(out.get(v));
    }

    // Distinct successors over edges of the accepted kinds, self-loops excluded, in ascending node order.
    public int[] successors(int v, Predicate<Relationship.Kind> kinds) {
        return out.get(v).stream().filter(e -> kinds.test(e.kind()) && e.to != v).mapToInt(Edge::to).distinct().sorted().toArray();
    }

    public int[] predecessors(int v, Predicate<Relationship.Kind> kinds) {
        return in.get(v).stream().filter(e -> kinds.test(e.kind()) && e.from != v).mapToInt(Edge::from).distinct().sorted().toArray();
    }

    public int[][] undirected() {
        var n = size();
        var adj = new ArrayList<List<Integer>>(n);
        for (var i = 0; i < n; i++) adj.add(new ArrayList<>());
        for (var e : edges) {
            if (e.from == e.to) continue;
            adj.get(e.from).add(e.to);
            adj.get(e.to).add(e.from);
        }
        var result = new int[n][];
        for (var i = 0; i < n; i++) result[i] = adj.get(i).stream().mapToInt(Integer::intValue).sorted().toArray();
        return result;
    }

    /**
     * Kahn's algorithm over dependency edges, ready nodes taken in request order. Nodes left over because they lie
     * on or behind a cycle are appended in request order and the order is marked incomplete.
     */
    public Order dependencyOrder() {
        var n = size();
        var indegree = new int[n];
        for (var e : edges)
            if (e.kind().isDependency() && e.from != e.to) indegree[e.to]++;
        var ready = new PriorityQueue<Integer>();
        for (var i = 0; i < n; i++)
            if (indegree[i] == 0) ready.add(i);
        var order = new ArrayList<String>(n);
        var placed = new boolean[n];
        while (!ready.isEmpty()) {
            var v = ready.poll();
            placed[v] = true;
            order.add(id(v));
            for (var e : out.get(v))
                if (e.kind().isDependency() && e.to != v && --indegree[e.to] == 0) ready.add(e.to);
        }
        var complete = order.size() == n;
        for (var i = 0; i < n; i++)
            if (!placed[i]) order.add(id(i));
        return new Order(order, complete);
    }

    public record Edge(int from, int to, Relationship relationship) {
        public Relationship.Kind kind() {
            return relationship.kind();
        }
    }

    public record Order(List<String> ids, boolean complete) {
        public Order {
            ids = List.copyOf(ids);
        }
    }
}
