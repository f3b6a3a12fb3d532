package com.db.vf2pp.matching;

import org.jgrapht.Graph;

import java.util.*;
import java.util.function.Function;

/**
 * Read-only, int-indexed snapshot of a graph and its node labels, taken once before a search.
 * Node {@code i} is the i-th vertex of {@code vertexSet()} iteration order.
 *
 * @param <V> the graph vertex type
 */
public final class GraphIndex<V> {
    private static final Object UNLABELED = new Object();
    private static final int[] NO_NODES = new int[0];

    private final List<V> vertices;
    private final Map<V, Integer> indexOf;
    private final boolean directed;
    private final int[] labelOf;
    private final int labelCount;
    private final int[][] nodesByLabel;
    private final int[] degree;
    private final int[] inDegree;
    private final int[] outDegree;
    private final int[][] neighbors;
    private final int[][] successors;
    private final int[][] predecessors;
    // outgoing edge label bags: bags.get(u).get(v) counts the u->v edges per edge label
    private final List<Map<Integer, Map<Object, Integer>>> bags;

    private GraphIndex(List<V> vertices, Map<V, Integer> indexOf, boolean directed, int[] labelOf, int labelCount,
                       int[] degree, int[] inDegree, int[] outDegree, List<Map<Integer, Map<Object, Integer>>> bags) {
        this.vertices = vertices;
        this.indexOf = indexOf;
        this.directed = directed;
        this.labelOf = labelOf;
        this.labelCount = labelCount;
        this.nodesByLabel = LabelGroups.groupByLabelId(labelOf, labelCount);
        this.degree = degree;
        this.inDegree = inDegree;
        this.outDegree = outDegree;
        this.bags = bags;

        int n = vertices.size();
        this.successors = new int[n][];
        this.predecessors = new int[n][];
        this.neighbors = new int[n][];
        List<SortedSet<Integer>> incoming = new ArrayList<>(n);
        for (int u = 0; u < n; u++) {
            incoming.add(new TreeSet<>());
        }
        for (int u = 0; u < n; u++) {
            SortedSet<Integer> out = new TreeSet<>(bags.get(u).keySet());
            out.remove(u);
            successors[u] = toArray(out);
            for (int v : successors[u]) {
                incoming.get(v).add(u);
            }
        }
        for (int u = 0; u < n; u++) {
            if (directed) {
                predecessors[u] = toArray(incoming.get(u));
                SortedSet<Integer> both = new TreeSet<>(incoming.get(u));
                for (int v : successors[u]) {
                    both.add(v);
                }
                neighbors[u] = toArray(both);
            } else {
                predecessors[u] = successors[u];
                neighbors[u] = successors[u];
            }
        }
    }

    /**
     * Indexes {@code graph}. {@code labelIds} is the label dictionary shared by both graphs of a query;
     * unseen labels are appended to it.
     *
     * @throws IllegalArgumentException if a vertex has no label
     */
    public static <V, E, L> GraphIndex<V> of(Graph<V, E> graph, Map<V, L> labels, Map<L, Integer> labelIds,
                                             Function<? super E, ?> edgeLabeler) {
        Set<V> vertexSet = graph.vertexSet();
        int n = vertexSet.size();
        boolean directed = graph.getType().isDirected();

        List<V> vertices = new ArrayList<>(n);
        Map<V, Integer> indexOf = new HashMap<>();
        int[] labelOf = new int[n];
        int[] degree = new int[n];
        int[] inDegree = new int[n];
        int[] outDegree = new int[n];

        for (V vertex : vertexSet) {
            L label = labels.get(vertex);
            if (label == null) {
                throw new IllegalArgumentException("No label given for vertex " + vertex);
            }
            int index = vertices.size();
            vertices.add(vertex);
            indexOf.put(vertex, index);
            labelOf[index] = labelIds.computeIfAbsent(label, k -> labelIds.size());
            degree[index] = graph.degreeOf(vertex);
            if (directed) {
                inDegree[index] = graph.inDegreeOf(vertex);
                outDegree[index] = graph.outDegreeOf(vertex);
            } else {
                inDegree[index] = degree[index];
                outDegree[index] = degree[index];
            }
        }

        List<Map<Integer, Map<Object, Integer>>> bags = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            bags.add(new HashMap<>());
        }
        for (E edge : graph.edgeSet()) {
            int source = indexOf.get(graph.getEdgeSource(edge));
            int target = indexOf.get(graph.getEdgeTarget(edge));
            Object edgeLabel = edgeLabeler == null ? UNLABELED : edgeLabeler.apply(edge);
            if (edgeLabel == null) {
                edgeLabel = UNLABELED;
            }
            addToBag(bags, source, target, edgeLabel);
            if (!directed && source != target) {
                addToBag(bags, target, source, edgeLabel);
            }
        }

        return new GraphIndex<>(Collections.unmodifiableList(vertices), indexOf, directed, labelOf,
                labelIds.size(), degree, inDegree, outDegree, bags);
    }

    private static void addToBag(List<Map<Integer, Map<Object, Integer>>> bags, int source, int target, Object label) {
        bags.get(source).computeIfAbsent(target, k -> new HashMap<>()).merge(label, 1, Integer::sum);
    }

    private static int[] toArray(Collection<Integer> values) {
        if (values.isEmpty()) {
            return NO_NODES;
        }
        int[] result = new int[values.size()];
        int i = 0;
        for (int value : values) {
            result[i++] = value;
        }
        return result;
    }

    public int size() {
        return vertices.size();
    }

    public boolean isDirected() {
        return directed;
    }

    public V vertex(int node) {
        return vertices.get(node);
    }

    public List<V> vertices() {
        return vertices;
    }

    public int indexOf(V vertex) {
        Integer index = indexOf.get(vertex);
        if (index == null) {
            throw new IllegalArgumentException("Vertex " + vertex + " is not part of the graph");
        }
        return index;
    }

    public int label(int node) {
        return labelOf[node];
    }

    /**
     * Number of distinct labels across both graphs of the query this index belongs to,
     * as seen when this index was built.
     */
    public int labelCount() {
        return labelCount;
    }

    public int[] nodesWithLabel(int label) {
        return label < nodesByLabel.length ? nodesByLabel[label] : NO_NODES;
    }

    public int degree(int node) {
        return degree[node];
    }

    public int inDegree(int node) {
        return inDegree[node];
    }

    public int outDegree(int node) {
        return outDegree[node];
    }

    /**
     * Distinct adjacent nodes in either direction, self excluded, ascending.
     */
    public int[] neighbors(int node) {
        return neighbors[node];
    }

    public int[] successors(int node) {
        return successors[node];
    }

    public int[] predecessors(int node) {
        return predecessors[node];
    }

    public boolean isAdjacent(int u, int v) {
        return bags.get(u).containsKey(v) || (directed && bags.get(v).containsKey(u));
    }

    /**
     * Edges from {@code u} to {@code v} counted per edge label; empty when there are none.
     * For undirected graphs the bag is symmetric.
     */
    public Map<Object, Integer> edgeBag(int u, int v) {
        Map<Object, Integer> bag = bags.get(u).get(v);
        return bag == null ? Collections.emptyMap() : bag;
    }

    public int multiplicity(int u, int v) {
        int total = 0;
        for (int count : edgeBag(u, v).values()) {
            total += count;
        }
        return total;
    }
}
