package com.db.vf2pp.matching;

import org.jgrapht.Graph;
import org.jgrapht.GraphMapping;

import java.util.Collections;
import java.util.Map;

/**
 * A mapping found by {@link VF2ppIsomorphismInspector}, from the first graph into the second.
 * For multigraphs the edge correspondence picks one of the parallel edges.
 */
public class VF2ppGraphMapping<V, E> implements GraphMapping<V, E> {
    private final Graph<V, E> graph1;
    private final Graph<V, E> graph2;
    private final Map<V, V> forwardMapping;
    private final Map<V, V> backwardMapping;

    public VF2ppGraphMapping(Graph<V, E> graph1, Graph<V, E> graph2, Map<V, V> forwardMapping, Map<V, V> backwardMapping) {
        this.graph1 = graph1;
        this.graph2 = graph2;
        this.forwardMapping = Collections.unmodifiableMap(forwardMapping);
        this.backwardMapping = Collections.unmodifiableMap(backwardMapping);
    }

    @Override
    public V getVertexCorrespondence(V vertex, boolean forward) {
        return forward ? forwardMapping.get(vertex) : backwardMapping.get(vertex);
    }

    @Override
    public E getEdgeCorrespondence(E edge, boolean forward) {
        Graph<V, E> from = forward ? graph1 : graph2;
        Graph<V, E> to = forward ? graph2 : graph1;
        V source = getVertexCorrespondence(from.getEdgeSource(edge), forward);
        V target = getVertexCorrespondence(from.getEdgeTarget(edge), forward);
        if (source == null || target == null) {
            return null;
        }
        return to.getEdge(source, target);
    }

    public Map<V, V> getForwardMapping() {
        return forwardMapping;
    }

    public Map<V, V> getBackwardMapping() {
        return backwardMapping;
    }

    @Override
    public String toString() {
        return "VF2ppGraphMapping{" + forwardMapping + '}';
    }
}
