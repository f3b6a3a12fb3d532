package com.db.vf2pp.matching;

import org.jgrapht.Graph;
import org.jgrapht.GraphMapping;
import org.jgrapht.alg.isomorphism.IsomorphismInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * VF2++ matcher for labelled graphs.
 * <p>
 * Maps every vertex of {@code graph1} into {@code graph2} according to the {@link MatchMode}. Vertex labels
 * are compared with {@code equals}; edge labels, when an edge labeler is given, must match between mapped
 * vertex pairs. Each call to {@link #getMappings()} starts an independent lazy search, so one inspector may
 * be used from several threads as long as each thread drives its own iterator.
 * <p>
 * Two empty graphs are not considered isomorphic; an empty first graph never yields a mapping.
 *
 * @param <V> the graph vertex type
 * @param <E> the graph edge type
 * @param <L> the vertex label type
 */
public class VF2ppIsomorphismInspector<V, E, L> implements IsomorphismInspector<V, E> {
    private static final Logger logger = LoggerFactory.getLogger(VF2ppIsomorphismInspector.class);

    private final Graph<V, E> graph1;
    private final Graph<V, E> graph2;
    private final MatchMode mode;
    private final GraphIndex<V> index1;
    private final GraphIndex<V> index2;
    private final int labelCount;

    public VF2ppIsomorphismInspector(Graph<V, E> graph1, Graph<V, E> graph2, Map<V, L> labels1, Map<V, L> labels2) {
        this(graph1, graph2, labels1, labels2, null, MatchMode.ISOMORPHISM);
    }

    /**
     * @param edgeLabeler label of an edge, or {@code null} to compare edge multiplicities only
     * @throws IllegalArgumentException if a vertex has no label or only one of the graphs is directed
     */
    public VF2ppIsomorphismInspector(Graph<V, E> graph1, Graph<V, E> graph2, Map<V, L> labels1, Map<V, L> labels2,
                                     Function<? super E, ?> edgeLabeler, MatchMode mode) {
        this.graph1 = Objects.requireNonNull(graph1, "graph1");
        this.graph2 = Objects.requireNonNull(graph2, "graph2");
        this.mode = Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(labels1, "labels1");
        Objects.requireNonNull(labels2, "labels2");
        if (graph1.getType().isDirected() != graph2.getType().isDirected()) {
            throw new IllegalArgumentException("Cannot match a directed graph against an undirected one");
        }

        Map<L, Integer> labelIds = new HashMap<>();
        this.index1 = GraphIndex.of(graph1, labels1, labelIds, edgeLabeler);
        this.index2 = GraphIndex.of(graph2, labels2, labelIds, edgeLabeler);
        this.labelCount = labelIds.size();
    }

    /**
     * Cheap necessary condition: {@code false} guarantees that no mapping exists.
     */
    public boolean precheck() {
        return Precheck.passes(index1, index2, mode);
    }

    @Override
    public VF2ppMappingIterator getMappings() {
        if (index1.size() == 0) {
            return new VF2ppMappingIterator(null);
        }
        if (!precheck()) {
            logger.debug("Pre-check rejected {} of {} into {} nodes", mode, index1.size(), index2.size());
            return new VF2ppMappingIterator(null);
        }
        return new VF2ppMappingIterator(new VF2ppSearch(index1, index2, mode, labelCount));
    }

    @Override
    public boolean isomorphismExists() {
        VF2ppMappingIterator mappings = getMappings();
        boolean exists = mappings.hasNext();
        mappings.halt();
        return exists;
    }

    /**
     * The first mapping found, or empty when there is none.
     */
    public Optional<VF2ppGraphMapping<V, E>> findMapping() {
        VF2ppMappingIterator mappings = getMappings();
        if (!mappings.hasNext()) {
            return Optional.empty();
        }
        VF2ppGraphMapping<V, E> mapping = mappings.next();
        mappings.halt();
        return Optional.of(mapping);
    }

    public MatchMode getMode() {
        return mode;
    }

    private VF2ppGraphMapping<V, E> toGraphMapping(int[] forward) {
        Map<V, V> forwardMapping = new LinkedHashMap<>();
        Map<V, V> backwardMapping = new LinkedHashMap<>();
        for (int n = 0; n < forward.length; n++) {
            V vertex1 = index1.vertex(n);
            V vertex2 = index2.vertex(forward[n]);
            forwardMapping.put(vertex1, vertex2);
            backwardMapping.put(vertex2, vertex1);
        }
        return new VF2ppGraphMapping<>(graph1, graph2, forwardMapping, backwardMapping);
    }

    /**
     * Lazy sequence of the mappings of one search. Stopping early needs no cleanup; {@link #halt()} only
     * releases the search stack sooner.
     */
    public class VF2ppMappingIterator implements Iterator<GraphMapping<V, E>> {
        private final VF2ppSearch search;

        private VF2ppMappingIterator(VF2ppSearch search) {
            this.search = search;
        }

        @Override
        public boolean hasNext() {
            return search != null && search.hasNext();
        }

        @Override
        public VF2ppGraphMapping<V, E> next() {
            if (search == null) {
                throw new NoSuchElementException("No mapping exists");
            }
            return toGraphMapping(search.next());
        }

        public void halt() {
            if (search != null) {
                search.halt();
            }
        }

        public SearchStatus getStatus() {
            return search == null ? SearchStatus.EXHAUSTED : search.getStatus();
        }
    }
}
