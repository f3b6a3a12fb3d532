package com.db.vf2pp.matching;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.db.vf2pp.matching.TestGraphs.*;
import static org.assertj.core.api.Assertions.assertThat;

class FeasibilityCheckerTest {

    private static GraphIndex<Integer> index(Graph<Integer, DefaultEdge> graph) {
        return GraphIndex.of(graph, uniformLabels(graph), new HashMap<>(), null);
    }

    private static FeasibilityChecker checker(GraphIndex<Integer> g1, GraphIndex<Integer> g2, MatchingState state, MatchMode mode) {
        return new FeasibilityChecker(g1, g2, state, mode, 1);
    }

    @Test
    void mappedNeighboursMustStayAdjacent() {
        GraphIndex<Integer> cycle = index(undirected(4, new int[][]{{0, 1}, {1, 2}, {2, 3}, {3, 0}}));
        MatchingState state = new MatchingState(cycle, cycle);
        state.commit(0, 0);
        state.commit(1, 1);
        FeasibilityChecker checker = checker(cycle, cycle, state, MatchMode.ISOMORPHISM);

        assertThat(checker.isFeasible(2, 2)).isTrue();
        assertThat(checker.isFeasible(3, 2)).isFalse();
        assertThat(checker.isFeasible(2, 3)).isFalse();
    }

    @Test
    void frontierCutsDependOnMode() {
        int[][] edges = {{0, 1}, {0, 2}, {3, 4}};
        GraphIndex<Integer> g1 = index(undirected(5, edges));
        GraphIndex<Integer> g2 = index(undirected(5, edges));
        MatchingState state = new MatchingState(g1, g2);
        state.commit(1, 1);

        // 3 has a remainder neighbour, 2 in the second graph has a frontier one
        assertThat(checker(g1, g2, state, MatchMode.ISOMORPHISM).isFeasible(3, 2)).isFalse();
        assertThat(checker(g1, g2, state, MatchMode.INDUCED_SUBGRAPH).isFeasible(3, 2)).isFalse();
        assertThat(checker(g1, g2, state, MatchMode.MONOMORPHISM).isFeasible(3, 2)).isTrue();

        FeasibilityChecker checker = checker(g1, g2, state, MatchMode.ISOMORPHISM);
        assertThat(checker.isFeasible(3, 3)).isTrue();
        assertThat(checker.isFeasible(2, 2)).isTrue();
        // scratch state is reset between calls
        assertThat(checker.isFeasible(3, 2)).isFalse();
        assertThat(checker.isFeasible(3, 3)).isTrue();
    }

    @Test
    void labelsAndDegreesAreCheckedFirst() {
        Graph<Integer, DefaultEdge> path = undirected(3, new int[][]{{0, 1}, {1, 2}});
        Map<String, Integer> labelIds = new HashMap<>();
        GraphIndex<Integer> g1 = GraphIndex.of(path, labels(path, "a", "a", "b"), labelIds, null);
        GraphIndex<Integer> g2 = GraphIndex.of(path, labels(path, "b", "a", "a"), labelIds, null);
        MatchingState state = new MatchingState(g1, g2);

        FeasibilityChecker exact = new FeasibilityChecker(g1, g2, state, MatchMode.ISOMORPHISM, labelIds.size());
        FeasibilityChecker embedding = new FeasibilityChecker(g1, g2, state, MatchMode.MONOMORPHISM, labelIds.size());

        assertThat(exact.isFeasible(2, 1)).isFalse();
        assertThat(exact.isFeasible(0, 1)).isFalse();
        assertThat(embedding.isFeasible(0, 1)).isTrue();
        assertThat(exact.isFeasible(0, 2)).isTrue();
        assertThat(FeasibilityChecker.degreeCompatible(g1, g2, MatchMode.INDUCED_SUBGRAPH, 1, 2)).isFalse();
    }

    @Test
    void directedEdgesMustKeepTheirDirection() {
        GraphIndex<Integer> g1 = index(directed(3, new int[][]{{0, 1}, {2, 1}}));
        GraphIndex<Integer> g2 = index(directed(3, new int[][]{{0, 1}, {1, 2}}));
        MatchingState state = new MatchingState(g1, g2);
        state.commit(1, 1);

        FeasibilityChecker checker = checker(g1, g2, state, MatchMode.MONOMORPHISM);

        assertThat(checker.isFeasible(0, 0)).isTrue();
        assertThat(checker.isFeasible(2, 2)).isFalse();
    }

    @Test
    void selfLoopsAndParallelEdgesAreCounted() {
        GraphIndex<Integer> single = index(undirected(2, new int[][]{{0, 1}, {1, 1}}));
        GraphIndex<Integer> doubled = index(undirected(2, new int[][]{{0, 1}, {0, 1}, {1, 1}, {1, 1}}));
        MatchingState state = new MatchingState(single, doubled);

        assertThat(checker(single, doubled, state, MatchMode.MONOMORPHISM).isFeasible(1, 1)).isTrue();
        assertThat(checker(single, doubled, state, MatchMode.INDUCED_SUBGRAPH).isFeasible(1, 1)).isFalse();

        state.commit(1, 1);
        assertThat(checker(single, doubled, state, MatchMode.MONOMORPHISM).isFeasible(0, 0)).isTrue();
    }
}
