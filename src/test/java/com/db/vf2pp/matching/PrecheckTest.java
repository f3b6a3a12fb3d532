package com.db.vf2pp.matching;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.db.vf2pp.matching.TestGraphs.*;
import static org.assertj.core.api.Assertions.assertThat;

class PrecheckTest {

    @Test
    void embeddingsNeedDominatedDegreesAndLabels() {
        Graph<Integer, DefaultEdge> path = undirected(3, new int[][]{{0, 1}, {1, 2}});
        Graph<Integer, DefaultEdge> star = undirected(4, new int[][]{{0, 1}, {0, 2}, {0, 3}});
        Map<String, Integer> labelIds = new HashMap<>();
        GraphIndex<Integer> g1 = GraphIndex.of(path, uniformLabels(path), labelIds, null);
        GraphIndex<Integer> g2 = GraphIndex.of(star, uniformLabels(star), labelIds, null);

        assertThat(Precheck.passes(g1, g2, MatchMode.MONOMORPHISM)).isTrue();
        assertThat(Precheck.passes(g1, g2, MatchMode.INDUCED_SUBGRAPH)).isTrue();
        assertThat(Precheck.passes(g1, g2, MatchMode.ISOMORPHISM)).isFalse();
        assertThat(Precheck.passes(g2, g1, MatchMode.MONOMORPHISM)).isFalse();
    }

    @Test
    void repeatedPrecheckGivesTheSameAnswer() {
        Graph<Integer, DefaultEdge> path = undirected(4, new int[][]{{0, 1}, {1, 2}, {2, 3}});
        Graph<Integer, DefaultEdge> star = undirected(4, new int[][]{{0, 1}, {0, 2}, {0, 3}});
        VF2ppIsomorphismInspector<Integer, DefaultEdge, String> rejected =
                new VF2ppIsomorphismInspector<>(path, star, uniformLabels(path), uniformLabels(star));
        VF2ppIsomorphismInspector<Integer, DefaultEdge, String> accepted =
                new VF2ppIsomorphismInspector<>(path, path, uniformLabels(path), uniformLabels(path));

        assertThat(rejected.precheck()).isFalse();
        assertThat(rejected.precheck()).isEqualTo(rejected.precheck());
        assertThat(accepted.precheck()).isTrue();
        accepted.isomorphismExists();
        assertThat(accepted.precheck()).isTrue();
    }

    @Test
    void directedGraphsCompareInAndOutDegrees() {
        Graph<Integer, DefaultEdge> fanOut = directed(3, new int[][]{{0, 1}, {0, 2}});
        Graph<Integer, DefaultEdge> fanIn = directed(3, new int[][]{{1, 0}, {2, 0}});
        Map<String, Integer> labelIds = new HashMap<>();
        GraphIndex<Integer> g1 = GraphIndex.of(fanOut, uniformLabels(fanOut), labelIds, null);
        GraphIndex<Integer> g2 = GraphIndex.of(fanIn, uniformLabels(fanIn), labelIds, null);

        assertThat(Precheck.passes(g1, g2, MatchMode.ISOMORPHISM)).isFalse();
        assertThat(Precheck.passes(g1, g1, MatchMode.ISOMORPHISM)).isTrue();
    }

    @Test
    void labelCountsMustFit() {
        Graph<Integer, DefaultEdge> pair = undirected(2, new int[][]{{0, 1}});
        Graph<Integer, DefaultEdge> triangle = undirected(3, new int[][]{{0, 1}, {1, 2}, {2, 0}});
        Map<String, Integer> labelIds = new HashMap<>();
        GraphIndex<Integer> g1 = GraphIndex.of(pair, labels(pair, "a", "a"), labelIds, null);
        GraphIndex<Integer> g2 = GraphIndex.of(triangle, labels(triangle, "a", "b", "b"), labelIds, null);

        assertThat(Precheck.passes(g1, g2, MatchMode.MONOMORPHISM)).isFalse();
        assertThat(Precheck.passes(g1, g1, MatchMode.ISOMORPHISM)).isTrue();
    }
}
