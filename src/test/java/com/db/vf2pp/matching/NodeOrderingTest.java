package com.db.vf2pp.matching;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import static com.db.vf2pp.matching.TestGraphs.*;
import static org.assertj.core.api.Assertions.assertThat;

class NodeOrderingTest {

    @Test
    void hubFirstThenSmallerComponent() {
        Graph<Integer, DefaultEdge> graph = undirected(6, new int[][]{{0, 1}, {0, 2}, {0, 3}, {4, 5}});
        GraphIndex<Integer> index = GraphIndex.of(graph, uniformLabels(graph), new HashMap<>(), null);

        assertThat(NodeOrdering.matchingOrder(index, new int[]{6})).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void rarerLabelBreaksTies() {
        Graph<Integer, DefaultEdge> graph = undirected(3, new int[][]{{0, 1}, {1, 2}});
        Map<String, Integer> labelIds = new HashMap<>();
        GraphIndex<Integer> index = GraphIndex.of(graph, labels(graph, "common", "common", "rare"), labelIds, null);
        int[] rarity = new int[labelIds.size()];
        rarity[labelIds.get("common")] = 5;
        rarity[labelIds.get("rare")] = 1;

        assertThat(NodeOrdering.matchingOrder(index, rarity)).containsExactly(1, 2, 0);
    }

    @Test
    void largerComponentComesFirst() {
        Graph<Integer, DefaultEdge> graph = undirected(5, new int[][]{{0, 1}, {2, 3}, {3, 4}});
        GraphIndex<Integer> index = GraphIndex.of(graph, uniformLabels(graph), new HashMap<>(), null);

        assertThat(NodeOrdering.componentsLargestFirst(index)).hasSize(2);
        assertThat(NodeOrdering.componentsLargestFirst(index).get(0)).containsExactlyInAnyOrder(2, 3, 4);
        assertThat(NodeOrdering.matchingOrder(index, new int[]{5})).containsExactly(3, 2, 4, 0, 1);
    }

    @Test
    void directedEdgesConnectComponents() {
        Graph<Integer, DefaultEdge> graph = directed(4, new int[][]{{1, 0}, {2, 1}, {3, 3}});
        GraphIndex<Integer> index = GraphIndex.of(graph, uniformLabels(graph), new HashMap<>(), null);

        assertThat(NodeOrdering.componentsLargestFirst(index).get(0)).containsExactlyInAnyOrder(0, 1, 2);
        assertThat(NodeOrdering.matchingOrder(index, new int[]{4})[0]).isEqualTo(1);
    }

    @Test
    void everyNodeAppearsExactlyOnce() {
        Random random = new Random(1);
        for (int round = 0; round < 20; round++) {
            int n = 1 + random.nextInt(40);
            Graph<Integer, DefaultEdge> graph = undirected(n, randomEdges(random, n, 0.1, false, true));
            Map<Integer, String> labels = new HashMap<>();
            for (int v = 0; v < n; v++) {
                labels.put(v, "l" + random.nextInt(3));
            }
            Map<String, Integer> labelIds = new HashMap<>();
            GraphIndex<Integer> index = GraphIndex.of(graph, labels, labelIds, null);

            int[] order = NodeOrdering.matchingOrder(index, new int[labelIds.size()]);

            int[] sorted = order.clone();
            Arrays.sort(sorted);
            int[] expected = new int[n];
            Arrays.setAll(expected, i -> i);
            assertThat(sorted).isEqualTo(expected);
        }
    }
}
