package com.db.vf2pp.matching;

import java.util.*;

/**
 * Computes the order in which the nodes of the first graph are matched.
 * <p>
 * Connected components are visited largest first. Inside a component the next node is the unordered one with,
 * in priority: the most already ordered neighbours, the highest degree, the rarest label, the lowest index.
 * The first node of a component therefore is its highest degree node, and every later node touches an
 * earlier one.
 */
public final class NodeOrdering {

    private NodeOrdering() {
    }

    /**
     * @param g1          the graph whose nodes are ordered
     * @param labelRarity per label id, how many nodes carry it in the second graph; lower is rarer
     * @return every node of {@code g1} exactly once
     */
    public static int[] matchingOrder(GraphIndex<?> g1, int[] labelRarity) {
        int n = g1.size();
        int[] order = new int[n];
        int[] orderedNeighbors = new int[n];
        boolean[] ordered = new boolean[n];

        Comparator<Integer> priority = Comparator
                .<Integer>comparingInt(node -> -orderedNeighbors[node])
                .thenComparingInt(node -> -g1.degree(node))
                .thenComparingInt(node -> rarity(labelRarity, g1.label(node)))
                .thenComparingInt(node -> node);

        int position = 0;
        for (int[] component : componentsLargestFirst(g1)) {
            Integer root = null;
            for (int node : component) {
                if (root == null || priority.compare(node, root) < 0) {
                    root = node;
                }
            }

            // orderedNeighbors only changes for queued nodes after they are removed from the queue
            TreeSet<Integer> queue = new TreeSet<>(priority);
            queue.add(root);
            while (!queue.isEmpty()) {
                int next = queue.pollFirst();
                ordered[next] = true;
                order[position++] = next;
                for (int neighbor : g1.neighbors(next)) {
                    if (ordered[neighbor]) {
                        continue;
                    }
                    queue.remove(neighbor);
                    orderedNeighbors[neighbor]++;
                    queue.add(neighbor);
                }
            }
        }
        return order;
    }

    private static int rarity(int[] labelRarity, int label) {
        return label < labelRarity.length ? labelRarity[label] : 0;
    }

    /**
     * Components (direction ignored) sorted by size descending, then by lowest member index.
     */
    static List<int[]> componentsLargestFirst(GraphIndex<?> graph) {
        int n = graph.size();
        boolean[] seen = new boolean[n];
        List<int[]> components = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int start = 0; start < n; start++) {
            if (seen[start]) {
                continue;
            }
            List<Integer> members = new ArrayList<>();
            seen[start] = true;
            stack.push(start);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                members.add(node);
                for (int neighbor : graph.neighbors(node)) {
                    if (!seen[neighbor]) {
                        seen[neighbor] = true;
                        stack.push(neighbor);
                    }
                }
            }
            components.add(members.stream().mapToInt(Integer::intValue).sorted().toArray());
        }
        // stable sort keeps discovery order, i.e. lowest member first, among equal sizes
        components.sort(Comparator.comparingInt((int[] c) -> -c.length));
        return components;
    }
}
