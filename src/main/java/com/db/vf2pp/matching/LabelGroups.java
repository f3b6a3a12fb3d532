package com.db.vf2pp.matching;

import java.util.*;

/**
 * Partitions nodes by label value.
 */
public final class LabelGroups {

    private LabelGroups() {
    }

    public static <V, L> Map<L, Set<V>> groupByLabel(Map<V, L> labels) {
        Map<L, Set<V>> groups = new LinkedHashMap<>();
        for (Map.Entry<V, L> entry : labels.entrySet()) {
            groups.computeIfAbsent(entry.getValue(), k -> new LinkedHashSet<>()).add(entry.getKey());
        }
        return groups;
    }

    public static <V, L> Map<L, Integer> countByLabel(Map<V, L> labels) {
        Map<L, Integer> counts = new HashMap<>();
        for (L label : labels.values()) {
            counts.merge(label, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Groups node indices by label id; each group is in ascending node order.
     */
    public static int[][] groupByLabelId(int[] labelOf, int labelCount) {
        int[] counts = countByLabelId(labelOf, labelCount);
        int[][] groups = new int[labelCount][];
        for (int label = 0; label < labelCount; label++) {
            groups[label] = new int[counts[label]];
        }
        int[] fill = new int[labelCount];
        for (int node = 0; node < labelOf.length; node++) {
            int label = labelOf[node];
            groups[label][fill[label]++] = node;
        }
        return groups;
    }

    public static int[] countByLabelId(int[] labelOf, int labelCount) {
        int[] counts = new int[labelCount];
        for (int label : labelOf) {
            counts[label]++;
        }
        return counts;
    }
}
