package com.db.vf2pp.matching;

import lombok.Value;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Partial mapping between two indexed graphs plus the frontier of each side.
 * <p>
 * Every node is in exactly one of: mapped, frontier (unmapped, adjacent to a mapped node),
 * remainder (unmapped, not adjacent to any mapped node). Adjacency ignores direction.
 * {@link #rollback(int, int)} restores exactly what the matching {@link #commit(int, int)} changed.
 */
public final class MatchingState {
    public static final int UNMAPPED = -1;

    private final GraphIndex<?> g1;
    private final GraphIndex<?> g2;
    private final int[] core1;
    private final int[] core2;
    // number of mapped neighbours per node
    private final int[] covered1;
    private final int[] covered2;
    private final BitSet frontier1 = new BitSet();
    private final BitSet frontier2 = new BitSet();
    private int size;

    public MatchingState(GraphIndex<?> g1, GraphIndex<?> g2) {
        this.g1 = g1;
        this.g2 = g2;
        this.core1 = new int[g1.size()];
        this.core2 = new int[g2.size()];
        Arrays.fill(core1, UNMAPPED);
        Arrays.fill(core2, UNMAPPED);
        this.covered1 = new int[g1.size()];
        this.covered2 = new int[g2.size()];
    }

    public void commit(int n, int m) {
        if (core1[n] != UNMAPPED || core2[m] != UNMAPPED) {
            throw new IllegalStateException("Cannot map " + n + " -> " + m + ", one side is already mapped");
        }
        core1[n] = m;
        core2[m] = n;
        size++;
        frontier1.clear(n);
        frontier2.clear(m);
        cover(g1, core1, covered1, frontier1, n);
        cover(g2, core2, covered2, frontier2, m);
    }

    public void rollback(int n, int m) {
        if (core1[n] != m || core2[m] != n) {
            throw new IllegalStateException("Pair " + n + " -> " + m + " is not mapped");
        }
        uncover(g1, core1, covered1, frontier1, n);
        uncover(g2, core2, covered2, frontier2, m);
        core1[n] = UNMAPPED;
        core2[m] = UNMAPPED;
        size--;
        if (covered1[n] > 0) {
            frontier1.set(n);
        }
        if (covered2[m] > 0) {
            frontier2.set(m);
        }
    }

    private static void cover(GraphIndex<?> graph, int[] core, int[] covered, BitSet frontier, int node) {
        for (int neighbor : graph.neighbors(node)) {
            covered[neighbor]++;
            if (core[neighbor] == UNMAPPED) {
                frontier.set(neighbor);
            }
        }
    }

    private static void uncover(GraphIndex<?> graph, int[] core, int[] covered, BitSet frontier, int node) {
        for (int neighbor : graph.neighbors(node)) {
            covered[neighbor]--;
            if (covered[neighbor] == 0 && core[neighbor] == UNMAPPED) {
                frontier.clear(neighbor);
            }
        }
    }

    public int size() {
        return size;
    }

    public int mapped1(int n) {
        return core1[n];
    }

    public int mapped2(int m) {
        return core2[m];
    }

    public boolean isMapped1(int n) {
        return core1[n] != UNMAPPED;
    }

    public boolean isMapped2(int m) {
        return core2[m] != UNMAPPED;
    }

    public boolean inFrontier1(int n) {
        return frontier1.get(n);
    }

    public boolean inFrontier2(int m) {
        return frontier2.get(m);
    }

    public boolean inRemainder1(int n) {
        return core1[n] == UNMAPPED && !frontier1.get(n);
    }

    public boolean inRemainder2(int m) {
        return core2[m] == UNMAPPED && !frontier2.get(m);
    }

    /**
     * Number of mapped neighbours of {@code n} in the first graph.
     */
    public int coveredCount1(int n) {
        return covered1[n];
    }

    public int[] forward() {
        return core1.clone();
    }

    public Snapshot snapshot() {
        BitSet remainder1 = remainder(core1, frontier1);
        BitSet remainder2 = remainder(core2, frontier2);
        return new Snapshot(core1.clone(), core2.clone(), (BitSet) frontier1.clone(), remainder1,
                (BitSet) frontier2.clone(), remainder2);
    }

    private static BitSet remainder(int[] core, BitSet frontier) {
        BitSet remainder = new BitSet(core.length);
        for (int node = 0; node < core.length; node++) {
            if (core[node] == UNMAPPED && !frontier.get(node)) {
                remainder.set(node);
            }
        }
        return remainder;
    }

    /**
     * Structural copy of the mapping and frontier sets.
     */
    @Value
    public static class Snapshot {
        int[] forward;
        int[] reverse;
        BitSet frontier1;
        BitSet remainder1;
        BitSet frontier2;
        BitSet remainder2;
    }
}
