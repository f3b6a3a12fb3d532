package com.db.vf2pp.matching;

import java.util.Arrays;

/**
 * Produces the second graph nodes a first graph node may be mapped to under the current partial mapping.
 * Results are ascending by node index. An empty result is a normal outcome and makes the search backtrack.
 */
public final class CandidateGenerator {
    private final GraphIndex<?> g1;
    private final GraphIndex<?> g2;
    private final MatchingState state;
    private final MatchMode mode;
    private final int[] buffer;

    public CandidateGenerator(GraphIndex<?> g1, GraphIndex<?> g2, MatchingState state, MatchMode mode) {
        this.g1 = g1;
        this.g2 = g2;
        this.state = state;
        this.mode = mode;
        this.buffer = new int[g2.size()];
    }

    public int[] candidates(int node) {
        int anchor = mappedNeighborWithSmallestImage(node);
        int count = 0;
        if (anchor == MatchingState.UNMAPPED) {
            // node has no mapped neighbour, so it sits in the remainder of the first graph
            for (int candidate : g2.nodesWithLabel(g1.label(node))) {
                if (state.isMapped2(candidate) || !degreeAllows(node, candidate)) {
                    continue;
                }
                if (mode.preservesNonEdges() && !state.inRemainder2(candidate)) {
                    continue;
                }
                buffer[count++] = candidate;
            }
        } else {
            int label = g1.label(node);
            for (int candidate : g2.neighbors(state.mapped1(anchor))) {
                if (state.isMapped2(candidate) || g2.label(candidate) != label || !degreeAllows(node, candidate)) {
                    continue;
                }
                buffer[count++] = candidate;
            }
        }
        return Arrays.copyOf(buffer, count);
    }

    private int mappedNeighborWithSmallestImage(int node) {
        int best = MatchingState.UNMAPPED;
        int bestSize = Integer.MAX_VALUE;
        for (int neighbor : g1.neighbors(node)) {
            if (!state.isMapped1(neighbor)) {
                continue;
            }
            int size = g2.neighbors(state.mapped1(neighbor)).length;
            if (size < bestSize) {
                best = neighbor;
                bestSize = size;
            }
        }
        return best;
    }

    private boolean degreeAllows(int n, int m) {
        return FeasibilityChecker.degreeCompatible(g1, g2, mode, n, m);
    }
}
