package com.db.vf2pp.matching;

import java.util.Map;

/**
 * Decides whether a tentative pair can extend the current partial mapping. Checks run cheapest first:
 * label, degree, self-loops, consistency with the mapped neighbours of both nodes, and finally the
 * label-aware frontier counting cuts. The checker never mutates the state.
 */
public final class FeasibilityChecker {
    private static final int OUT_FRONTIER = 0;
    private static final int OUT_REST = 1;
    private static final int IN_FRONTIER = 2;
    private static final int IN_REST = 3;

    private final GraphIndex<?> g1;
    private final GraphIndex<?> g2;
    private final MatchingState state;
    private final MatchMode mode;
    private final int labelCount;

    // scratch for the counting cuts: first graph counts added, second graph counts subtracted
    private final int[] balance;
    private final boolean[] marked;
    private final int[] touched;
    private int touchedCount;

    public FeasibilityChecker(GraphIndex<?> g1, GraphIndex<?> g2, MatchingState state, MatchMode mode, int labelCount) {
        this.g1 = g1;
        this.g2 = g2;
        this.state = state;
        this.mode = mode;
        this.labelCount = labelCount;
        this.balance = new int[4 * labelCount];
        this.marked = new boolean[4 * labelCount];
        this.touched = new int[4 * labelCount];
    }

    public boolean isFeasible(int n, int m) {
        return g1.label(n) == g2.label(m)
                && degreeCompatible(g1, g2, mode, n, m)
                && bagCompatible(g1.edgeBag(n, n), g2.edgeBag(m, m))
                && mappedNeighborsConsistent(n, m)
                && frontierCutsHold(n, m);
    }

    /**
     * Exact modes need equal degrees, embeddings need the second graph node to have at least as many edges
     * in each direction.
     */
    public static boolean degreeCompatible(GraphIndex<?> g1, GraphIndex<?> g2, MatchMode mode, int n, int m) {
        if (mode.isExact()) {
            return g1.degree(n) == g2.degree(m)
                    && g1.inDegree(n) == g2.inDegree(m)
                    && g1.outDegree(n) == g2.outDegree(m);
        }
        return g1.degree(n) <= g2.degree(m)
                && g1.inDegree(n) <= g2.inDegree(m)
                && g1.outDegree(n) <= g2.outDegree(m);
    }

    boolean mappedNeighborsConsistent(int n, int m) {
        for (int u : g1.neighbors(n)) {
            int image = state.mapped1(u);
            if (image == MatchingState.UNMAPPED) {
                continue;
            }
            if (!bagCompatible(g1.edgeBag(n, u), g2.edgeBag(m, image))) {
                return false;
            }
            if (g1.isDirected() && !bagCompatible(g1.edgeBag(u, n), g2.edgeBag(image, m))) {
                return false;
            }
        }
        if (mode.preservesNonEdges()) {
            for (int v : g2.neighbors(m)) {
                int preimage = state.mapped2(v);
                if (preimage != MatchingState.UNMAPPED && !g1.isAdjacent(n, preimage)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Monomorphisms only need the first graph's parallel edges to be included in the second graph's,
     * the other modes need them to match exactly.
     */
    private boolean bagCompatible(Map<Object, Integer> bag1, Map<Object, Integer> bag2) {
        if (mode.preservesNonEdges()) {
            return bag1.equals(bag2);
        }
        for (Map.Entry<Object, Integer> entry : bag1.entrySet()) {
            if (bag2.getOrDefault(entry.getKey(), 0) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }

    boolean frontierCutsHold(int n, int m) {
        touchedCount = 0;
        tally1(n);
        tally2(m);
        boolean holds = true;
        for (int i = 0; i < touchedCount; i++) {
            int slot = touched[i];
            int difference = balance[slot];
            if (mode.isExact() ? difference != 0 : difference > 0) {
                holds = false;
            }
            balance[slot] = 0;
            marked[slot] = false;
        }
        return holds;
    }

    private void tally1(int n) {
        for (int u : g1.successors(n)) {
            if (!state.isMapped1(u)) {
                count(state.inFrontier1(u), OUT_FRONTIER, OUT_REST, g1.label(u), 1);
            }
        }
        if (g1.isDirected()) {
            for (int u : g1.predecessors(n)) {
                if (!state.isMapped1(u)) {
                    count(state.inFrontier1(u), IN_FRONTIER, IN_REST, g1.label(u), 1);
                }
            }
        }
    }

    private void tally2(int m) {
        for (int v : g2.successors(m)) {
            if (!state.isMapped2(v)) {
                count(state.inFrontier2(v), OUT_FRONTIER, OUT_REST, g2.label(v), -1);
            }
        }
        if (g2.isDirected()) {
            for (int v : g2.predecessors(m)) {
                if (!state.isMapped2(v)) {
                    count(state.inFrontier2(v), IN_FRONTIER, IN_REST, g2.label(v), -1);
                }
            }
        }
    }

    private void count(boolean inFrontier, int frontierCategory, int restCategory, int label, int delta) {
        if (inFrontier) {
            add(frontierCategory, label, delta);
        }
        // for monomorphisms the rest category holds every unmapped neighbour, frontier included
        if (!inFrontier || !mode.preservesNonEdges()) {
            add(restCategory, label, delta);
        }
    }

    private void add(int category, int label, int delta) {
        int slot = category * labelCount + label;
        balance[slot] += delta;
        if (!marked[slot]) {
            marked[slot] = true;
            touched[touchedCount++] = slot;
        }
    }
}
