package com.db.vf2pp.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.IntUnaryOperator;

/**
 * Necessary conditions checked before any search: node counts, degree sequences and label distributions.
 * A rejection here means no mapping exists; a pass means nothing.
 */
public final class Precheck {
    private static final Logger logger = LoggerFactory.getLogger(Precheck.class);

    private Precheck() {
    }

    public static boolean passes(GraphIndex<?> g1, GraphIndex<?> g2, MatchMode mode) {
        boolean exact = mode.isExact();
        if (exact ? g1.size() != g2.size() : g1.size() > g2.size()) {
            logger.debug("Pre-check rejected: {} nodes against {}", g1.size(), g2.size());
            return false;
        }
        if (!degreesCompatible(g1.size(), g1::degree, g2.size(), g2::degree, exact)) {
            logger.debug("Pre-check rejected: degree sequences differ");
            return false;
        }
        if (g1.isDirected()
                && (!degreesCompatible(g1.size(), g1::inDegree, g2.size(), g2::inDegree, exact)
                || !degreesCompatible(g1.size(), g1::outDegree, g2.size(), g2::outDegree, exact))) {
            logger.debug("Pre-check rejected: in/out degree sequences differ");
            return false;
        }
        if (!labelsCompatible(g1, g2, exact)) {
            logger.debug("Pre-check rejected: label distributions differ");
            return false;
        }
        return true;
    }

    /**
     * Exact: equal multisets. Otherwise the i-th largest degree of the first graph may not exceed the
     * i-th largest of the second.
     */
    private static boolean degreesCompatible(int size1, IntUnaryOperator degree1, int size2, IntUnaryOperator degree2,
                                             boolean exact) {
        int[] sequence1 = descending(size1, degree1);
        int[] sequence2 = descending(size2, degree2);
        if (exact) {
            return Arrays.equals(sequence1, sequence2);
        }
        for (int i = 0; i < sequence1.length; i++) {
            if (sequence1[i] > sequence2[i]) {
                return false;
            }
        }
        return true;
    }

    private static int[] descending(int size, IntUnaryOperator degree) {
        int[] sequence = new int[size];
        for (int node = 0; node < size; node++) {
            sequence[node] = -degree.applyAsInt(node);
        }
        Arrays.sort(sequence);
        for (int i = 0; i < size; i++) {
            sequence[i] = -sequence[i];
        }
        return sequence;
    }

    private static boolean labelsCompatible(GraphIndex<?> g1, GraphIndex<?> g2, boolean exact) {
        int labelCount = Math.max(g1.labelCount(), g2.labelCount());
        for (int label = 0; label < labelCount; label++) {
            int count1 = g1.nodesWithLabel(label).length;
            int count2 = g2.nodesWithLabel(label).length;
            if (exact ? count1 != count2 : count1 > count2) {
                return false;
            }
        }
        return true;
    }
}
