package com.db.vf2pp.matching;

import java.util.Locale;

/**
 * The matching problem a search solves. Every mode maps all nodes of the first graph;
 * they differ in how much of the second graph's structure must be reproduced.
 */
public enum MatchMode {
    /**
     * Bijection preserving edges and non-edges with equal multiplicities.
     */
    ISOMORPHISM,
    /**
     * Injection preserving edges and non-edges among the mapped nodes.
     */
    INDUCED_SUBGRAPH,
    /**
     * Injection preserving edges only.
     */
    MONOMORPHISM;

    public boolean isExact() {
        return this == ISOMORPHISM;
    }

    public boolean preservesNonEdges() {
        return this != MONOMORPHISM;
    }

    public static MatchMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return ISOMORPHISM;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "ISOMORPHISM":
            case "ISO":
                return ISOMORPHISM;
            case "SUBGRAPH":
            case "INDUCED_SUBGRAPH":
                return INDUCED_SUBGRAPH;
            case "MONOMORPHISM":
            case "MONO":
                return MONOMORPHISM;
            default:
                throw new IllegalArgumentException("Unknown match mode: " + name);
        }
    }
}
