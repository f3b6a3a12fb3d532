package com.db.vf2pp.domain;

import lombok.Getter;
import org.jgrapht.graph.DefaultEdge;

/**
 * A labelled edge. Edges keep identity equality so that parallel edges with the same label stay distinct
 * in multigraphs; the label is fixed once the edge is created.
 */
@Getter
public class RelationshipEdge extends DefaultEdge {
    private final String label;

    public RelationshipEdge(String label) {
        this.label = label == null ? "" : label;
    }

    @Override
    public String toString() {
        return getSource() + " -[" + label + "]-> " + getTarget();
    }
}
