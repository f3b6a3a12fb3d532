package com.db.vf2pp.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.jgrapht.Graph;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DataGraph {
    private String name;
    private Graph<Vertex, RelationshipEdge> graph;
    private Map<String, Vertex> nodeMap = new LinkedHashMap<>();

    public DataGraph(String name, Graph<Vertex, RelationshipEdge> graph) {
        this.name = name;
        this.graph = graph;
    }
}
