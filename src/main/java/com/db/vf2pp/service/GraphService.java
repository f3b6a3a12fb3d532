package com.db.vf2pp.service;

import com.db.vf2pp.domain.DataGraph;
import com.db.vf2pp.domain.RelationshipEdge;
import com.db.vf2pp.domain.Vertex;
import com.db.vf2pp.utils.FileUtil;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultUndirectedGraph;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.graph.Pseudograph;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class GraphService {
    private static final Logger logger = LoggerFactory.getLogger(GraphService.class);

    public DataGraph loadGraph(String path) {
        logger.info("Loading graph from " + path);
        JSONObject object = FileUtil.readJsonObject(path);
        String name = object.optString("name", Paths.get(path).getFileName().toString());
        DataGraph graph = parseGraph(name, object);
        logger.info("Graph {} has {} vertices and {} edges", name, graph.getGraph().vertexSet().size(), graph.getGraph().edgeSet().size());
        return graph;
    }

    /**
     * Builds a graph from {@code {"directed", "multigraph", "vertices": [{"uri", "type"}], "edges": [{"src", "dst", "label"}]}}.
     */
    public DataGraph parseGraph(String name, JSONObject object) {
        DataGraph graph = createGraph(name, object.optBoolean("directed", false), object.optBoolean("multigraph", false));

        JSONArray vertices = object.optJSONArray("vertices");
        if (vertices != null) {
            for (Object o : vertices) {
                JSONObject vertexObj = (JSONObject) o;
                addVertex(graph, new Vertex(vertexObj.get("uri").toString(), vertexObj.optString("type", "")));
            }
        }

        JSONArray edges = object.optJSONArray("edges");
        if (edges != null) {
            for (Object o : edges) {
                JSONObject edgeObj = (JSONObject) o;
                addEdge(graph, edgeObj.get("src").toString(), edgeObj.get("dst").toString(), edgeObj.optString("label", ""));
            }
        }
        return graph;
    }

    public DataGraph createGraph(String name, boolean directed, boolean multigraph) {
        Graph<Vertex, RelationshipEdge> graph;
        if (directed) {
            graph = multigraph ? new DirectedPseudograph<>(RelationshipEdge.class) : new DefaultDirectedGraph<>(RelationshipEdge.class);
        } else {
            graph = multigraph ? new Pseudograph<>(RelationshipEdge.class) : new DefaultUndirectedGraph<>(RelationshipEdge.class);
        }
        return new DataGraph(name, graph);
    }

    public void addVertex(DataGraph baseGraph, Vertex vertex) {
        Graph<Vertex, RelationshipEdge> graph = baseGraph.getGraph();
        Map<String, Vertex> nodeMap = baseGraph.getNodeMap();
        nodeMap.computeIfAbsent(vertex.getUri(), uri -> {
            graph.addVertex(vertex);
            return vertex;
        });
    }

    /**
     * @throws IllegalArgumentException if either endpoint is not a vertex of the graph
     */
    public void addEdge(DataGraph baseGraph, String srcURI, String dstURI, String label) {
        Map<String, Vertex> nodeMap = baseGraph.getNodeMap();
        Vertex src = nodeMap.get(srcURI);
        Vertex dst = nodeMap.get(dstURI);
        if (src == null || dst == null) {
            throw new IllegalArgumentException("Edge " + srcURI + " -> " + dstURI + " references an unknown vertex in " + baseGraph.getName());
        }

        boolean added = baseGraph.getGraph().addEdge(src, dst, new RelationshipEdge(label));
        if (!added) {
            logger.debug("Ignoring parallel edge {} -> {} in simple graph {}", srcURI, dstURI, baseGraph.getName());
        }
    }

    /**
     * Vertex labels used for matching: the vertex type.
     */
    public Map<Vertex, String> labelsOf(DataGraph graph) {
        Map<Vertex, String> labels = new LinkedHashMap<>();
        for (Vertex v : graph.getGraph().vertexSet()) {
            labels.put(v, v.getType());
        }
        return labels;
    }
}
