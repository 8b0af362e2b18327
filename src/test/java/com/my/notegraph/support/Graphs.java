package com.my.notegraph.support;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphNode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 테스트용 그래프 비교 헬퍼.
 */
public final class Graphs {

    private Graphs() {
    }

    public static Map<String, List<String>> edgesById(Graph graph) {
        Map<String, List<String>> edges = new TreeMap<>();
        for (GraphNode node : graph.nodes()) {
            edges.put(node.id(), node.edgeTargets());
        }
        return edges;
    }

    public static GraphNode node(Graph graph, String id) {
        return graph.node(id).orElseThrow(() -> new AssertionError("노드가 없습니다: " + id + " in " + graph));
    }
}
