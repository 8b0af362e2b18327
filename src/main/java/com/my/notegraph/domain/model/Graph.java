package com.my.notegraph.domain.model;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 노드 ID에서 노드로의 불변 매핑. 모든 변환은 새 Graph를 반환한다.
 */
public final class Graph {

    private static final Graph EMPTY = new Graph(Map.of());

    private final Map<String, GraphNode> nodes;

    private Graph(Map<String, GraphNode> nodes) {
        this.nodes = nodes;
    }

    public static Graph empty() {
        return EMPTY;
    }

    public static Graph of(Map<String, GraphNode> nodes) {
        return new Graph(Map.copyOf(nodes));
    }

    public static Graph of(Collection<GraphNode> nodes) {
        Map<String, GraphNode> byId = new HashMap<>();
        nodes.forEach(node -> byId.put(node.id(), node));
        return new Graph(Map.copyOf(byId));
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Set<String> ids() {
        return nodes.keySet();
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Map<String, GraphNode> asMap() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * 델타의 연산을 순서대로 적용한 새 그래프를 만든다.
     */
    public Graph apply(GraphDelta delta) {
        if (delta.isEmpty()) {
            return this;
        }
        Map<String, GraphNode> next = new HashMap<>(nodes);
        for (NodeDelta operation : delta.operations()) {
            if (operation instanceof NodeDelta.UpsertNode upsert) {
                next.put(upsert.nodeId(), upsert.node());
            } else if (operation instanceof NodeDelta.DeleteNode delete) {
                next.remove(delete.nodeId());
            }
        }
        return new Graph(Map.copyOf(next));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Graph other)) {
            return false;
        }
        return nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes);
    }

    @Override
    public String toString() {
        return "Graph" + nodes.keySet();
    }
}
