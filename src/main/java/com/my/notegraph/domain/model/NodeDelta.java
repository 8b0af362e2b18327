package com.my.notegraph.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * GraphDelta를 이루는 단일 연산.
 */
public sealed interface NodeDelta permits NodeDelta.UpsertNode, NodeDelta.DeleteNode {

    String nodeId();

    record UpsertNode(GraphNode node, Optional<GraphNode> previousNode) implements NodeDelta {
        public UpsertNode {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(previousNode, "previousNode");
        }

        @Override
        public String nodeId() {
            return node.id();
        }
    }

    record DeleteNode(String nodeId) implements NodeDelta {
        public DeleteNode {
            Objects.requireNonNull(nodeId, "nodeId");
        }
    }
}
