package com.my.notegraph.adapter.out.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.my.notegraph.domain.model.Edge;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.model.Position;

import java.util.List;
import java.util.Map;

/**
 * graph-deltas 채널로 나가는 JSON 형태. 연산 순서는 델타의 순서를 그대로 따른다.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
record GraphDeltaPayload(String type, List<OperationPayload> operations) {

    static final String DELTA = "delta";
    static final String CLEAR = "clear";

    static GraphDeltaPayload of(GraphDelta delta) {
        return new GraphDeltaPayload(DELTA, delta.operations().stream().map(OperationPayload::of).toList());
    }

    static GraphDeltaPayload clear() {
        return new GraphDeltaPayload(CLEAR, List.of());
    }

    record OperationPayload(String op, String nodeId, NodePayload node, NodePayload previousNode) {

        static OperationPayload of(NodeDelta operation) {
            if (operation instanceof NodeDelta.UpsertNode upsert) {
                return new OperationPayload("upsert", upsert.nodeId(),
                        NodePayload.of(upsert.node()),
                        upsert.previousNode().map(NodePayload::of).orElse(null));
            }
            return new OperationPayload("delete", operation.nodeId(), null, null);
        }
    }

    record NodePayload(String id,
                       String title,
                       String content,
                       List<EdgePayload> edges,
                       String color,
                       PositionPayload position,
                       @JsonProperty("isContextNode") boolean isContextNode,
                       List<String> containedNodeIds,
                       Map<String, Object> extraProperties) {

        static NodePayload of(GraphNode node) {
            return new NodePayload(
                    node.id(),
                    node.title(),
                    node.content(),
                    node.edges().stream().map(EdgePayload::of).toList(),
                    node.metadata().color().orElse(null),
                    node.metadata().position().map(PositionPayload::of).orElse(null),
                    node.metadata().contextNode(),
                    node.metadata().containedNodeIds().orElse(null),
                    node.metadata().extraProperties());
        }
    }

    record EdgePayload(String targetId, String label) {
        static EdgePayload of(Edge edge) {
            return new EdgePayload(edge.targetId(), edge.label());
        }
    }

    record PositionPayload(double x, double y) {
        static PositionPayload of(Position position) {
            return new PositionPayload(position.x(), position.y());
        }
    }
}
