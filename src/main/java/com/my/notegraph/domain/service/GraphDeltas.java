package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.port.out.LayoutPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 여러 폴드 단계에서 누적된 델타를 브로드캐스트용으로 정리하는 함수 모음.
 */
final class GraphDeltas {

    private GraphDeltas() {
    }

    /**
     * 누적 델타를 노드 ID별 최종 연산 하나로 줄인다. upsert는 {@code finalGraph}의 노드로,
     * previousNode는 {@code before}의 노드로 채운다. 삭제가 먼저, upsert가 나중에 나온다.
     */
    static GraphDelta collapse(GraphDelta accumulated, Graph before, Graph finalGraph) {
        Map<String, NodeDelta> lastById = new LinkedHashMap<>();
        for (NodeDelta operation : accumulated.operations()) {
            lastById.remove(operation.nodeId());
            lastById.put(operation.nodeId(), operation);
        }
        List<NodeDelta> deletes = new ArrayList<>();
        List<NodeDelta> upserts = new ArrayList<>();
        for (NodeDelta operation : lastById.values()) {
            String id = operation.nodeId();
            if (operation instanceof NodeDelta.DeleteNode) {
                if (before.contains(id)) {
                    deletes.add(operation);
                }
            } else {
                finalGraph.node(id).ifPresent(node -> upserts.add(new NodeDelta.UpsertNode(node, before.node(id))));
            }
        }
        List<NodeDelta> ordered = new ArrayList<>(deletes);
        ordered.addAll(upserts);
        return new GraphDelta(ordered);
    }

    /**
     * 델타를 적용한 뒤 위치가 없는 노드에 위치를 부여하고, 위치가 반영된 델타를 돌려준다.
     */
    static GraphDelta positioned(GraphDelta delta, Graph before, LayoutPort layoutPort) {
        if (delta.isEmpty()) {
            return delta;
        }
        Graph positionedGraph = layoutPort.assignPositions(before.apply(delta));
        return collapse(delta, before, positionedGraph);
    }
}
