package com.my.notegraph.adapter.out.layout;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.Position;
import com.my.notegraph.domain.port.out.LayoutPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 위치가 없는 노드를 이미 배치된 이웃 근처에 놓는 결정적 배치기.
 * 이웃이 없는 노드는 원점 둘레의 나선에 놓는다. 같은 입력에는 항상 같은 좌표가 나온다.
 */
@ApplicationScoped
public class NeighborLayoutAdapter implements LayoutPort {

    static final double SPAWN_RADIUS = 200.0;
    private static final double GOLDEN_ANGLE = Math.PI * (3 - Math.sqrt(5));

    @Override
    public Graph assignPositions(Graph graph) {
        TreeMap<String, GraphNode> nodes = new TreeMap<>(graph.asMap());
        if (nodes.values().stream().allMatch(node -> node.metadata().position().isPresent())) {
            return graph;
        }

        Map<String, List<String>> incoming = new HashMap<>();
        nodes.values().forEach(source -> source.edgeTargets()
                .forEach(target -> incoming.computeIfAbsent(target, key -> new ArrayList<>()).add(source.id())));
        Map<String, Integer> childrenPlaced = new HashMap<>();
        int rootsPlaced = (int) nodes.values().stream()
                .filter(node -> node.metadata().position().isPresent())
                .count();

        boolean pending = true;
        while (pending) {
            pending = false;
            boolean placedThisRound = false;
            for (GraphNode node : List.copyOf(nodes.values())) {
                if (node.metadata().position().isPresent()) {
                    continue;
                }
                Optional<GraphNode> anchor = positionedNeighbor(node, nodes, incoming);
                if (anchor.isEmpty()) {
                    pending = true;
                    continue;
                }
                int index = childrenPlaced.merge(anchor.get().id(), 1, Integer::sum);
                Position base = anchor.get().metadata().position().orElseThrow();
                nodes.put(node.id(), node.withPosition(around(base, SPAWN_RADIUS, index)));
                placedThisRound = true;
            }
            if (pending && !placedThisRound) {
                GraphNode root = nodes.values().stream()
                        .filter(node -> node.metadata().position().isEmpty())
                        .findFirst()
                        .orElseThrow();
                nodes.put(root.id(), root.withPosition(
                        around(new Position(0, 0), SPAWN_RADIUS * Math.sqrt(rootsPlaced + 1), rootsPlaced)));
                rootsPlaced++;
            }
        }
        return Graph.of(nodes);
    }

    private static Optional<GraphNode> positionedNeighbor(GraphNode node,
                                                          Map<String, GraphNode> nodes,
                                                          Map<String, List<String>> incoming) {
        Optional<GraphNode> target = firstPositioned(node.edgeTargets(), nodes);
        if (target.isPresent()) {
            return target;
        }
        return firstPositioned(incoming.getOrDefault(node.id(), List.of()), nodes);
    }

    private static Optional<GraphNode> firstPositioned(List<String> ids, Map<String, GraphNode> nodes) {
        return ids.stream()
                .sorted()
                .map(nodes::get)
                .filter(neighbor -> neighbor != null && neighbor.metadata().position().isPresent())
                .findFirst();
    }

    private static Position around(Position center, double radius, int index) {
        double angle = index * GOLDEN_ANGLE;
        return center.offset(radius * Math.cos(angle), radius * Math.sin(angle));
    }
}
