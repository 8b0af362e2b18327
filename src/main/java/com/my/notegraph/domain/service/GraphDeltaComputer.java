package com.my.notegraph.domain.service;

import com.my.notegraph.domain.exception.MarkdownParseException;
import com.my.notegraph.domain.model.Edge;
import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.FsEventType;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.ParsedMarkdown;
import com.my.notegraph.domain.model.WikiLink;
import com.my.notegraph.domain.port.out.MarkdownPort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 파일 시스템 이벤트 하나를 현재 그래프 기준의 GraphDelta로 바꾸는 폴드 단계.
 * <p>
 * 전체 스캔, 링크 해석, 실시간 이벤트가 모두 이 함수를 그대로 사용하므로 스캔 시점과 런타임의 동작이 같다.
 * 새 노드의 엣지는 현재 그래프에서 해석되는 링크만 담고, 새 노드로 인해 엣지가 달라지는 기존 노드는
 * 치유(healing) upsert로 같은 델타에 포함된다.
 */
public class GraphDeltaComputer {

    private static final Logger log = Logger.getLogger(GraphDeltaComputer.class);

    private final MarkdownPort markdownPort;

    public GraphDeltaComputer(MarkdownPort markdownPort) {
        this.markdownPort = markdownPort;
    }

    public GraphDelta compute(FileSystemEvent event, Graph graph) {
        if (event.type() == FsEventType.DELETED) {
            return deleteNode(event.nodeId(), graph);
        }
        return upsertNode(event, graph);
    }

    /**
     * 노드의 링크를 주어진 그래프에서 해석한 엣지 목록. 해석되지 않는 링크는 제외되고 같은 대상은 한 번만 나온다.
     */
    public static List<Edge> resolveEdges(GraphNode node, Graph graph) {
        List<Edge> edges = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (WikiLink link : node.links()) {
            Optional<String> target = LinkMatcher.resolveInGraph(node.id(), link, graph);
            if (target.isPresent() && seen.add(target.get())) {
                edges.add(new Edge(target.get(), link.label()));
            }
        }
        return edges;
    }

    private GraphDelta upsertNode(FileSystemEvent event, Graph graph) {
        String nodeId = event.nodeId();
        ParsedMarkdown parsed;
        try {
            parsed = markdownPort.parse(nodeId, event.content().orElse(""));
        } catch (MarkdownParseException e) {
            log.warnf("파싱 실패로 파일을 건너뜁니다: %s (%s)", nodeId, e.getMessage());
            return GraphDelta.empty();
        }

        Optional<GraphNode> previous = graph.node(nodeId);
        GraphNode parsedNode = parsed.toNode(nodeId);
        if (previous.isPresent()) {
            parsedNode = parsedNode.withMetadata(parsedNode.metadata().mergeMissingFrom(previous.get().metadata()));
        }

        Graph withNode = graph.apply(GraphDelta.of(new NodeDelta.UpsertNode(parsedNode, previous)));
        GraphNode node = parsedNode.withEdges(resolveEdges(parsedNode, withNode));

        List<NodeDelta> operations = new ArrayList<>();
        operations.add(new NodeDelta.UpsertNode(node, previous));
        Graph after = withNode.apply(GraphDelta.of(new NodeDelta.UpsertNode(node, previous)));
        operations.addAll(healNodesLinkingTo(nodeId, after));
        return new GraphDelta(operations);
    }

    private GraphDelta deleteNode(String nodeId, Graph graph) {
        if (!graph.contains(nodeId)) {
            return GraphDelta.empty();
        }
        NodeDelta.DeleteNode delete = new NodeDelta.DeleteNode(nodeId);
        Graph after = graph.apply(GraphDelta.of(delete));

        List<NodeDelta> operations = new ArrayList<>();
        operations.add(delete);
        operations.addAll(healNodesLinkingTo(nodeId, after));
        return new GraphDelta(operations);
    }

    /**
     * 바뀐 노드 ID와 basename이 같은 링크를 가진 다른 노드들의 엣지를 다시 계산하고,
     * 실제로 달라진 노드만 upsert로 돌려준다. 결과 순서는 노드 ID 순이다.
     */
    private List<NodeDelta> healNodesLinkingTo(String changedId, Graph graph) {
        String changedBaseName = NodeIds.baseName(changedId);
        List<NodeDelta> healed = new ArrayList<>();
        graph.ids().stream()
                .filter(id -> !id.equals(changedId))
                .sorted()
                .forEach(id -> {
                    GraphNode candidate = graph.node(id).orElseThrow();
                    if (!mayReferTo(candidate, changedId, changedBaseName)) {
                        return;
                    }
                    List<Edge> recomputed = resolveEdges(candidate, graph);
                    if (!recomputed.equals(candidate.edges())) {
                        healed.add(new NodeDelta.UpsertNode(candidate.withEdges(recomputed), Optional.of(candidate)));
                    }
                });
        return healed;
    }

    private static boolean mayReferTo(GraphNode node, String changedId, String changedBaseName) {
        if (node.hasEdgeTo(changedId)) {
            return true;
        }
        return node.links().stream()
                .anyMatch(link -> LinkMatcher.targetBaseName(link.target()).equals(changedBaseName));
    }
}
