package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.NodeMetadata;
import com.my.notegraph.domain.model.Position;
import com.my.notegraph.domain.port.in.SaveNodeUseCase;
import com.my.notegraph.domain.port.out.EchoGuard;
import com.my.notegraph.domain.port.out.FilePort;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;
import com.my.notegraph.domain.port.out.LayoutPort;
import com.my.notegraph.domain.port.out.MarkdownPort;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 왜: 애플리케이션 자신의 쓰기를 파일 이벤트와 같은 폴드 단계로 반영하고, 뒤따르는 에코를 걸러낼 수 있도록 기록하기 위함.
 */
public class NodePersistenceService implements SaveNodeUseCase {

    private static final Logger log = Logger.getLogger(NodePersistenceService.class);

    private final MarkdownPort markdownPort;
    private final FilePort filePort;
    private final GraphDeltaComputer deltaComputer;
    private final GraphState state;
    private final EchoGuard echoGuard;
    private final LayoutPort layoutPort;
    private final GraphBroadcastPort broadcastPort;

    public NodePersistenceService(MarkdownPort markdownPort,
                                  FilePort filePort,
                                  GraphDeltaComputer deltaComputer,
                                  GraphState state,
                                  EchoGuard echoGuard,
                                  LayoutPort layoutPort,
                                  GraphBroadcastPort broadcastPort) {
        this.markdownPort = markdownPort;
        this.filePort = filePort;
        this.deltaComputer = deltaComputer;
        this.state = state;
        this.echoGuard = echoGuard;
        this.layoutPort = layoutPort;
        this.broadcastPort = broadcastPort;
    }

    @Override
    public GraphDelta save(GraphNode node) {
        Graph before = state.current();
        String content = markdownPort.render(node);
        filePort.write(node.id(), content);

        FileSystemEvent event = before.contains(node.id())
                ? FileSystemEvent.changed(node.id(), content)
                : FileSystemEvent.added(node.id(), content);
        return publish(deltaComputer.compute(event, before), before);
    }

    @Override
    public GraphDelta saveMarkdown(String nodeId, String markdown) {
        String id = NodeIds.normalize(nodeId);
        GraphNode parsed = markdownPort.parse(id, markdown).toNode(id);
        NodeMetadata metadata = state.current().node(id)
                .map(previous -> parsed.metadata().mergeMissingFrom(previous.metadata()))
                .orElse(parsed.metadata());
        return save(parsed.withMetadata(metadata));
    }

    @Override
    public GraphDelta delete(String nodeId) {
        Graph before = state.current();
        filePort.delete(nodeId);
        return publish(deltaComputer.compute(FileSystemEvent.deleted(nodeId), before), before);
    }

    @Override
    public GraphDelta savePositions(Map<String, Position> positions) {
        GraphDelta saved = GraphDelta.empty();
        for (Map.Entry<String, Position> entry : new TreeMap<>(positions).entrySet()) {
            Optional<GraphNode> node = state.current().node(entry.getKey());
            if (node.isEmpty()) {
                log.warnf("그래프에 없는 노드의 위치는 저장하지 않습니다: %s", entry.getKey());
                continue;
            }
            saved = saved.concat(save(node.get().withPosition(entry.getValue())));
        }
        return saved;
    }

    private GraphDelta publish(GraphDelta delta, Graph before) {
        if (delta.isEmpty()) {
            return delta;
        }
        GraphDelta positioned = GraphDeltas.positioned(delta, before, layoutPort);
        echoGuard.recordOwnWrite(positioned);
        state.apply(positioned);
        broadcastPort.broadcast(positioned);
        return positioned;
    }
}
