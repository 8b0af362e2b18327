package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.FsEventType;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.VaultLayout;
import com.my.notegraph.domain.port.in.HandleFileEventUseCase;
import com.my.notegraph.domain.port.out.EchoGuard;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;
import com.my.notegraph.domain.port.out.LayoutPort;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * 외부에서 관찰된 파일 이벤트를 그래프에 반영한다.
 * <p>
 * 델타 계산 → 에코 판정 → 상태 적용 → 브로드캐스트 → 감시 폴더 범위의 링크 해석 순서로 처리하며,
 * 이벤트 루프 스레드에서 한 번에 하나씩 호출되어야 한다.
 */
public class FileEventDispatcher implements HandleFileEventUseCase {

    private static final Logger log = Logger.getLogger(FileEventDispatcher.class);

    private final GraphDeltaComputer deltaComputer;
    private final LinkResolver linkResolver;
    private final GraphState state;
    private final EchoGuard echoGuard;
    private final LayoutPort layoutPort;
    private final GraphBroadcastPort broadcastPort;

    public FileEventDispatcher(GraphDeltaComputer deltaComputer,
                               LinkResolver linkResolver,
                               GraphState state,
                               EchoGuard echoGuard,
                               LayoutPort layoutPort,
                               GraphBroadcastPort broadcastPort) {
        this.deltaComputer = deltaComputer;
        this.linkResolver = linkResolver;
        this.state = state;
        this.echoGuard = echoGuard;
        this.layoutPort = layoutPort;
        this.broadcastPort = broadcastPort;
    }

    @Override
    public GraphDelta handle(FileSystemEvent event) {
        String nodeId = event.nodeId();
        if (!NodeIds.isSupported(nodeId)) {
            return GraphDelta.empty();
        }

        Graph before = state.current();
        boolean eager = state.layout().map(layout -> layout.isEager(nodeId)).orElse(true);
        if (!eager && !before.contains(nodeId)) {
            // 지연 로드 영역: 링크되어 있을 때만 그래프에 들어온다. 이전에 파싱에 실패한 파일이 고쳐진 경우도 여기로 온다.
            if (event.type() != FsEventType.DELETED) {
                return resolvePendingLinks();
            }
            log.debugf("그래프 밖 파일 이벤트를 무시합니다: %s %s", event.type(), nodeId);
            return GraphDelta.empty();
        }

        GraphDelta delta = deltaComputer.compute(event, before);
        if (delta.isEmpty()) {
            return delta;
        }
        if (echoGuard.isOwnRecentWrite(delta)) {
            log.debugf("자체 쓰기 에코를 무시합니다: %s", nodeId);
            return GraphDelta.empty();
        }

        GraphDelta applied = applyAndBroadcast(delta, before);
        log.infof("파일 이벤트 반영: %s %s (연산 %d개)", event.type(), nodeId, applied.size());
        return applied.concat(resolvePendingLinks());
    }

    /**
     * 감시 폴더에서 아직 로드되지 않은 링크 대상을 찾아 반영한다. 감시 폴더가 없으면 아무것도 하지 않는다.
     */
    public GraphDelta resolvePendingLinks() {
        Optional<String> searchRoot = state.layout().flatMap(VaultLayout::watchedFolder);
        if (searchRoot.isEmpty()) {
            return GraphDelta.empty();
        }
        Graph before = state.current();
        GraphDelta resolved = linkResolver.resolve(before, searchRoot.get());
        if (resolved.isEmpty()) {
            return resolved;
        }
        return applyAndBroadcast(resolved, before);
    }

    private GraphDelta applyAndBroadcast(GraphDelta delta, Graph before) {
        GraphDelta positioned = GraphDeltas.positioned(delta, before, layoutPort);
        state.apply(positioned);
        broadcastPort.broadcast(positioned);
        return positioned;
    }
}
