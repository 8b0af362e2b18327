package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.LoadOutcome;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.VaultLayout;
import com.my.notegraph.domain.port.in.WatchFolderUseCase;
import com.my.notegraph.domain.port.out.FolderWatchPort;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;
import com.my.notegraph.domain.port.out.LayoutPort;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 감시 폴더 전환과 eager 디렉터리 추가/제거를 처리한다. 모든 메서드는 이벤트 루프 스레드에서 호출된다.
 */
public class WatchFolderService implements WatchFolderUseCase {

    private static final Logger log = Logger.getLogger(WatchFolderService.class);

    private final ProgressiveGraphLoader loader;
    private final LinkResolver linkResolver;
    private final FileEventDispatcher dispatcher;
    private final GraphDeltaComputer deltaComputer;
    private final GraphState state;
    private final LayoutPort layoutPort;
    private final GraphBroadcastPort broadcastPort;
    private final FolderWatchPort folderWatchPort;

    public WatchFolderService(ProgressiveGraphLoader loader,
                              LinkResolver linkResolver,
                              FileEventDispatcher dispatcher,
                              GraphDeltaComputer deltaComputer,
                              GraphState state,
                              LayoutPort layoutPort,
                              GraphBroadcastPort broadcastPort,
                              FolderWatchPort folderWatchPort) {
        this.loader = loader;
        this.linkResolver = linkResolver;
        this.dispatcher = dispatcher;
        this.deltaComputer = deltaComputer;
        this.state = state;
        this.layoutPort = layoutPort;
        this.broadcastPort = broadcastPort;
        this.folderWatchPort = folderWatchPort;
    }

    @Override
    public LoadOutcome<Graph> loadFolder(VaultLayout layout) {
        LoadOutcome<Graph> outcome = loader.load(layout.eagerRoots());
        return outcome.<LoadOutcome<Graph>>fold(
                loaded -> {
                    folderWatchPort.stop();
                    broadcastPort.clear();
                    Graph graph = layout.watchedFolder()
                            .map(folder -> layoutPort.assignPositions(loaded.apply(linkResolver.resolve(loaded, folder))))
                            .orElse(loaded);
                    state.reset(layout, graph);
                    broadcastPort.broadcast(allNodes(graph));
                    folderWatchPort.watch(layout.watchRoots());
                    log.infof("감시 폴더 로드 완료: %s (노드 %d개)", layout.watchedFolder().orElse(layout.writePath()), graph.size());
                    return LoadOutcome.loaded(graph);
                },
                failure -> {
                    log.error(failure.userMessage());
                    return failure;
                });
    }

    @Override
    public LoadOutcome<GraphDelta> addReadPath(String directory) {
        VaultLayout layout = requireLayout();
        String root = NodeIds.normalize(directory);
        if (layout.eagerRoots().contains(root)) {
            log.infof("이미 로드된 디렉터리입니다: %s", root);
            return LoadOutcome.loaded(GraphDelta.empty());
        }

        LoadOutcome<GraphDelta> outcome = loader.loadAdditively(root, state.current());
        return outcome.<LoadOutcome<GraphDelta>>fold(
                delta -> {
                    VaultLayout next = layout.withReadPath(root);
                    state.updateLayout(next);
                    if (!delta.isEmpty()) {
                        state.apply(delta);
                        broadcastPort.broadcast(delta);
                    }
                    restartWatcherIfNeeded(layout, next);
                    return LoadOutcome.loaded(delta.concat(dispatcher.resolvePendingLinks()));
                },
                failure -> {
                    log.error(failure.userMessage());
                    return failure;
                });
    }

    @Override
    public GraphDelta removeReadPath(String directory) {
        VaultLayout layout = requireLayout();
        String root = NodeIds.normalize(directory);
        if (!layout.readPaths().contains(root)) {
            return GraphDelta.empty();
        }
        VaultLayout next = layout.withoutReadPath(root);
        state.updateLayout(next);

        Graph before = state.current();
        List<String> unloaded = before.ids().stream()
                .filter(id -> NodeIds.isUnder(id, root))
                .filter(id -> !next.isEager(id))
                .sorted()
                .toList();
        Graph graph = before;
        GraphDelta accumulated = GraphDelta.empty();
        for (String id : unloaded) {
            GraphDelta delta = deltaComputer.compute(FileSystemEvent.deleted(id), graph);
            graph = graph.apply(delta);
            accumulated = accumulated.concat(delta);
        }

        GraphDelta collapsed = GraphDeltas.collapse(accumulated, before, graph);
        if (!collapsed.isEmpty()) {
            state.apply(collapsed);
            broadcastPort.broadcast(collapsed);
        }
        restartWatcherIfNeeded(layout, next);
        log.infof("디렉터리 언로드: %s (노드 %d개 제거)", root, unloaded.size());
        return collapsed;
    }

    @Override
    public GraphDelta resolvePendingLinks() {
        return dispatcher.resolvePendingLinks();
    }

    @Override
    public Graph currentGraph() {
        return state.current();
    }

    private VaultLayout requireLayout() {
        Optional<VaultLayout> layout = state.layout();
        return layout.orElseThrow(() -> new IllegalStateException("감시 중인 폴더가 없습니다. 먼저 폴더를 로드하세요."));
    }

    private void restartWatcherIfNeeded(VaultLayout previous, VaultLayout next) {
        if (!previous.watchRoots().equals(next.watchRoots())) {
            folderWatchPort.stop();
            folderWatchPort.watch(next.watchRoots());
        }
    }

    private static GraphDelta allNodes(Graph graph) {
        List<NodeDelta> upserts = graph.nodes().stream()
                .sorted(Comparator.comparing(GraphNode::id))
                .<NodeDelta>map(node -> new NodeDelta.UpsertNode(node, Optional.empty()))
                .toList();
        return new GraphDelta(upserts);
    }
}
