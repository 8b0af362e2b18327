package com.my.notegraph.config;

import com.my.notegraph.adapter.out.clock.SystemClockAdapter;
import com.my.notegraph.domain.port.in.SaveNodeUseCase;
import com.my.notegraph.domain.port.in.WatchFolderUseCase;
import com.my.notegraph.domain.port.out.ClockPort;
import com.my.notegraph.domain.port.out.EchoGuard;
import com.my.notegraph.domain.port.out.FilePort;
import com.my.notegraph.domain.port.out.FolderWatchPort;
import com.my.notegraph.domain.port.out.GraphBroadcastPort;
import com.my.notegraph.domain.port.out.LayoutPort;
import com.my.notegraph.domain.port.out.MarkdownPort;
import com.my.notegraph.domain.service.FileEventDispatcher;
import com.my.notegraph.domain.service.GraphDeltaComputer;
import com.my.notegraph.domain.service.GraphState;
import com.my.notegraph.domain.service.LinkResolver;
import com.my.notegraph.domain.service.NodePersistenceService;
import com.my.notegraph.domain.service.ProgressiveGraphLoader;
import com.my.notegraph.domain.service.WatchFolderService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public GraphState graphState() {
        return new GraphState();
    }

    @Produces
    @ApplicationScoped
    public GraphDeltaComputer graphDeltaComputer(MarkdownPort markdownPort) {
        return new GraphDeltaComputer(markdownPort);
    }

    @Produces
    @ApplicationScoped
    public ProgressiveGraphLoader progressiveGraphLoader(FilePort filePort,
                                                         GraphDeltaComputer graphDeltaComputer,
                                                         LayoutPort layoutPort,
                                                         AppConfig appConfig) {
        return new ProgressiveGraphLoader(filePort, graphDeltaComputer, layoutPort, appConfig.loading().maxFiles());
    }

    @Produces
    @ApplicationScoped
    public LinkResolver linkResolver(FilePort filePort, GraphDeltaComputer graphDeltaComputer, AppConfig appConfig) {
        return new LinkResolver(filePort, graphDeltaComputer, appConfig.resolution().maxPasses());
    }

    @Produces
    @ApplicationScoped
    public FileEventDispatcher fileEventDispatcher(GraphDeltaComputer graphDeltaComputer,
                                                   LinkResolver linkResolver,
                                                   GraphState graphState,
                                                   EchoGuard echoGuard,
                                                   LayoutPort layoutPort,
                                                   GraphBroadcastPort graphBroadcastPort) {
        return new FileEventDispatcher(graphDeltaComputer, linkResolver, graphState, echoGuard, layoutPort, graphBroadcastPort);
    }

    @Produces
    @ApplicationScoped
    public WatchFolderUseCase watchFolderUseCase(ProgressiveGraphLoader progressiveGraphLoader,
                                                 LinkResolver linkResolver,
                                                 FileEventDispatcher fileEventDispatcher,
                                                 GraphDeltaComputer graphDeltaComputer,
                                                 GraphState graphState,
                                                 LayoutPort layoutPort,
                                                 GraphBroadcastPort graphBroadcastPort,
                                                 FolderWatchPort folderWatchPort) {
        return new WatchFolderService(progressiveGraphLoader, linkResolver, fileEventDispatcher, graphDeltaComputer,
                graphState, layoutPort, graphBroadcastPort, folderWatchPort);
    }

    @Produces
    @ApplicationScoped
    public SaveNodeUseCase saveNodeUseCase(MarkdownPort markdownPort,
                                           FilePort filePort,
                                           GraphDeltaComputer graphDeltaComputer,
                                           GraphState graphState,
                                           EchoGuard echoGuard,
                                           LayoutPort layoutPort,
                                           GraphBroadcastPort graphBroadcastPort) {
        return new NodePersistenceService(markdownPort, filePort, graphDeltaComputer, graphState, echoGuard,
                layoutPort, graphBroadcastPort);
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }
}
