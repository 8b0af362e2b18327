package com.my.notegraph.adapter.in.startup;

import com.my.notegraph.adapter.in.watcher.GraphEventLoop;
import com.my.notegraph.config.AppConfig;
import com.my.notegraph.config.VaultLayouts;
import com.my.notegraph.domain.model.VaultLayout;
import com.my.notegraph.domain.port.in.WatchFolderUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 설정된 감시 폴더를 기동 시 이벤트 루프에서 로드하고, 주기적 링크 해석을 예약하기 위함.
 */
@Startup
@ApplicationScoped
public class InitialFolderLoader {

    private static final Logger log = Logger.getLogger(InitialFolderLoader.class);

    private final AppConfig appConfig;
    private final WatchFolderUseCase watchFolderUseCase;
    private final GraphEventLoop eventLoop;

    public InitialFolderLoader(AppConfig appConfig, WatchFolderUseCase watchFolderUseCase, GraphEventLoop eventLoop) {
        this.appConfig = appConfig;
        this.watchFolderUseCase = watchFolderUseCase;
        this.eventLoop = eventLoop;
    }

    @PostConstruct
    void start() {
        Optional<VaultLayout> layout = VaultLayouts.fromConfig(appConfig.paths());
        layout.ifPresent(configured -> eventLoop.execute(() -> watchFolderUseCase.loadFolder(configured)));

        int interval = appConfig.resolution().rescanIntervalSeconds();
        if (interval > 0) {
            eventLoop.scheduleWithFixedDelay(watchFolderUseCase::resolvePendingLinks, interval, interval, TimeUnit.SECONDS);
            log.infof("주기적 링크 해석 예약: %d초 간격", interval);
        }
    }
}
