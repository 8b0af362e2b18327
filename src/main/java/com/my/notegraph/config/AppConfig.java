package com.my.notegraph.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    PathsConfig paths();

    LoadingConfig loading();

    EchoConfig echo();

    ResolutionConfig resolution();

    interface PathsConfig {
        @WithName("watched-folder")
        Optional<String> watchedFolder();

        /**
         * 감시 폴더 기준 상대 경로 또는 절대 경로. 비어 있으면 감시 폴더 자체.
         */
        @WithName("write-path")
        Optional<String> writePath();

        @WithName("read-paths")
        Optional<List<String>> readPaths();
    }

    interface LoadingConfig {
        @WithName("max-files")
        @WithDefault("600")
        int maxFiles();

        @WithName("io-threads")
        @WithDefault("4")
        int ioThreads();
    }

    interface EchoConfig {
        @WithName("window-millis")
        @WithDefault("3000")
        long windowMillis();
    }

    interface ResolutionConfig {
        /**
         * 0이면 주기적 링크 해석을 하지 않는다.
         */
        @WithName("rescan-interval-seconds")
        @WithDefault("0")
        int rescanIntervalSeconds();

        @WithName("max-passes")
        Optional<Integer> maxPasses();
    }
}
