package com.my.notegraph.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean strict = LaunchMode.current() == LaunchMode.NORMAL;
        validatePositive("app.loading.max-files", appConfig.loading().maxFiles(), strict);
        validatePositive("app.loading.io-threads", appConfig.loading().ioThreads(), strict);
        validatePositive("app.echo.window-millis", appConfig.echo().windowMillis(), strict);
        if (appConfig.resolution().rescanIntervalSeconds() < 0) {
            fail("app.resolution.rescan-interval-seconds는 0 이상이어야 합니다.", strict);
        }
        appConfig.resolution().maxPasses()
                .filter(passes -> passes < 1)
                .ifPresent(passes -> fail("app.resolution.max-passes는 1 이상이어야 합니다: " + passes, strict));

        if (appConfig.paths().watchedFolder().isEmpty()) {
            log.info("app.paths.watched-folder가 비어 있어 시작 시 폴더를 로드하지 않습니다.");
            return;
        }
        VaultLayouts.fromConfig(appConfig.paths()).ifPresent(layout -> {
            layout.watchedFolder().ifPresent(folder -> validateDirectory("app.paths.watched-folder", folder, strict));
            layout.eagerRoots().forEach(root -> validateDirectory("eager 디렉터리", root, strict));
        });
    }

    private void validatePositive(String name, long value, boolean strict) {
        if (value <= 0) {
            fail("설정값은 0보다 커야 합니다: " + name + "=" + value, strict);
        }
    }

    private void validateDirectory(String name, String path, boolean strict) {
        if (!Files.isDirectory(Path.of(path))) {
            fail("디렉터리가 존재하지 않습니다: " + name + "=" + path, strict);
        }
    }

    private void fail(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
