package com.my.notegraph.config;

import com.my.notegraph.domain.model.VaultLayout;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 설정값을 {@link VaultLayout}으로 바꾼다. 상대 경로는 감시 폴더 기준으로 해석한다.
 */
public final class VaultLayouts {

    private VaultLayouts() {
    }

    public static Optional<VaultLayout> fromConfig(AppConfig.PathsConfig paths) {
        if (paths.watchedFolder().isEmpty()) {
            return Optional.empty();
        }
        Path watched = Path.of(paths.watchedFolder().get());
        String writePath = paths.writePath()
                .map(path -> watched.resolve(path).toString())
                .orElse(watched.toString());
        List<String> readPaths = paths.readPaths().orElse(List.of()).stream()
                .map(path -> watched.resolve(path).toString())
                .toList();
        return Optional.of(VaultLayout.of(watched.toString(), writePath, readPaths));
    }
}
