package com.my.notegraph.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 감시 중인 프로젝트 폴더와 즉시 로드되는(eager) 디렉터리 구성.
 * watchedFolder는 resolve-on-link 검색 루트이며, eager 디렉터리 밖의 파일은 링크될 때만 로드된다.
 */
public record VaultLayout(Optional<String> watchedFolder, String writePath, List<String> readPaths) {

    public VaultLayout {
        Objects.requireNonNull(watchedFolder, "watchedFolder");
        Objects.requireNonNull(writePath, "writePath");
        watchedFolder = watchedFolder.map(NodeIds::normalize);
        writePath = NodeIds.normalize(writePath);
        readPaths = readPaths == null
                ? List.of()
                : readPaths.stream().map(NodeIds::normalize).distinct().toList();
    }

    public static VaultLayout of(String watchedFolder, String writePath, List<String> readPaths) {
        return new VaultLayout(Optional.of(watchedFolder), writePath, readPaths);
    }

    public static VaultLayout single(String directory) {
        return new VaultLayout(Optional.of(directory), directory, List.of());
    }

    public List<String> eagerRoots() {
        LinkedHashSet<String> roots = new LinkedHashSet<>();
        roots.add(writePath);
        roots.addAll(readPaths);
        return List.copyOf(roots);
    }

    /**
     * 파일 감시 대상. 감시 폴더 하위 전체와, 감시 폴더 밖에 있는 eager 디렉터리.
     */
    public List<String> watchRoots() {
        LinkedHashSet<String> roots = new LinkedHashSet<>();
        watchedFolder.ifPresent(roots::add);
        for (String root : eagerRoots()) {
            boolean covered = watchedFolder.map(folder -> NodeIds.isUnder(root, folder)).orElse(false);
            if (!covered) {
                roots.add(root);
            }
        }
        return List.copyOf(roots);
    }

    public boolean isEager(String nodeId) {
        return eagerRoots().stream().anyMatch(root -> NodeIds.isUnder(nodeId, root));
    }

    public VaultLayout withReadPath(String path) {
        List<String> next = new ArrayList<>(readPaths);
        next.add(path);
        return new VaultLayout(watchedFolder, writePath, next);
    }

    public VaultLayout withoutReadPath(String path) {
        String normalized = NodeIds.normalize(path);
        List<String> next = readPaths.stream().filter(p -> !p.equals(normalized)).toList();
        return new VaultLayout(watchedFolder, writePath, next);
    }
}
