package com.my.notegraph.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 디스크에서 관찰된 단일 변경. Added/Changed 이벤트는 이미 읽어 둔 파일 내용을 함께 가진다.
 * 텍스트가 아닌 파일(이미지)은 내용이 비어 있다.
 */
public record FileSystemEvent(String absolutePath, Optional<String> content, FsEventType type) {

    public FileSystemEvent {
        Objects.requireNonNull(absolutePath, "absolutePath");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(type, "type");
        absolutePath = NodeIds.normalize(absolutePath);
    }

    public static FileSystemEvent added(String absolutePath, String content) {
        return new FileSystemEvent(absolutePath, Optional.ofNullable(content), FsEventType.ADDED);
    }

    public static FileSystemEvent changed(String absolutePath, String content) {
        return new FileSystemEvent(absolutePath, Optional.ofNullable(content), FsEventType.CHANGED);
    }

    public static FileSystemEvent deleted(String absolutePath) {
        return new FileSystemEvent(absolutePath, Optional.empty(), FsEventType.DELETED);
    }

    public String nodeId() {
        return absolutePath;
    }
}
