package com.my.notegraph.domain.model;

import java.util.Objects;

/**
 * 스캔 중 디스크에서 읽은 파일 하나. 이미지 파일의 content는 빈 문자열이다.
 */
public record FileSnapshot(String path, String content) {
    public FileSnapshot {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }

    public FileSystemEvent toAddedEvent() {
        return FileSystemEvent.added(path, content);
    }
}
