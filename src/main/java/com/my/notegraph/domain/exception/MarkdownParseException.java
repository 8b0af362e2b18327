package com.my.notegraph.domain.exception;

/**
 * 파일 내용을 노드로 파싱할 수 없을 때 발생한다. 폴드 단계에서 잡혀 해당 파일만 건너뛴다.
 */
public class MarkdownParseException extends RuntimeException {

    private final String path;

    public MarkdownParseException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
