package com.my.notegraph.domain.exception;

/**
 * 외부에서 들어온 파일 이벤트가 계약을 위반했을 때 발생한다.
 */
public class InvalidFileEventException extends RuntimeException {
    public InvalidFileEventException(String message) {
        super(message);
    }

    public InvalidFileEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
