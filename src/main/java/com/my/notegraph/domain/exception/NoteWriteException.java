package com.my.notegraph.domain.exception;

public class NoteWriteException extends RuntimeException {
    public NoteWriteException(String message) {
        super(message);
    }

    public NoteWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
