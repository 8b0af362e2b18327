package com.my.notegraph.domain.exception;

/**
 * 외부에서 들어온 노드 명령이 계약을 위반했을 때 발생한다.
 */
public class InvalidNodeCommandException extends RuntimeException {
    public InvalidNodeCommandException(String message) {
        super(message);
    }
}
