package com.my.notegraph.domain.model;

/**
 * 그래프 캔버스 위의 2D 좌표.
 */
public record Position(double x, double y) {

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
