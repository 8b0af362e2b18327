package com.my.notegraph.domain.model;

import java.util.Objects;

/**
 * 노드의 outgoing 엣지. source는 소유 노드이며 target은 그래프에 존재하는 노드 ID여야 한다.
 */
public record Edge(String targetId, String label) {
    public Edge {
        Objects.requireNonNull(targetId, "targetId");
        label = label == null ? "" : label;
    }
}
