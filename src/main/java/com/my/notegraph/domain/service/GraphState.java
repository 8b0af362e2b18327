package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.VaultLayout;

import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 그래프 상태를 전역 가변 변수가 아닌 하나의 소유자에 두고, 변경은 이벤트 루프 스레드에서만 일어나도록 하기 위함.
 * <p>
 * 읽기는 어느 스레드에서나 가능하다(헬스 체크 등). 쓰기는 단일 작성자 규칙을 따른다.
 */
public class GraphState {

    private volatile Graph graph = Graph.empty();
    private volatile VaultLayout layout;

    public Graph current() {
        return graph;
    }

    public Optional<VaultLayout> layout() {
        return Optional.ofNullable(layout);
    }

    public Graph apply(GraphDelta delta) {
        graph = graph.apply(delta);
        return graph;
    }

    public void reset(VaultLayout newLayout, Graph newGraph) {
        this.layout = Objects.requireNonNull(newLayout, "layout");
        this.graph = Objects.requireNonNull(newGraph, "graph");
    }

    public void updateLayout(VaultLayout newLayout) {
        this.layout = Objects.requireNonNull(newLayout, "layout");
    }
}
