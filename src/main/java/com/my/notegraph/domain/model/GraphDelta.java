package com.my.notegraph.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 순서가 있는 upsert/delete 연산 목록. 엔진과 하위 협력자 사이의 브로드캐스트 단위이며,
 * 소비자는 반드시 주어진 순서대로 적용해야 한다.
 */
public record GraphDelta(List<NodeDelta> operations) {

    private static final GraphDelta EMPTY = new GraphDelta(List.of());

    public GraphDelta {
        Objects.requireNonNull(operations, "operations");
        operations = List.copyOf(operations);
    }

    public static GraphDelta empty() {
        return EMPTY;
    }

    public static GraphDelta of(NodeDelta... operations) {
        return new GraphDelta(List.of(operations));
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    public Optional<NodeDelta> primary() {
        return operations.isEmpty() ? Optional.empty() : Optional.of(operations.get(0));
    }

    public GraphDelta concat(GraphDelta other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<NodeDelta> merged = new ArrayList<>(operations);
        merged.addAll(other.operations());
        return new GraphDelta(merged);
    }

    /**
     * upsert된 노드 ID를 처음 등장한 순서대로 반환한다.
     */
    public Set<String> upsertedIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (NodeDelta operation : operations) {
            if (operation instanceof NodeDelta.UpsertNode upsert) {
                ids.add(upsert.nodeId());
            }
        }
        return ids;
    }
}
