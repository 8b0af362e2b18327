package com.my.notegraph.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 프론트매터에서 온 UI 메타데이터. 값이 없을 수 있는 필드는 모두 Optional로 표현한다.
 */
public record NodeMetadata(Optional<String> color,
                           Optional<Position> position,
                           Map<String, Object> extraProperties,
                           boolean contextNode,
                           Optional<List<String>> containedNodeIds) {

    public NodeMetadata {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(containedNodeIds, "containedNodeIds");
        extraProperties = extraProperties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraProperties));
        containedNodeIds = containedNodeIds.map(List::copyOf);
    }

    public static NodeMetadata empty() {
        return new NodeMetadata(Optional.empty(), Optional.empty(), Map.of(), false, Optional.empty());
    }

    public NodeMetadata withPosition(Position newPosition) {
        return new NodeMetadata(color, Optional.of(newPosition), extraProperties, contextNode, containedNodeIds);
    }

    /**
     * 새 값이 있으면 새 값을, 없으면 이전 값을 유지한다. color와 position에만 적용된다.
     */
    public NodeMetadata mergeMissingFrom(NodeMetadata previous) {
        return new NodeMetadata(
                color.or(previous::color),
                position.or(previous::position),
                extraProperties,
                contextNode,
                containedNodeIds
        );
    }
}
