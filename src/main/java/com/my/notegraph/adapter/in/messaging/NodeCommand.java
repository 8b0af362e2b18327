package com.my.notegraph.adapter.in.messaging;

import com.my.notegraph.domain.model.Position;

import java.util.Map;
import java.util.Objects;

/**
 * 검증을 마친 노드 명령. target은 노드 ID 또는 디렉터리 경로이며 savePositions에서는 비어 있다.
 */
record NodeCommand(Type type, String target, String content, Map<String, Position> positions) {

    NodeCommand {
        Objects.requireNonNull(type, "type");
        target = target == null ? "" : target;
        positions = positions == null ? Map.of() : Map.copyOf(positions);
    }

    enum Type {
        SAVE("save"),
        DELETE("delete"),
        SAVE_POSITIONS("savePositions"),
        ADD_READ_PATH("addReadPath"),
        REMOVE_READ_PATH("removeReadPath");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        String wireName() {
            return wireName;
        }
    }
}
