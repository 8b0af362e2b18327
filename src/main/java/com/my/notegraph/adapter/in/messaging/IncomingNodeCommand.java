package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.notegraph.domain.exception.InvalidNodeCommandException;
import com.my.notegraph.domain.model.Position;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * node-commands 채널의 JSON 메시지. 에디터와 UI가 노드 저장, 삭제, 위치 저장, eager 디렉터리 추가/제거를 요청한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingNodeCommand(String command,
                                  String nodeId,
                                  String content,
                                  Map<String, PositionValue> positions,
                                  String directory) {

    private static final Pattern ABSOLUTE_PATH = Pattern.compile("^(/|[A-Za-z]:[/\\\\])");

    public NodeCommand toNodeCommand() {
        if (command == null || command.isBlank()) {
            throw new InvalidNodeCommandException("command가 비어 있습니다.");
        }
        NodeCommand.Type type = Arrays.stream(NodeCommand.Type.values())
                .filter(candidate -> candidate.wireName().equalsIgnoreCase(command.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidNodeCommandException("알 수 없는 command입니다: " + command));

        return switch (type) {
            case SAVE -> {
                if (content == null) {
                    throw new InvalidNodeCommandException("save 명령에는 content가 필요합니다.");
                }
                yield new NodeCommand(type, requireAbsolute("nodeId", nodeId), content, null);
            }
            case DELETE -> new NodeCommand(type, requireAbsolute("nodeId", nodeId), null, null);
            case SAVE_POSITIONS -> new NodeCommand(type, null, null, toPositions());
            case ADD_READ_PATH, REMOVE_READ_PATH -> new NodeCommand(type, requireAbsolute("directory", directory), null, null);
        };
    }

    private Map<String, Position> toPositions() {
        if (positions == null || positions.isEmpty()) {
            throw new InvalidNodeCommandException("savePositions 명령에는 positions가 필요합니다.");
        }
        Map<String, Position> converted = new LinkedHashMap<>();
        positions.forEach((id, value) -> {
            if (value == null || value.x() == null || value.y() == null) {
                throw new InvalidNodeCommandException("position은 x, y를 가져야 합니다: " + id);
            }
            converted.put(requireAbsolute("positions 키", id), new Position(value.x(), value.y()));
        });
        return converted;
    }

    private static String requireAbsolute(String field, String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidNodeCommandException(field + "가 비어 있습니다.");
        }
        if (!ABSOLUTE_PATH.matcher(path).find()) {
            throw new InvalidNodeCommandException("절대 경로가 아닙니다: " + path);
        }
        return path;
    }

    public record PositionValue(Double x, Double y) {
    }
}
