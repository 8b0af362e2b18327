package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.notegraph.domain.exception.InvalidFileEventException;
import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.FsEventType;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * file-events 채널의 JSON 메시지. eventType은 Added, Changed, Deleted 중 하나이다(대소문자 무시).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingFileEvent(String absolutePath,
                                String content,
                                String eventType) {

    private static final Pattern ABSOLUTE_PATH = Pattern.compile("^(/|[A-Za-z]:[/\\\\])");

    public FileSystemEvent toFileSystemEvent() {
        if (absolutePath == null || absolutePath.isBlank()) {
            throw new InvalidFileEventException("absolutePath가 비어 있습니다.");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new InvalidFileEventException("eventType이 비어 있습니다.");
        }
        FsEventType type;
        try {
            type = FsEventType.valueOf(eventType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFileEventException("알 수 없는 eventType입니다: " + eventType, e);
        }
        if (!ABSOLUTE_PATH.matcher(absolutePath).find()) {
            throw new InvalidFileEventException("절대 경로가 아닙니다: " + absolutePath);
        }
        if (type != FsEventType.DELETED && content == null) {
            throw new InvalidFileEventException(type + " 이벤트에는 content가 필요합니다.");
        }
        Optional<String> body = type == FsEventType.DELETED ? Optional.empty() : Optional.of(content);
        return new FileSystemEvent(absolutePath, body, type);
    }
}
