package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.notegraph.adapter.in.watcher.GraphEventLoop;
import com.my.notegraph.domain.exception.InvalidFileEventException;
import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.port.in.HandleFileEventUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: 외부 감시자(다른 프로세스)가 보낸 파일 이벤트를 로컬 감시 이벤트와 같은 이벤트 루프로 진입시키기 위함.
 */
@ApplicationScoped
public class FileEventConsumer {

    private static final Logger log = Logger.getLogger(FileEventConsumer.class);

    private final HandleFileEventUseCase handleFileEventUseCase;
    private final GraphEventLoop eventLoop;
    private final ObjectMapper objectMapper;

    @Inject
    public FileEventConsumer(HandleFileEventUseCase handleFileEventUseCase,
                             GraphEventLoop eventLoop,
                             ObjectMapper objectMapper) {
        this.handleFileEventUseCase = handleFileEventUseCase;
        this.eventLoop = eventLoop;
        this.objectMapper = objectMapper;
    }

    @Incoming("file-events")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            FileSystemEvent event;
            try {
                event = objectMapper.readValue(message.getPayload(), IncomingFileEvent.class).toFileSystemEvent();
            } catch (IOException | InvalidFileEventException e) {
                log.warnf("파일 이벤트 파싱 실패로 처리 중단: %s", e.getMessage());
                return null;
            }
            MDC.put("nodeId", event.nodeId());
            MDC.put("eventType", event.type().name());
            try {
                GraphDelta applied = eventLoop.call(() -> handleFileEventUseCase.handle(event));
                log.debugf("파일 이벤트 처리 완료: 연산 %d개", applied.size());
            } finally {
                MDC.remove("nodeId");
                MDC.remove("eventType");
            }
            return null;
        }).replaceWithVoid();
    }
}
