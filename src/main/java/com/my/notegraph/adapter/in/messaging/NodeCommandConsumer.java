package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.notegraph.adapter.in.watcher.GraphEventLoop;
import com.my.notegraph.domain.exception.InvalidNodeCommandException;
import com.my.notegraph.domain.exception.MarkdownParseException;
import com.my.notegraph.domain.exception.NoteWriteException;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.port.in.SaveNodeUseCase;
import com.my.notegraph.domain.port.in.WatchFolderUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.concurrent.CompletionException;

/**
 * 왜: 에디터와 UI의 쓰기 요청을 파일 이벤트와 같은 이벤트 루프에서 실행하여 그래프의 단일 작성자 규칙을 지키기 위함.
 */
@ApplicationScoped
public class NodeCommandConsumer {

    private static final Logger log = Logger.getLogger(NodeCommandConsumer.class);

    private final SaveNodeUseCase saveNodeUseCase;
    private final WatchFolderUseCase watchFolderUseCase;
    private final GraphEventLoop eventLoop;
    private final ObjectMapper objectMapper;

    @Inject
    public NodeCommandConsumer(SaveNodeUseCase saveNodeUseCase,
                               WatchFolderUseCase watchFolderUseCase,
                               GraphEventLoop eventLoop,
                               ObjectMapper objectMapper) {
        this.saveNodeUseCase = saveNodeUseCase;
        this.watchFolderUseCase = watchFolderUseCase;
        this.eventLoop = eventLoop;
        this.objectMapper = objectMapper;
    }

    @Incoming("node-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            NodeCommand command;
            try {
                command = objectMapper.readValue(message.getPayload(), IncomingNodeCommand.class).toNodeCommand();
            } catch (IOException | InvalidNodeCommandException e) {
                log.warnf("노드 명령 파싱 실패로 처리 중단: %s", e.getMessage());
                return null;
            }
            MDC.put("nodeId", command.target());
            MDC.put("eventType", command.type().wireName());
            try {
                GraphDelta applied = eventLoop.call(() -> execute(command));
                log.debugf("노드 명령 처리 완료: 연산 %d개", applied.size());
            } catch (CompletionException e) {
                warnFailure(e.getCause() == null ? e : e.getCause());
            } catch (MarkdownParseException | NoteWriteException e) {
                warnFailure(e);
            } finally {
                MDC.remove("nodeId");
                MDC.remove("eventType");
            }
            return null;
        }).replaceWithVoid();
    }

    private GraphDelta execute(NodeCommand command) {
        return switch (command.type()) {
            case SAVE -> saveNodeUseCase.saveMarkdown(command.target(), command.content());
            case DELETE -> saveNodeUseCase.delete(command.target());
            case SAVE_POSITIONS -> saveNodeUseCase.savePositions(command.positions());
            case ADD_READ_PATH -> watchFolderUseCase.addReadPath(command.target())
                    .fold(delta -> delta, failure -> GraphDelta.empty());
            case REMOVE_READ_PATH -> watchFolderUseCase.removeReadPath(command.target());
        };
    }

    private void warnFailure(Throwable e) {
        log.warnf("노드 명령 처리 실패: %s", e.getMessage());
    }
}
