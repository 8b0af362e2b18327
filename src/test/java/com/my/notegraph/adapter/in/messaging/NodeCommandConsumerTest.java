package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.notegraph.adapter.in.watcher.GraphEventLoop;
import com.my.notegraph.domain.exception.MarkdownParseException;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.LoadOutcome;
import com.my.notegraph.domain.model.Position;
import com.my.notegraph.domain.port.in.SaveNodeUseCase;
import com.my.notegraph.domain.port.in.WatchFolderUseCase;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class NodeCommandConsumerTest {

    private SaveNodeUseCase saveNodeUseCase;
    private WatchFolderUseCase watchFolderUseCase;
    private GraphEventLoop eventLoop;
    private NodeCommandConsumer consumer;

    @BeforeEach
    void setUp() {
        saveNodeUseCase = mock(SaveNodeUseCase.class);
        watchFolderUseCase = mock(WatchFolderUseCase.class);
        eventLoop = new GraphEventLoop();
        consumer = new NodeCommandConsumer(saveNodeUseCase, watchFolderUseCase, eventLoop, new ObjectMapper());
    }

    private void send(String json) {
        consumer.consume(Message.of(json)).await().indefinitely();
    }

    @Test
    void saveRunsOnEventLoop() {
        AtomicReference<Boolean> onLoop = new AtomicReference<>(false);
        when(saveNodeUseCase.saveMarkdown(anyString(), anyString())).thenAnswer(invocation -> {
            onLoop.set(eventLoop.isLoopThread());
            return GraphDelta.empty();
        });

        send("{\"command\":\"save\",\"nodeId\":\"/vault/a.md\",\"content\":\"# A\\n\\n[[b]]\"}");

        verify(saveNodeUseCase).saveMarkdown("/vault/a.md", "# A\n\n[[b]]");
        assertThat(onLoop.get()).isTrue();
    }

    @Test
    void deleteIsDispatched() {
        when(saveNodeUseCase.delete(anyString())).thenReturn(GraphDelta.empty());

        send("{\"command\":\"delete\",\"nodeId\":\"/vault/a.md\"}");

        verify(saveNodeUseCase).delete("/vault/a.md");
    }

    @Test
    void savePositionsIsDispatched() {
        when(saveNodeUseCase.savePositions(any())).thenReturn(GraphDelta.empty());

        send("{\"command\":\"savePositions\",\"positions\":{\"/vault/a.md\":{\"x\":1.5,\"y\":-2}}}");

        verify(saveNodeUseCase).savePositions(Map.of("/vault/a.md", new Position(1.5, -2)));
    }

    @Test
    void readPathCommandsAreDispatched() {
        when(watchFolderUseCase.addReadPath(anyString()))
                .thenReturn(new LoadOutcome.FileLimitExceeded<>(20_001, 20_000));
        when(watchFolderUseCase.removeReadPath(anyString())).thenReturn(GraphDelta.empty());

        send("{\"command\":\"addReadPath\",\"directory\":\"/vault/lib\"}");
        send("{\"command\":\"removeReadPath\",\"directory\":\"/vault/lib\"}");

        verify(watchFolderUseCase).addReadPath("/vault/lib");
        verify(watchFolderUseCase).removeReadPath("/vault/lib");
    }

    @Test
    void malformedJsonIsDropped() {
        send("not-json");

        verifyNoInteractions(saveNodeUseCase, watchFolderUseCase);
    }

    @Test
    void unknownCommandIsDropped() {
        send("{\"command\":\"rename\",\"nodeId\":\"/vault/a.md\"}");

        verifyNoInteractions(saveNodeUseCase, watchFolderUseCase);
    }

    @Test
    void failingSaveDoesNotFailTheMessage() {
        when(saveNodeUseCase.saveMarkdown(anyString(), anyString()))
                .thenThrow(new MarkdownParseException("/vault/a.md", "프론트매터 YAML을 해석할 수 없습니다", null));

        assertThatCode(() -> send("{\"command\":\"save\",\"nodeId\":\"/vault/a.md\",\"content\":\"---\\n[x\"}"))
                .doesNotThrowAnyException();
        verify(saveNodeUseCase, never()).delete(anyString());
    }
}
