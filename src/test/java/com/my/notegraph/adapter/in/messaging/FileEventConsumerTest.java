package com.my.notegraph.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.notegraph.adapter.in.watcher.GraphEventLoop;
import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.FsEventType;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.port.in.HandleFileEventUseCase;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FileEventConsumerTest {

    private HandleFileEventUseCase useCase;
    private GraphEventLoop eventLoop;
    private FileEventConsumer consumer;

    @BeforeEach
    void setUp() {
        useCase = mock(HandleFileEventUseCase.class);
        eventLoop = new GraphEventLoop();
        consumer = new FileEventConsumer(useCase, eventLoop, new ObjectMapper());
    }

    @Test
    void validMessageIsHandledOnEventLoop() {
        AtomicReference<Boolean> onLoop = new AtomicReference<>(false);
        when(useCase.handle(any())).thenAnswer(invocation -> {
            onLoop.set(eventLoop.isLoopThread());
            return GraphDelta.empty();
        });

        consumer.consume(Message.of("{\"absolutePath\":\"/vault/a.md\",\"content\":\"# A\",\"eventType\":\"Changed\"}"))
                .await().indefinitely();

        ArgumentCaptor<FileSystemEvent> captor = ArgumentCaptor.forClass(FileSystemEvent.class);
        verify(useCase).handle(captor.capture());
        assertThat(captor.getValue().nodeId()).isEqualTo("/vault/a.md");
        assertThat(captor.getValue().type()).isEqualTo(FsEventType.CHANGED);
        assertThat(onLoop.get()).isTrue();
    }

    @Test
    void malformedJsonIsDropped() {
        consumer.consume(Message.of("not-json")).await().indefinitely();

        verify(useCase, never()).handle(any());
    }

    @Test
    void invalidEventIsDropped() {
        consumer.consume(Message.of("{\"absolutePath\":\"relative.md\",\"content\":\"x\",\"eventType\":\"Added\"}"))
                .await().indefinitely();

        verify(useCase, never()).handle(any());
    }
}
