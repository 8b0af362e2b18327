package com.my.notegraph.adapter.in.watcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GraphEventLoopTest {

    private final GraphEventLoop loop = new GraphEventLoop();

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void callRunsTaskOnLoopThread() {
        String threadName = loop.call(() -> Thread.currentThread().getName());

        assertThat(threadName).isEqualTo("graph-event-loop");
        assertThat(loop.isLoopThread()).isFalse();
    }

    @Test
    void nestedCallRunsInlineWithoutDeadlock() {
        int result = loop.call(() -> loop.call(() -> 21) * 2);

        assertThat(result).isEqualTo(42);
    }

    @Test
    void failingTaskDoesNotStopLoop() {
        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });

        assertThat(loop.submit(() -> "alive").join()).isEqualTo("alive");
    }

    @Test
    void tasksRunInSubmissionOrder() {
        StringBuilder order = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            int n = i;
            loop.execute(() -> order.append(n));
        }

        assertThat(loop.call(order::toString)).isEqualTo("01234");
    }

    @Test
    void scheduledTaskRepeats() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);

        loop.scheduleWithFixedDelay(latch::countDown, 0, 10, TimeUnit.MILLISECONDS);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
