package com.my.notegraph.adapter.in.watcher;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 왜: 그래프를 바꾸는 모든 작업(감시 이벤트, 메시지, 초기 로드, 주기적 링크 해석)을 한 스레드에서 순서대로 실행하기 위함.
 */
@ApplicationScoped
public class GraphEventLoop {

    private static final Logger log = Logger.getLogger(GraphEventLoop.class);
    private static final String THREAD_NAME = "graph-event-loop";

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public GraphEventLoop() {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    /**
     * 작업을 루프에서 실행하고 끝날 때까지 기다린다. 루프 스레드 안에서 호출되면 바로 실행한다.
     */
    public <T> T call(Supplier<T> task) {
        if (isLoopThread()) {
            return task.get();
        }
        return submit(task).join();
    }

    public void execute(Runnable task) {
        executor.execute(() -> runSafely(task));
    }

    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, long initialDelay, long delay, TimeUnit unit) {
        return executor.scheduleWithFixedDelay(() -> runSafely(task), initialDelay, delay, unit);
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.errorf(e, "그래프 이벤트 처리 중 예외: %s", e.getMessage());
        }
    }
}
