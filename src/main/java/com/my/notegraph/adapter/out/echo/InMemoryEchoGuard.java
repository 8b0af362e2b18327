package com.my.notegraph.adapter.out.echo;

import com.my.notegraph.config.AppConfig;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.port.out.ClockPort;
import com.my.notegraph.domain.port.out.EchoGuard;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 최근 자체 쓰기를 시간 창 동안 기억한다. 기록은 일치 여부와 관계없이 창이 지나면 만료된다.
 * <p>
 * 관찰된 델타의 첫 연산(이벤트를 일으킨 파일)을 기록과 비교한다. upsert는 본문과 메타데이터까지 같아야 한다.
 */
@ApplicationScoped
public class InMemoryEchoGuard implements EchoGuard {

    private final Duration window;
    private final ClockPort clockPort;
    private final List<Entry> recent = new ArrayList<>();

    @Inject
    public InMemoryEchoGuard(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofMillis(appConfig.echo().windowMillis()), clockPort);
    }

    public InMemoryEchoGuard(Duration window, ClockPort clockPort) {
        this.window = window;
        this.clockPort = clockPort;
    }

    @Override
    public synchronized void recordOwnWrite(GraphDelta delta) {
        cleanup();
        Instant now = clockPort.now();
        delta.operations().forEach(operation -> recent.add(new Entry(operation, now)));
    }

    @Override
    public synchronized boolean isOwnRecentWrite(GraphDelta delta) {
        cleanup();
        return delta.primary()
                .map(observed -> recent.stream().anyMatch(entry -> sameWrite(entry.operation(), observed)))
                .orElse(false);
    }

    synchronized int size() {
        cleanup();
        return recent.size();
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(window);
        recent.removeIf(entry -> entry.recordedAt().isBefore(cutoff));
    }

    private static boolean sameWrite(NodeDelta recorded, NodeDelta observed) {
        if (!recorded.nodeId().equals(observed.nodeId())) {
            return false;
        }
        if (recorded instanceof NodeDelta.DeleteNode) {
            return observed instanceof NodeDelta.DeleteNode;
        }
        if (recorded instanceof NodeDelta.UpsertNode written && observed instanceof NodeDelta.UpsertNode seen) {
            return sameContent(written.node(), seen.node());
        }
        return false;
    }

    private static boolean sameContent(GraphNode written, GraphNode seen) {
        return written.body().equals(seen.body())
                && written.metadata().color().equals(seen.metadata().color())
                && written.metadata().position().equals(seen.metadata().position())
                && written.metadata().contextNode() == seen.metadata().contextNode()
                && Objects.equals(written.metadata().containedNodeIds(), seen.metadata().containedNodeIds());
    }

    private record Entry(NodeDelta operation, Instant recordedAt) {
    }
}
