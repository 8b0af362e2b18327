package com.my.notegraph.adapter.out.echo;

import com.my.notegraph.config.AppConfig;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.model.NodeMetadata;
import com.my.notegraph.domain.model.Position;
import com.my.notegraph.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEchoGuardTest {

    private MutableClock clock;
    private InMemoryEchoGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        guard = new InMemoryEchoGuard(new TestConfig(), clock);
    }

    private static GraphDelta upsert(String id, String body) {
        GraphNode node = new GraphNode(id, "t", body, List.of(), List.of(), NodeMetadata.empty());
        return GraphDelta.of(new NodeDelta.UpsertNode(node, Optional.empty()));
    }

    @Test
    void recordedWriteMatchesObservedDeltaWithSameContent() {
        guard.recordOwnWrite(upsert("/v/a.md", "# A"));

        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A"))).isTrue();
    }

    @Test
    void matchIsRepeatableWithinWindow() {
        guard.recordOwnWrite(upsert("/v/a.md", "# A"));

        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A"))).isTrue();
        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A"))).isTrue();
    }

    @Test
    void differentContentOrNodeIsNotAnEcho() {
        guard.recordOwnWrite(upsert("/v/a.md", "# A"));

        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A changed elsewhere"))).isFalse();
        assertThat(guard.isOwnRecentWrite(upsert("/v/b.md", "# A"))).isFalse();
        assertThat(guard.isOwnRecentWrite(GraphDelta.of(new NodeDelta.DeleteNode("/v/a.md")))).isFalse();
    }

    @Test
    void positionDifferenceIsNotAnEcho() {
        GraphNode node = new GraphNode("/v/a.md", "t", "# A", List.of(), List.of(), NodeMetadata.empty());
        guard.recordOwnWrite(GraphDelta.of(new NodeDelta.UpsertNode(node.withPosition(new Position(1, 2)), Optional.empty())));

        GraphDelta moved = GraphDelta.of(new NodeDelta.UpsertNode(node.withPosition(new Position(5, 5)), Optional.empty()));

        assertThat(guard.isOwnRecentWrite(moved)).isFalse();
    }

    @Test
    void entriesExpireAfterWindow() {
        guard.recordOwnWrite(upsert("/v/a.md", "# A"));

        clock.advance(Duration.ofMillis(1500));
        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A"))).isTrue();

        clock.advance(Duration.ofMillis(1501));
        assertThat(guard.isOwnRecentWrite(upsert("/v/a.md", "# A"))).isFalse();
        assertThat(guard.size()).isZero();
    }

    @Test
    void onlyPrimaryOperationOfObservedDeltaIsCompared() {
        guard.recordOwnWrite(upsert("/v/a.md", "# A"));

        GraphDelta observed = upsert("/v/b.md", "# B").concat(upsert("/v/a.md", "# A"));

        assertThat(guard.isOwnRecentWrite(observed)).isFalse();
    }

    @Test
    void deleteEchoMatchesRecordedDelete() {
        guard.recordOwnWrite(GraphDelta.of(new NodeDelta.DeleteNode("/v/a.md")));

        assertThat(guard.isOwnRecentWrite(GraphDelta.of(new NodeDelta.DeleteNode("/v/a.md")))).isTrue();
        assertThat(guard.isOwnRecentWrite(GraphDelta.empty())).isFalse();
    }

    private static class TestConfig implements AppConfig {
        @Override
        public PathsConfig paths() {
            return new PathsConfig() {
                @Override
                public Optional<String> watchedFolder() {
                    return Optional.empty();
                }

                @Override
                public Optional<String> writePath() {
                    return Optional.empty();
                }

                @Override
                public Optional<List<String>> readPaths() {
                    return Optional.empty();
                }
            };
        }

        @Override
        public LoadingConfig loading() {
            return new LoadingConfig() {
                @Override
                public int maxFiles() {
                    return 600;
                }

                @Override
                public int ioThreads() {
                    return 1;
                }
            };
        }

        @Override
        public EchoConfig echo() {
            return () -> 3000L;
        }

        @Override
        public ResolutionConfig resolution() {
            return new ResolutionConfig() {
                @Override
                public int rescanIntervalSeconds() {
                    return 0;
                }

                @Override
                public Optional<Integer> maxPasses() {
                    return Optional.empty();
                }
            };
        }
    }
}
