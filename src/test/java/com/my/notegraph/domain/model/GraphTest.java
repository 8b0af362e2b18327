package com.my.notegraph.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GraphTest {

    private static GraphNode node(String id, String body) {
        return new GraphNode(id, "t", body, List.of(), List.of(), NodeMetadata.empty());
    }

    @Test
    void appliesOperationsInOrder() {
        GraphNode a = node("/v/a.md", "a");
        GraphNode b = node("/v/b.md", "b");
        Graph graph = Graph.empty().apply(GraphDelta.of(
                new NodeDelta.UpsertNode(a, Optional.empty()),
                new NodeDelta.UpsertNode(b, Optional.empty()),
                new NodeDelta.DeleteNode("/v/a.md")));

        assertThat(graph.ids()).containsExactly("/v/b.md");
    }

    @Test
    void applyLeavesOriginalUntouched() {
        Graph before = Graph.of(List.of(node("/v/a.md", "a")));

        Graph after = before.apply(GraphDelta.of(new NodeDelta.DeleteNode("/v/a.md")));

        assertThat(before.contains("/v/a.md")).isTrue();
        assertThat(after.isEmpty()).isTrue();
    }

    @Test
    void contentStripsLinkMarkupKeepingAlias() {
        GraphNode node = node("/v/a.md", "See [[b]] and [[notes/c|the c note]].");

        assertThat(node.content()).isEqualTo("See b and the c note.");
    }

    @Test
    void deltaReportsPrimaryAndUpsertedIds() {
        GraphDelta delta = GraphDelta.of(
                new NodeDelta.DeleteNode("/v/x.md"),
                new NodeDelta.UpsertNode(node("/v/a.md", ""), Optional.empty()));

        assertThat(delta.primary()).contains(new NodeDelta.DeleteNode("/v/x.md"));
        assertThat(delta.upsertedIds()).containsExactly("/v/a.md");
        assertThat(GraphDelta.empty().primary()).isEmpty();
    }

    @Test
    void nodeIdsNormalizeSeparatorsAndDotSegments() {
        assertThat(NodeIds.normalize("/v/notes/../a.md")).isEqualTo("/v/a.md");
        assertThat(NodeIds.normalize("/v\\sub\\b.md")).isEqualTo("/v/sub/b.md");
        assertThat(NodeIds.baseName("/v/Sub/Note.MD")).isEqualTo("note");
        assertThat(NodeIds.isUnder("/v/sub/b.md", "/v/sub")).isTrue();
        assertThat(NodeIds.isUnder("/v/subway/b.md", "/v/sub")).isFalse();
    }
}
