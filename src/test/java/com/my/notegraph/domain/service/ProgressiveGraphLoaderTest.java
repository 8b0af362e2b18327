package com.my.notegraph.domain.service;

import com.my.notegraph.adapter.out.filesystem.FileSystemAdapter;
import com.my.notegraph.adapter.out.layout.NeighborLayoutAdapter;
import com.my.notegraph.adapter.out.markdown.FrontmatterMarkdownAdapter;
import com.my.notegraph.domain.model.FileSnapshot;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.LoadOutcome;
import com.my.notegraph.domain.model.NodeDelta;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.port.out.FilePort;
import com.my.notegraph.support.Graphs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.my.notegraph.support.Graphs.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressiveGraphLoaderTest {

    @TempDir
    Path vault;

    private GraphDeltaComputer computer;
    private ProgressiveGraphLoader loader;

    @BeforeEach
    void setUp() {
        computer = new GraphDeltaComputer(new FrontmatterMarkdownAdapter());
        loader = new ProgressiveGraphLoader(new FileSystemAdapter(2), computer, new NeighborLayoutAdapter(), 600);
    }

    private String write(String relative, String content) throws IOException {
        Path file = vault.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return NodeIds.normalize(file);
    }

    private Graph loadVault() {
        LoadOutcome<Graph> outcome = loader.load(List.of(NodeIds.normalize(vault)));
        assertThat(outcome.isLoaded()).isTrue();
        return ((LoadOutcome.Loaded<Graph>) outcome).value();
    }

    @Test
    void twoNotesWithDanglingLinkBuildTwoNodes() throws IOException {
        String a = write("a.md", "Links to [[b]].");
        String b = write("b.md", "Links to [[a]] and [[c]].");

        Graph graph = loadVault();

        assertThat(graph.size()).isEqualTo(2);
        assertThat(node(graph, a).edgeTargets()).containsExactly(b);
        assertThat(node(graph, b).edgeTargets()).containsExactly(a);
    }

    @Test
    void everyDiscoveryOrderYieldsTheSameEdges() {
        List<FileSnapshot> files = List.of(
                new FileSnapshot("/v/a.md", "[[b]] [[sub/c]]"),
                new FileSnapshot("/v/b.md", "[[c]]"),
                new FileSnapshot("/v/c.md", "# top c"),
                new FileSnapshot("/v/sub/c.md", "[[a]]"));

        Graph reference = loader.fold(Graph.empty(), files);
        for (List<FileSnapshot> permutation : permutations(files)) {
            Graph graph = loader.fold(Graph.empty(), permutation);
            assertThat(Graphs.edgesById(graph)).isEqualTo(Graphs.edgesById(reference));
        }
        assertThat(node(reference, "/v/a.md").edgeTargets()).containsExactly("/v/b.md", "/v/sub/c.md");
        assertThat(node(reference, "/v/b.md").edgeTargets()).containsExactly("/v/c.md");
    }

    @Test
    void rescanOfUnchangedDirectoryIsIdempotent() throws IOException {
        write("a.md", "# A\n[[b]]");
        write("nested/b.md", "---\ncolor: blue\n---\n# B\n[[a]]");
        write("nested/pic.png", "not really a png");

        Graph first = loadVault();
        Graph second = loadVault();

        assertThat(second).isEqualTo(first);
        assertThat(first.nodes()).allSatisfy(node -> assertThat(node.metadata().position()).isPresent());
    }

    @Test
    void tooManyFilesFailsBeforeReadingAnything() {
        FilePort filePort = mock(FilePort.class);
        when(filePort.scanNoteFiles(anyString())).thenReturn(List.of("/v/a.md", "/v/b.md", "/v/c.md"));
        ProgressiveGraphLoader limited = new ProgressiveGraphLoader(filePort, computer, new NeighborLayoutAdapter(), 2);

        LoadOutcome<Graph> outcome = limited.load(List.of("/v"));

        assertThat(outcome).isEqualTo(LoadOutcome.fileLimitExceeded(3, 2));
        verify(filePort, never()).readAll(any());
        verify(filePort, never()).read(anyString());
    }

    @Test
    void exactlyAtLimitLoads() throws IOException {
        write("a.md", "a");
        write("b.md", "b");
        ProgressiveGraphLoader limited = new ProgressiveGraphLoader(
                new FileSystemAdapter(1), computer, new NeighborLayoutAdapter(), 2);

        assertThat(limited.load(List.of(NodeIds.normalize(vault))).isLoaded()).isTrue();
    }

    @Test
    void imagesBecomeNodesThatNotesCanLinkTo() throws IOException {
        String note = write("a.md", "Diagram: [[pic.png]]");
        String image = write("img/pic.png", "binary");

        Graph graph = loadVault();

        assertThat(node(graph, image).title()).isEqualTo("pic.png");
        assertThat(node(graph, image).body()).isEmpty();
        assertThat(node(graph, note).edgeTargets()).containsExactly(image);
    }

    @Test
    void additiveLoadCountsOnlyNewFilesAndHealsExistingNodes() throws IOException {
        String a = write("notes/a.md", "[[b]]");
        String b = write("docs/b.md", "# B");
        Graph existing = ((LoadOutcome.Loaded<Graph>) loader.load(List.of(NodeIds.normalize(vault.resolve("notes")))))
                .value();
        assertThat(node(existing, a).edgeTargets()).isEmpty();

        LoadOutcome<GraphDelta> outcome = loader.loadAdditively(NodeIds.normalize(vault.resolve("docs")), existing);

        GraphDelta delta = ((LoadOutcome.Loaded<GraphDelta>) outcome).value();
        assertThat(delta.upsertedIds()).containsExactlyInAnyOrder(a, b);
        Graph after = existing.apply(delta);
        assertThat(node(after, a).edgeTargets()).containsExactly(b);
        assertThat(node(after, b).metadata().position()).isPresent();
    }

    @Test
    void additiveLoadDoesNotDoubleCountFilesAlreadyInGraph() throws IOException {
        write("a.md", "a");
        write("b.md", "b");
        ProgressiveGraphLoader limited = new ProgressiveGraphLoader(
                new FileSystemAdapter(1), computer, new NeighborLayoutAdapter(), 2);
        Graph existing = ((LoadOutcome.Loaded<Graph>) limited.load(List.of(NodeIds.normalize(vault)))).value();

        LoadOutcome<GraphDelta> again = limited.loadAdditively(NodeIds.normalize(vault), existing);
        assertThat(again.isLoaded()).isTrue();

        write("sub/c.md", "c");
        LoadOutcome<GraphDelta> over = limited.loadAdditively(NodeIds.normalize(vault.resolve("sub")), existing);
        assertThat(over).isEqualTo(LoadOutcome.fileLimitExceeded(3, 2));
    }

    @Test
    void malformedFileIsSkippedWithoutAbortingTheScan() throws IOException {
        write("good.md", "# Good");
        String bad = write("bad.md", "---\nposition: [1, 2\n---\n# Bad");

        Graph graph = loadVault();

        assertThat(graph.size()).isEqualTo(1);
        assertThat(graph.contains(bad)).isFalse();
    }

    @Test
    void hiddenDirectoriesAreNotScanned() throws IOException {
        write(".git/x.md", "x");
        write("node_modules/pkg/readme.md", "x");
        String kept = write("kept.md", "x");

        assertThat(loadVault().ids()).containsExactly(kept);
    }

    @Test
    void collapsedDeltaKeepsPreviousNodes() throws IOException {
        String a = write("notes/a.md", "[[b]]");
        write("docs/b.md", "# B");
        Graph existing = ((LoadOutcome.Loaded<Graph>) loader.load(List.of(NodeIds.normalize(vault.resolve("notes")))))
                .value();

        GraphDelta delta = ((LoadOutcome.Loaded<GraphDelta>) loader
                .loadAdditively(NodeIds.normalize(vault.resolve("docs")), existing)).value();

        NodeDelta.UpsertNode healed = delta.operations().stream()
                .filter(op -> op.nodeId().equals(a))
                .map(NodeDelta.UpsertNode.class::cast)
                .findFirst()
                .orElseThrow();
        assertThat(healed.previousNode()).contains(node(existing, a));
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.isEmpty()) {
            List<List<T>> single = new ArrayList<>();
            single.add(new ArrayList<>());
            return single;
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                tail.add(0, head);
                result.add(tail);
            }
        }
        return result;
    }
}
