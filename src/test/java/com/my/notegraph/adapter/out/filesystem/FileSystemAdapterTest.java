package com.my.notegraph.adapter.out.filesystem;

import com.my.notegraph.domain.model.FileSnapshot;
import com.my.notegraph.domain.model.NodeIds;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemAdapterTest {

    @TempDir
    Path root;

    private FileSystemAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FileSystemAdapter(2);
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private String write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return NodeIds.normalize(file);
    }

    @Test
    void scanReturnsSupportedFilesRecursivelyInNameOrder() throws IOException {
        String b = write("b.md", "b");
        String a = write("a.md", "a");
        String nested = write("sub/deep/c.md", "c");
        String image = write("sub/pic.png", "");
        write("notes.txt", "ignored");

        List<String> files = adapter.scanNoteFiles(NodeIds.normalize(root));

        assertThat(files).containsExactly(a, b, nested, image);
    }

    @Test
    void scanSkipsHiddenDirectoriesAndNodeModules() throws IOException {
        String visible = write("x.md", "x");
        write(".obsidian/config.md", "hidden");
        write("node_modules/pkg/readme.md", "dep");
        write(".hidden.md", "dotfile");

        assertThat(adapter.scanNoteFiles(NodeIds.normalize(root))).containsExactly(visible);
    }

    @Test
    void scanOfMissingRootIsEmpty() {
        assertThat(adapter.scanNoteFiles(NodeIds.normalize(root.resolve("nope")))).isEmpty();
    }

    @Test
    void readAllKeepsInputOrderAndDropsUnreadableFiles() throws IOException {
        String a = write("a.md", "alpha");
        String b = write("b.md", "beta");
        String missing = NodeIds.normalize(root.resolve("missing.md"));

        List<FileSnapshot> snapshots = adapter.readAll(List.of(b, missing, a));

        assertThat(snapshots).containsExactly(new FileSnapshot(b, "beta"), new FileSnapshot(a, "alpha"));
    }

    @Test
    void imagesAreReadAsEmptyContent() throws IOException {
        String image = write("pic.png", "binary");

        assertThat(adapter.read(image)).contains("");
    }

    @Test
    void writeCreatesParentDirectoriesAndDeleteRemovesFile() {
        String path = NodeIds.normalize(root.resolve("new/dir/note.md"));

        adapter.write(path, "# Note");

        assertThat(adapter.exists(path)).isTrue();
        assertThat(adapter.read(path)).contains("# Note");

        adapter.delete(path);

        assertThat(adapter.exists(path)).isFalse();
        assertThat(adapter.read(path)).isEmpty();
    }

    @Test
    void existsIsFalseForDirectories() throws IOException {
        write("dir/a.md", "a");

        assertThat(adapter.exists(NodeIds.normalize(root.resolve("dir")))).isFalse();
    }
}
