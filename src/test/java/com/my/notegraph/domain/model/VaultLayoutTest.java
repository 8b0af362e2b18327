package com.my.notegraph.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VaultLayoutTest {

    @Test
    void eagerRootsAreWritePathThenReadPaths() {
        VaultLayout layout = VaultLayout.of("/v", "/v/notes", List.of("/v/docs", "/v/docs"));

        assertThat(layout.eagerRoots()).containsExactly("/v/notes", "/v/docs");
        assertThat(layout.isEager("/v/docs/a.md")).isTrue();
        assertThat(layout.isEager("/v/lib/a.md")).isFalse();
    }

    @Test
    void watchRootsIncludeEagerDirectoriesOutsideWatchedFolder() {
        VaultLayout layout = VaultLayout.of("/v", "/v/notes", List.of("/elsewhere/docs"));

        assertThat(layout.watchRoots()).containsExactly("/v", "/elsewhere/docs");
    }

    @Test
    void addsAndRemovesReadPaths() {
        VaultLayout layout = VaultLayout.single("/v").withReadPath("/x/docs");

        assertThat(layout.readPaths()).containsExactly("/x/docs");
        assertThat(layout.withoutReadPath("/x/docs/").readPaths()).isEmpty();
    }
}
