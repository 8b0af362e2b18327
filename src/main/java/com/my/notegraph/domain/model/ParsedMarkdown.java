package com.my.notegraph.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 마크다운 파서의 출력. 엣지는 아직 해석되지 않았다.
 */
public record ParsedMarkdown(String title, String body, List<WikiLink> links, NodeMetadata metadata) {
    public ParsedMarkdown {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(metadata, "metadata");
        links = links == null ? List.of() : List.copyOf(links);
    }

    public GraphNode toNode(String id) {
        return new GraphNode(id, title, body, links, List.of(), metadata);
    }
}
