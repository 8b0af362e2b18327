package com.my.notegraph.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 그래프의 노드. ID는 정규화된 절대 파일 경로이며 디스크 위치를 겸한다.
 * <p>
 * {@code body}는 프론트매터를 제외한 원문 본문(링크 마크업 포함)으로, 파일에 다시 쓸 때 사용한다.
 * {@code links}는 본문에서 파싱된 전체 링크, {@code edges}는 그 중 현재 그래프에서 해석된 것만 담는다.
 */
public record GraphNode(String id,
                        String title,
                        String body,
                        List<WikiLink> links,
                        List<Edge> edges,
                        NodeMetadata metadata) {

    private static final Pattern LINK_MARKUP = Pattern.compile("\\[\\[([^\\[\\]]*?)]]");

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(metadata, "metadata");
        links = links == null ? List.of() : List.copyOf(links);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * 프론트매터와 링크 마크업이 제거된 본문. 링크는 표시 텍스트(별칭이 있으면 별칭)로 남는다.
     */
    public String content() {
        Matcher matcher = LINK_MARKUP.matcher(body);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String inner = matcher.group(1);
            int pipe = inner.indexOf('|');
            String text = pipe >= 0 ? inner.substring(pipe + 1) : inner;
            matcher.appendReplacement(out, Matcher.quoteReplacement(text.trim()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public List<String> edgeTargets() {
        return edges.stream().map(Edge::targetId).toList();
    }

    public boolean hasEdgeTo(String targetId) {
        return edges.stream().anyMatch(edge -> edge.targetId().equals(targetId));
    }

    public GraphNode withEdges(List<Edge> newEdges) {
        return new GraphNode(id, title, body, links, newEdges, metadata);
    }

    public GraphNode withMetadata(NodeMetadata newMetadata) {
        return new GraphNode(id, title, body, links, edges, newMetadata);
    }

    public GraphNode withPosition(Position position) {
        return withMetadata(metadata.withPosition(position));
    }
}
