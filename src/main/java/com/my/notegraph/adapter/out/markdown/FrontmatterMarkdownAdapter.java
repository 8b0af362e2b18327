package com.my.notegraph.adapter.out.markdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.my.notegraph.domain.exception.MarkdownParseException;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.NodeMetadata;
import com.my.notegraph.domain.model.ParsedMarkdown;
import com.my.notegraph.domain.model.Position;
import com.my.notegraph.domain.model.WikiLink;
import com.my.notegraph.domain.port.out.MarkdownPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: YAML 프론트매터와 위키 링크 문법을 어댑터에 가두고, 도메인에는 순수 파싱 결과만 넘기기 위함.
 */
@ApplicationScoped
public class FrontmatterMarkdownAdapter implements MarkdownPort {

    static final String COLOR = "color";
    static final String POSITION = "position";
    static final String CONTEXT_NODE = "isContextNode";
    static final String CONTAINED_NODE_IDS = "containedNodeIds";

    private static final String DELIMITER = "---";
    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\[\\]]*?)]]");
    private static final Pattern HEADING = Pattern.compile("^ {0,3}#{1,6}[ \\t]+(.+?)[ \\t]*#*[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern LIST_MARKER = Pattern.compile("^[-*+]\\s+");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final YAMLMapper yamlMapper = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .disable(YAMLGenerator.Feature.SPLIT_LINES)
            .build();

    @Override
    public ParsedMarkdown parse(String absolutePath, String content) {
        if (NodeIds.isImage(absolutePath)) {
            return new ParsedMarkdown(NodeIds.fileName(absolutePath), "", List.of(), NodeMetadata.empty());
        }
        String normalized = content.replace("\r\n", "\n");
        Split split = splitFrontmatter(normalized);
        NodeMetadata metadata = toMetadata(absolutePath, readYaml(absolutePath, split.yaml()));
        String body = split.body();
        return new ParsedMarkdown(title(absolutePath, body), body, links(body), metadata);
    }

    @Override
    public String render(GraphNode node) {
        NodeMetadata metadata = node.metadata();
        Map<String, Object> frontmatter = new LinkedHashMap<>();
        metadata.color().ifPresent(color -> frontmatter.put(COLOR, color));
        metadata.position().ifPresent(position -> {
            Map<String, Object> xy = new LinkedHashMap<>();
            xy.put("x", position.x());
            xy.put("y", position.y());
            frontmatter.put(POSITION, xy);
        });
        frontmatter.put(CONTEXT_NODE, metadata.contextNode());
        metadata.containedNodeIds().ifPresent(ids -> frontmatter.put(CONTAINED_NODE_IDS, ids));
        metadata.extraProperties().forEach(frontmatter::putIfAbsent);
        try {
            return DELIMITER + "\n" + yamlMapper.writeValueAsString(frontmatter) + DELIMITER + "\n" + node.body();
        } catch (JsonProcessingException e) {
            throw new MarkdownParseException(node.id(), "프론트매터 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }

    private Split splitFrontmatter(String content) {
        if (!content.startsWith(DELIMITER + "\n")) {
            return new Split("", content);
        }
        int start = DELIMITER.length() + 1;
        int cursor = start;
        while (cursor <= content.length()) {
            int lineEnd = content.indexOf('\n', cursor);
            String line = lineEnd < 0 ? content.substring(cursor) : content.substring(cursor, lineEnd);
            if (line.trim().equals(DELIMITER)) {
                String yaml = content.substring(start, cursor);
                String body = lineEnd < 0 ? "" : content.substring(lineEnd + 1);
                return new Split(yaml, body);
            }
            if (lineEnd < 0) {
                break;
            }
            cursor = lineEnd + 1;
        }
        // 닫는 구분선이 없으면 프론트매터로 보지 않는다.
        return new Split("", content);
    }

    private Map<String, Object> readYaml(String path, String yaml) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> values = yamlMapper.readValue(yaml, MAP_TYPE);
            return values == null ? Map.of() : values;
        } catch (JsonProcessingException e) {
            throw new MarkdownParseException(path, "프론트매터 YAML을 해석할 수 없습니다: " + e.getOriginalMessage(), e);
        }
    }

    private NodeMetadata toMetadata(String path, Map<String, Object> yaml) {
        Map<String, Object> extras = new LinkedHashMap<>();
        Optional<String> color = Optional.empty();
        Optional<Position> position = Optional.empty();
        boolean contextNode = false;
        Optional<List<String>> containedNodeIds = Optional.empty();

        for (Map.Entry<String, Object> entry : yaml.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case COLOR -> color = Optional.ofNullable(value).map(Object::toString);
                case POSITION -> position = toPosition(path, value);
                case CONTEXT_NODE -> contextNode = Boolean.TRUE.equals(value) || "true".equals(String.valueOf(value));
                case CONTAINED_NODE_IDS -> containedNodeIds = toStringList(value);
                default -> extras.put(entry.getKey(), value);
            }
        }
        return new NodeMetadata(color, position, extras, contextNode, containedNodeIds);
    }

    private static Optional<Position> toPosition(String path, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        Optional<Double> x = toDouble(map.get("x"));
        Optional<Double> y = toDouble(map.get("y"));
        if (x.isPresent() && y.isPresent()) {
            return Optional.of(new Position(x.get(), y.get()));
        }
        throw new MarkdownParseException(path, "position은 숫자 x, y를 가져야 합니다: " + value, null);
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            // 1.0E7 처럼 지수 부호가 없는 값은 YAML 문자열로 읽힌다.
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<List<String>> toStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return Optional.empty();
        }
        return Optional.of(list.stream().map(String::valueOf).toList());
    }

    private static String title(String path, String body) {
        Matcher heading = HEADING.matcher(body);
        if (heading.find()) {
            String title = stripLinkMarkup(heading.group(1)).trim();
            if (!title.isEmpty()) {
                return title;
            }
        }
        return NodeIds.stripMarkdownExtension(NodeIds.fileName(path)).replace('-', ' ').replace('_', ' ');
    }

    private static List<WikiLink> links(String body) {
        List<WikiLink> links = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = WIKI_LINK.matcher(body);
        while (matcher.find()) {
            String inner = matcher.group(1);
            int pipe = inner.indexOf('|');
            String target = (pipe >= 0 ? inner.substring(0, pipe) : inner).trim();
            if (target.isEmpty() || !seen.add(target)) {
                continue;
            }
            links.add(new WikiLink(target, labelBefore(body, matcher.start())));
        }
        return links;
    }

    private static String labelBefore(String body, int linkStart) {
        int lineStart = body.lastIndexOf('\n', linkStart - 1) + 1;
        String before = body.substring(lineStart, linkStart).trim();
        return LIST_MARKER.matcher(before).replaceFirst("").trim();
    }

    private static String stripLinkMarkup(String text) {
        Matcher matcher = WIKI_LINK.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String inner = matcher.group(1);
            int pipe = inner.indexOf('|');
            matcher.appendReplacement(out, Matcher.quoteReplacement((pipe >= 0 ? inner.substring(pipe + 1) : inner).trim()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private record Split(String yaml, String body) {
    }
}
