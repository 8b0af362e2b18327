package com.my.notegraph.domain.port.out;

import com.my.notegraph.domain.exception.MarkdownParseException;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.ParsedMarkdown;

/**
 * 왜: 마크다운/프론트매터 문법을 도메인 밖에 두고 순수 함수로만 소비하기 위함.
 */
public interface MarkdownPort {

    /**
     * @throws MarkdownParseException 내용을 노드로 만들 수 없을 때
     */
    ParsedMarkdown parse(String absolutePath, String content);

    String render(GraphNode node);
}
