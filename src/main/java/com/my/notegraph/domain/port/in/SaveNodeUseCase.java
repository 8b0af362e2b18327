package com.my.notegraph.domain.port.in;

import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.Position;

import java.util.Map;

/**
 * 애플리케이션 자신의 쓰기 경로. 디스크에 쓴 뒤 에코 가드에 기록한다.
 */
public interface SaveNodeUseCase {

    GraphDelta save(GraphNode node);

    /**
     * 에디터가 보낸 마크다운 원문(프론트매터 포함 가능)을 노드로 저장한다. 원문에 없는 색상과 위치는 기존 노드 값을 유지한다.
     *
     * @throws com.my.notegraph.domain.exception.MarkdownParseException 원문을 해석할 수 없을 때
     */
    GraphDelta saveMarkdown(String nodeId, String markdown);

    GraphDelta delete(String nodeId);

    GraphDelta savePositions(Map<String, Position> positions);
}
