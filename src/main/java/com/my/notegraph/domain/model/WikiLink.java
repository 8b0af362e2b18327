package com.my.notegraph.domain.model;

import java.util.Objects;

/**
 * 본문에서 파싱된 위키 링크. target은 아직 해석되지 않은 원문 텍스트이다.
 */
public record WikiLink(String target, String label) {
    public WikiLink {
        Objects.requireNonNull(target, "target");
        if (target.isBlank()) {
            throw new IllegalArgumentException("링크 대상은 비어 있을 수 없습니다.");
        }
        label = label == null ? "" : label;
    }
}
