package com.my.notegraph.domain.port.in;

import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.GraphDelta;

/**
 * 파일 시스템 이벤트 하나를 그래프에 반영한다. 반영된(브로드캐스트된) 델타를 반환하며,
 * 에코로 판정되었거나 변화가 없으면 빈 델타를 반환한다.
 */
public interface HandleFileEventUseCase {
    GraphDelta handle(FileSystemEvent event);
}
