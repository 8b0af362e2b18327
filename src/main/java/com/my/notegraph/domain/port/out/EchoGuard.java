package com.my.notegraph.domain.port.out;

import com.my.notegraph.domain.model.GraphDelta;

/**
 * 애플리케이션이 직접 디스크에 쓴 델타를 잠시 기억해, 그 쓰기로 인한 파일 이벤트(에코)를 걸러낸다.
 */
public interface EchoGuard {

    void recordOwnWrite(GraphDelta delta);

    boolean isOwnRecentWrite(GraphDelta delta);
}
