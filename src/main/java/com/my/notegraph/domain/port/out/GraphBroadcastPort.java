package com.my.notegraph.domain.port.out;

import com.my.notegraph.domain.model.GraphDelta;

/**
 * 왜: UI와 플로팅 에디터 등 하위 협력자에게 델타를 전달하는 채널 세부 구현을 숨기기 위함.
 */
public interface GraphBroadcastPort {

    void broadcast(GraphDelta delta);

    /**
     * 감시 디렉터리를 전환할 때 협력자 측 그래프를 비운다.
     */
    void clear();
}
