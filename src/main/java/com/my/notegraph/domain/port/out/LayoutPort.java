package com.my.notegraph.domain.port.out;

import com.my.notegraph.domain.model.Graph;

/**
 * 위치가 없는 노드에 배치를 부여하는 레이아웃 협력자. 이미 위치가 있는 노드는 건드리지 않는다.
 */
public interface LayoutPort {
    Graph assignPositions(Graph graph);
}
