package com.my.notegraph.domain.port.in;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.LoadOutcome;
import com.my.notegraph.domain.model.VaultLayout;

/**
 * 왜: 감시 폴더 전환과 eager 디렉터리 추가/제거를 하나의 진입점으로 모아 그래프 상태 교체를 일관되게 처리하기 위함.
 */
public interface WatchFolderUseCase {

    LoadOutcome<Graph> loadFolder(VaultLayout layout);

    LoadOutcome<GraphDelta> addReadPath(String directory);

    GraphDelta removeReadPath(String directory);

    GraphDelta resolvePendingLinks();

    Graph currentGraph();
}
