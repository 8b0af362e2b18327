package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.FileSnapshot;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.LoadOutcome;
import com.my.notegraph.domain.port.out.FilePort;
import com.my.notegraph.domain.port.out.LayoutPort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 디렉터리 전체 스캔으로 그래프를 만든다.
 * <p>
 * 파일을 하나씩 {@link GraphDeltaComputer}로 폴드하므로 발견 순서와 무관하게 같은 그래프가 나온다.
 * 파일 수 한도는 내용을 하나라도 읽기 전에 검사한다.
 */
public class ProgressiveGraphLoader {

    private static final Logger log = Logger.getLogger(ProgressiveGraphLoader.class);

    private final FilePort filePort;
    private final GraphDeltaComputer deltaComputer;
    private final LayoutPort layoutPort;
    private final int maxFiles;

    public ProgressiveGraphLoader(FilePort filePort,
                                  GraphDeltaComputer deltaComputer,
                                  LayoutPort layoutPort,
                                  int maxFiles) {
        this.filePort = filePort;
        this.deltaComputer = deltaComputer;
        this.layoutPort = layoutPort;
        this.maxFiles = maxFiles;
    }

    public LoadOutcome<Graph> load(List<String> roots) {
        if (roots.isEmpty()) {
            return LoadOutcome.loaded(Graph.empty());
        }
        List<String> files = scan(roots);
        if (files.size() > maxFiles) {
            log.errorf("파일 수 한도 초과로 로드를 중단합니다: %d개 발견 (최대 %d개)", files.size(), maxFiles);
            return LoadOutcome.fileLimitExceeded(files.size(), maxFiles);
        }

        Graph graph = fold(Graph.empty(), filePort.readAll(files));
        Graph positioned = layoutPort.assignPositions(graph);
        log.infof("그래프 로드 완료: 루트 %d개, 파일 %d개, 노드 %d개", roots.size(), files.size(), positioned.size());
        return LoadOutcome.loaded(positioned);
    }

    /**
     * 기존 그래프에 디렉터리 하나를 추가로 로드한다. 이미 그래프에 있는 파일은 한도 계산에서 제외한다.
     * 반환 델타는 새로 추가되거나 치유된 노드를 최종 위치와 함께 담는다.
     */
    public LoadOutcome<GraphDelta> loadAdditively(String root, Graph existing) {
        List<String> newFiles = scan(List.of(root)).stream()
                .filter(path -> !existing.contains(path))
                .toList();
        int total = existing.size() + newFiles.size();
        if (total > maxFiles) {
            log.errorf("파일 수 한도 초과로 추가 로드를 중단합니다: %d개 (최대 %d개)", total, maxFiles);
            return LoadOutcome.fileLimitExceeded(total, maxFiles);
        }

        GraphDelta accumulated = GraphDelta.empty();
        Graph graph = existing;
        for (FileSnapshot snapshot : filePort.readAll(newFiles)) {
            GraphDelta delta = deltaComputer.compute(snapshot.toAddedEvent(), graph);
            graph = graph.apply(delta);
            accumulated = accumulated.concat(delta);
        }
        Graph positioned = layoutPort.assignPositions(graph);
        log.infof("디렉터리 추가 로드 완료: %s (새 파일 %d개)", root, newFiles.size());
        return LoadOutcome.loaded(GraphDeltas.collapse(accumulated, existing, positioned));
    }

    /**
     * 스냅샷을 하나씩 폴드한다. 각 단계의 델타는 즉시 누적 그래프에 적용된다.
     */
    public Graph fold(Graph initial, List<FileSnapshot> snapshots) {
        Graph graph = initial;
        for (FileSnapshot snapshot : snapshots) {
            graph = graph.apply(deltaComputer.compute(snapshot.toAddedEvent(), graph));
        }
        return graph;
    }

    private List<String> scan(List<String> roots) {
        LinkedHashSet<String> files = new LinkedHashSet<>();
        for (String root : roots) {
            files.addAll(filePort.scanNoteFiles(root));
        }
        return new ArrayList<>(files);
    }
}
