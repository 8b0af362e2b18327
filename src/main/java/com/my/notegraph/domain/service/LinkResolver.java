package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.FileSnapshot;
import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.GraphDelta;
import com.my.notegraph.domain.model.GraphNode;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.WikiLink;
import com.my.notegraph.domain.port.out.FilePort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * resolve-on-link: 그래프 안의 링크 중 아직 로드되지 않은 파일을 가리키는 것을 검색 루트에서 찾아 로드한다.
 * <p>
 * 새로 로드된 파일의 링크도 다음 반복에서 다시 검사하므로 A→B→C 같은 연쇄가 한 번의 호출로 해석된다.
 * 순환은 처리한 파일 집합으로 끊는다. 어떤 노드도 링크하지 않는 파일은 절대 로드되지 않는다.
 */
public class LinkResolver {

    private static final Logger log = Logger.getLogger(LinkResolver.class);

    private final FilePort filePort;
    private final GraphDeltaComputer deltaComputer;
    private final Optional<Integer> maxPasses;

    public LinkResolver(FilePort filePort, GraphDeltaComputer deltaComputer, Optional<Integer> maxPasses) {
        this.filePort = filePort;
        this.deltaComputer = deltaComputer;
        this.maxPasses = maxPasses;
    }

    /**
     * 로드한 파일과 그로 인한 치유를 담은 누적 델타를 반환한다. 위치는 아직 부여되지 않았다.
     */
    public GraphDelta resolve(Graph graph, String searchRoot) {
        if (allLinksSettled(graph)) {
            return GraphDelta.empty();
        }
        Map<String, List<String>> candidatesByBaseName = indexCandidates(graph, filePort.scanNoteFiles(searchRoot));
        Set<String> processed = new HashSet<>();
        Graph current = graph;
        GraphDelta accumulated = GraphDelta.empty();
        int passes = 0;

        while (true) {
            if (maxPasses.isPresent() && passes >= maxPasses.get()) {
                log.debugf("링크 해석 반복 한도에 도달했습니다: %d회", passes);
                break;
            }
            Set<String> pending = pendingFiles(current, candidatesByBaseName, processed);
            if (pending.isEmpty()) {
                break;
            }
            processed.addAll(pending);
            for (FileSnapshot snapshot : filePort.readAll(new ArrayList<>(pending))) {
                GraphDelta delta = deltaComputer.compute(snapshot.toAddedEvent(), current);
                current = current.apply(delta);
                accumulated = accumulated.concat(delta);
            }
            passes++;
        }

        if (!processed.isEmpty()) {
            log.infof("링크된 파일 %d개를 로드했습니다 (검색 루트: %s, 반복 %d회)", processed.size(), searchRoot, passes);
        }
        return accumulated;
    }

    private Set<String> pendingFiles(Graph graph, Map<String, List<String>> candidatesByBaseName, Set<String> processed) {
        Set<String> pending = new TreeSet<>();
        graph.nodes().stream()
                .sorted(Comparator.comparing(GraphNode::id))
                .forEach(node -> {
                    for (WikiLink link : node.links()) {
                        targetFile(node.id(), link, candidatesByBaseName, graph)
                                .filter(path -> !graph.contains(path))
                                .filter(path -> !processed.contains(path))
                                .ifPresent(pending::add);
                    }
                });
        return pending;
    }

    private Optional<String> targetFile(String sourceId,
                                        WikiLink link,
                                        Map<String, List<String>> candidatesByBaseName,
                                        Graph graph) {
        String target = link.target();
        Optional<String> exact = LinkMatcher.exactPath(sourceId, target);
        if (exact.isPresent()) {
            Optional<String> literal = existingFile(exact.get(), graph);
            // 절대 경로는 그 위치만 본다. 상대 경로는 없으면 이름 검색으로 넘어간다.
            if (literal.isPresent() || LinkMatcher.isAbsolute(target)) {
                return literal;
            }
        }
        String tail = LinkMatcher.pathTail(target);
        List<String> candidates = candidatesByBaseName.getOrDefault(LinkMatcher.targetBaseName(tail), List.of());
        return LinkMatcher.bestMatch(tail, candidates);
    }

    /**
     * 모든 링크가 이미 확정된 노드를 가리키면 검색 루트를 훑을 필요가 없다.
     */
    private static boolean allLinksSettled(Graph graph) {
        return graph.nodes().stream()
                .allMatch(node -> node.links().stream()
                        .allMatch(link -> LinkMatcher.isSettled(node.id(), link, graph)));
    }

    private Optional<String> existingFile(String path, Graph graph) {
        for (String candidate : List.of(path, path + NodeIds.MARKDOWN_EXTENSION)) {
            if (graph.contains(candidate)) {
                return Optional.of(candidate);
            }
            if (NodeIds.isSupported(candidate) && filePort.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Map<String, List<String>> indexCandidates(Graph graph, List<String> files) {
        Map<String, List<String>> index = new HashMap<>();
        Set<String> all = new HashSet<>(files);
        all.addAll(graph.ids());
        for (String path : all) {
            index.computeIfAbsent(NodeIds.baseName(path), key -> new ArrayList<>()).add(path);
        }
        return index;
    }
}
