package com.my.notegraph.domain.service;

import com.my.notegraph.domain.model.Graph;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.model.WikiLink;

import java.util.Collection;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * 위키 링크 텍스트와 후보 파일 경로를 대응시키는 규칙.
 * <p>
 * 후보는 basename(.md 제외, 대소문자 무시)이 링크의 마지막 구성요소와 같아야 한다.
 * 여러 후보가 있으면 점수(정확한 접미사 일치, 공유하는 뒤쪽 경로 구성요소 수)가 높은 것,
 * 같으면 더 짧은 경로, 그래도 같으면 사전순으로 고른다. 발견 순서는 결과에 영향을 주지 않는다.
 */
public final class LinkMatcher {

    static final int EXACT_SUFFIX_SCORE = 1000;
    static final int CASE_INSENSITIVE_SUFFIX_SCORE = 500;
    static final int SHARED_COMPONENT_SCORE = 10;

    private LinkMatcher() {
    }

    public static String normalizeTarget(String target) {
        String normalized = target.trim().replace('\\', '/');
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return NodeIds.stripMarkdownExtension(normalized);
    }

    public static boolean isAbsolute(String target) {
        String normalized = target.trim().replace('\\', '/');
        return normalized.startsWith("/") || normalized.matches("^[A-Za-z]:/.*");
    }

    public static boolean isRelative(String target) {
        String normalized = target.trim().replace('\\', '/');
        return normalized.startsWith("./") || normalized.startsWith("../");
    }

    /**
     * 링크 대상의 basename 키. 후보 색인 조회에 사용한다.
     */
    public static String targetBaseName(String target) {
        return NodeIds.baseName(normalizeTarget(target));
    }

    public static boolean matches(String target, String candidatePath) {
        String key = targetBaseName(target);
        return !key.isEmpty() && key.equals(NodeIds.baseName(candidatePath));
    }

    public static int score(String target, String candidatePath) {
        String normalizedTarget = normalizeTarget(target);
        String candidate = NodeIds.stripMarkdownExtension(candidatePath.replace('\\', '/'));
        int score = 0;
        if (candidate.equals(normalizedTarget) || candidate.endsWith("/" + normalizedTarget)) {
            score += EXACT_SUFFIX_SCORE;
        } else {
            String lowerCandidate = candidate.toLowerCase(Locale.ROOT);
            String lowerTarget = normalizedTarget.toLowerCase(Locale.ROOT);
            if (lowerCandidate.equals(lowerTarget) || lowerCandidate.endsWith("/" + lowerTarget)) {
                score += CASE_INSENSITIVE_SUFFIX_SCORE;
            }
        }
        return score + SHARED_COMPONENT_SCORE * sharedTrailingComponents(normalizedTarget, candidate);
    }

    public static Optional<String> bestMatch(String target, Collection<String> candidates) {
        Comparator<String> byScore = Comparator.comparingInt((String candidate) -> score(target, candidate)).reversed();
        return candidates.stream()
                .filter(candidate -> matches(target, candidate))
                .sorted(byScore
                        .thenComparingInt(String::length)
                        .thenComparing(Comparator.naturalOrder()))
                .findFirst();
    }

    /**
     * 링크를 현재 그래프의 노드 ID로 해석한다. 상대/절대 링크는 가리키는 경로의 노드를 먼저 찾고,
     * 없으면 앞쪽 {@code ./}, {@code ../}, 루트를 뗀 나머지 경로로 접미사 매칭한다.
     */
    public static Optional<String> resolveInGraph(String sourceId, WikiLink link, Graph graph) {
        String target = link.target();
        Optional<String> exact = exactPath(sourceId, target).flatMap(path -> existingNode(path, graph));
        if (exact.isPresent()) {
            return exact;
        }
        return bestMatch(pathTail(target), graph.ids());
    }

    /**
     * 링크가 그래프 안에서 더 나은 후보로 바뀔 여지가 없는지. 경로 그대로 일치하거나 접미사가 정확히 일치하면 확정이다.
     */
    public static boolean isSettled(String sourceId, WikiLink link, Graph graph) {
        String target = link.target();
        if (exactPath(sourceId, target).flatMap(path -> existingNode(path, graph)).isPresent()) {
            return true;
        }
        String tail = pathTail(target);
        return bestMatch(tail, graph.ids())
                .map(match -> score(tail, match) >= EXACT_SUFFIX_SCORE)
                .orElse(false);
    }

    /**
     * 상대/절대 링크에서 앞쪽 {@code ./}, {@code ../}, 루트({@code /}, {@code C:/})를 뗀 경로. 단순 이름 링크는 그대로다.
     */
    public static String pathTail(String target) {
        String tail = target.trim().replace('\\', '/');
        if (tail.matches("^[A-Za-z]:/.*")) {
            tail = tail.substring(3);
        }
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            if (tail.startsWith("./")) {
                tail = tail.substring(2);
                stripped = true;
            } else if (tail.startsWith("../")) {
                tail = tail.substring(3);
                stripped = true;
            } else if (tail.startsWith("/")) {
                tail = tail.substring(1);
                stripped = true;
            }
        }
        return tail;
    }

    /**
     * 상대/절대 링크가 가리키는 정규화된 경로(.md 보정 전). 단순 이름 링크이면 비어 있다.
     */
    public static Optional<String> exactPath(String sourceId, String target) {
        String normalized = target.trim().replace('\\', '/');
        if (isAbsolute(normalized)) {
            return Optional.of(NodeIds.normalize(normalized));
        }
        if (isRelative(normalized)) {
            return Optional.of(NodeIds.normalize(NodeIds.directoryOf(sourceId) + "/" + normalized));
        }
        return Optional.empty();
    }

    private static Optional<String> existingNode(String path, Graph graph) {
        if (graph.contains(path)) {
            return Optional.of(path);
        }
        String withExtension = path + NodeIds.MARKDOWN_EXTENSION;
        return graph.contains(withExtension) ? Optional.of(withExtension) : Optional.empty();
    }

    private static int sharedTrailingComponents(String target, String candidate) {
        String[] targetParts = target.toLowerCase(Locale.ROOT).split("/");
        String[] candidateParts = candidate.toLowerCase(Locale.ROOT).split("/");
        int shared = 0;
        int t = targetParts.length - 1;
        int c = candidateParts.length - 1;
        while (t >= 0 && c >= 0 && targetParts[t].equals(candidateParts[c])) {
            shared++;
            t--;
            c--;
        }
        return shared;
    }
}
