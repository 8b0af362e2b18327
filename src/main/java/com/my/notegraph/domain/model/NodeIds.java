package com.my.notegraph.domain.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * 노드 ID(정규화된 절대 경로, 슬래시 구분자) 관련 유틸리티.
 */
public final class NodeIds {

    public static final String MARKDOWN_EXTENSION = ".md";

    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".gif", ".webp", ".svg");

    private NodeIds() {
    }

    public static String normalize(String path) {
        String slashed = path.replace('\\', '/');
        return Path.of(slashed).toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    public static String normalize(Path path) {
        return normalize(path.toString());
    }

    public static boolean isMarkdown(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(MARKDOWN_EXTENSION);
    }

    public static boolean isImage(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    public static boolean isSupported(String path) {
        return isMarkdown(path) || isImage(path);
    }

    public static String fileName(String id) {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    public static String directoryOf(String id) {
        int slash = id.lastIndexOf('/');
        return slash > 0 ? id.substring(0, slash) : "/";
    }

    /**
     * 확장자 .md를 제거한 경로. 이미지 확장자는 링크 텍스트에도 포함되므로 유지한다.
     */
    public static String stripMarkdownExtension(String path) {
        return isMarkdown(path) ? path.substring(0, path.length() - MARKDOWN_EXTENSION.length()) : path;
    }

    /**
     * 소문자 basename(.md 제외). 링크 후보 검색의 키로 사용한다.
     */
    public static String baseName(String path) {
        return stripMarkdownExtension(fileName(path.replace('\\', '/'))).toLowerCase(Locale.ROOT);
    }

    public static boolean isUnder(String id, String directory) {
        String dir = directory.endsWith("/") ? directory.substring(0, directory.length() - 1) : directory;
        return id.equals(dir) || id.startsWith(dir + "/");
    }
}
