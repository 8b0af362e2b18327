package com.my.notegraph.domain.port.out;

import com.my.notegraph.domain.model.FileSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 왜: 디렉터리 스캔과 노트 파일 입출력을 추상화하여 도메인이 파일 시스템 구조에 종속되지 않도록 하기 위함.
 */
public interface FilePort {

    /**
     * 루트 하위의 마크다운/이미지 파일을 재귀적으로 찾는다. 디렉터리 항목은 이름순으로 정렬되며
     * 결과는 정규화된 절대 경로이다. 내용은 읽지 않는다.
     */
    List<String> scanNoteFiles(String root);

    /**
     * 읽을 수 없는 파일은 빈 값으로 돌려준다.
     */
    Optional<String> read(String path);

    /**
     * 여러 파일을 동시에 읽되 결과는 입력 순서를 유지한다. 실패한 파일은 결과에서 빠진다.
     */
    List<FileSnapshot> readAll(List<String> paths);

    boolean exists(String path);

    void write(String path, String content);

    void delete(String path);
}
