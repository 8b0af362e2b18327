package com.my.notegraph.domain.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * 디렉터리 로드 결과. 파일 수 한도 초과는 예외가 아닌 값으로 반환되어 호출자가 반드시 처리해야 한다.
 */
public sealed interface LoadOutcome<T> permits LoadOutcome.Loaded, LoadOutcome.FileLimitExceeded {

    static <T> LoadOutcome<T> loaded(T value) {
        return new Loaded<>(value);
    }

    static <T> LoadOutcome<T> fileLimitExceeded(int fileCount, int maxFiles) {
        return new FileLimitExceeded<>(fileCount, maxFiles);
    }

    <R> R fold(Function<T, R> onLoaded, Function<FileLimitExceeded<T>, R> onLimitExceeded);

    default boolean isLoaded() {
        return this instanceof Loaded;
    }

    record Loaded<T>(T value) implements LoadOutcome<T> {
        public Loaded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R fold(Function<T, R> onLoaded, Function<FileLimitExceeded<T>, R> onLimitExceeded) {
            return onLoaded.apply(value);
        }
    }

    record FileLimitExceeded<T>(int fileCount, int maxFiles) implements LoadOutcome<T> {

        @Override
        public <R> R fold(Function<T, R> onLoaded, Function<FileLimitExceeded<T>, R> onLimitExceeded) {
            return onLimitExceeded.apply(this);
        }

        public String userMessage() {
            return "파일이 너무 많습니다: " + fileCount + "개 발견 (최대 " + maxFiles + "개). "
                    + "더 작은 폴더를 선택하거나 app.loading.max-files 값을 늘려주세요.";
        }
    }
}
