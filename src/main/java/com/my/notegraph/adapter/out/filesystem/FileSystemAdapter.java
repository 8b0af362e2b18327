package com.my.notegraph.adapter.out.filesystem;

import com.my.notegraph.config.AppConfig;
import com.my.notegraph.domain.exception.NoteWriteException;
import com.my.notegraph.domain.model.FileSnapshot;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.port.out.FilePort;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * 왜: 노트 디렉터리 스캔과 파일 입출력을 한곳에서 처리하여 읽기 실패를 "파일 없음"으로 일관되게 다루기 위함.
 * <p>
 * 스캔은 최상위 하위 디렉터리별로 작업 풀에 나누어 실행하고 이름순으로 합친다.
 */
@ApplicationScoped
public class FileSystemAdapter implements FilePort {

    private static final Logger log = Logger.getLogger(FileSystemAdapter.class);

    private final ExecutorService ioPool;

    @Inject
    public FileSystemAdapter(AppConfig appConfig) {
        this(appConfig.loading().ioThreads());
    }

    public FileSystemAdapter(int ioThreads) {
        this.ioPool = Executors.newFixedThreadPool(Math.max(1, ioThreads), namedDaemonThreads());
    }

    @Override
    public List<String> scanNoteFiles(String root) {
        Path rootPath = Path.of(root);
        if (!Files.isDirectory(rootPath)) {
            log.warnf("스캔할 디렉터리가 없습니다: %s", root);
            return List.of();
        }

        List<CompletableFuture<List<String>>> parts = new ArrayList<>();
        for (Path entry : sortedEntries(rootPath)) {
            if (Files.isDirectory(entry)) {
                parts.add(CompletableFuture.supplyAsync(() -> walk(entry), ioPool));
            } else if (isNoteFile(entry)) {
                parts.add(CompletableFuture.completedFuture(List.of(NodeIds.normalize(entry))));
            }
        }

        List<String> files = new ArrayList<>();
        parts.forEach(part -> files.addAll(part.join()));
        return files;
    }

    @Override
    public Optional<String> read(String path) {
        Path file = Path.of(path);
        if (NodeIds.isImage(path)) {
            return Files.isRegularFile(file) ? Optional.of("") : Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            log.warnf("파일을 읽을 수 없어 건너뜁니다: %s (%s)", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<FileSnapshot> readAll(List<String> paths) {
        List<CompletableFuture<Optional<FileSnapshot>>> reads = paths.stream()
                .map(path -> CompletableFuture.supplyAsync(
                        () -> read(path).map(content -> new FileSnapshot(path, content)), ioPool))
                .toList();
        List<FileSnapshot> snapshots = new ArrayList<>();
        reads.forEach(read -> read.join().ifPresent(snapshots::add));
        return snapshots;
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(Path.of(path));
    }

    @Override
    @Retry(maxRetries = 2, delay = 100, retryOn = NoteWriteException.class)
    public void write(String path, String content) {
        Path file = Path.of(path);
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NoteWriteException("노트 파일 쓰기 실패: " + path, e);
        }
    }

    @Override
    @Retry(maxRetries = 2, delay = 100, retryOn = NoteWriteException.class)
    public void delete(String path) {
        try {
            Files.deleteIfExists(Path.of(path));
        } catch (IOException e) {
            throw new NoteWriteException("노트 파일 삭제 실패: " + path, e);
        }
    }

    @PreDestroy
    void shutdown() {
        ioPool.shutdownNow();
    }

    private List<String> walk(Path directory) {
        List<String> files = new ArrayList<>();
        for (Path entry : sortedEntries(directory)) {
            if (Files.isDirectory(entry)) {
                files.addAll(walk(entry));
            } else if (isNoteFile(entry)) {
                files.add(NodeIds.normalize(entry));
            }
        }
        return files;
    }

    private List<Path> sortedEntries(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(entry -> !isIgnored(entry))
                    .sorted(Comparator.comparing(entry -> entry.getFileName().toString()))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warnf("디렉터리를 읽을 수 없어 건너뜁니다: %s (%s)", directory, e.getMessage());
            return List.of();
        }
    }

    private static boolean isIgnored(Path entry) {
        String name = entry.getFileName().toString();
        return name.startsWith(".") || name.equals("node_modules");
    }

    private static boolean isNoteFile(Path entry) {
        return Files.isRegularFile(entry) && NodeIds.isSupported(entry.getFileName().toString());
    }

    private static ThreadFactory namedDaemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "note-io-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
