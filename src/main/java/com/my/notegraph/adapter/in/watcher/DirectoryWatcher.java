package com.my.notegraph.adapter.in.watcher;

import com.my.notegraph.domain.model.FileSystemEvent;
import com.my.notegraph.domain.model.NodeIds;
import com.my.notegraph.domain.port.in.HandleFileEventUseCase;
import com.my.notegraph.domain.port.out.FilePort;
import com.my.notegraph.domain.port.out.FolderWatchPort;
import com.my.notegraph.domain.service.GraphState;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * JDK {@link WatchService}로 감시 루트 하위 전체를 재귀적으로 감시한다.
 * <p>
 * 감시 스레드는 이벤트를 기다리고 파일 내용을 읽기만 하며, 그래프 반영은 {@link GraphEventLoop}에 순서대로 넘긴다.
 */
@ApplicationScoped
public class DirectoryWatcher implements FolderWatchPort {

    private static final Logger log = Logger.getLogger(DirectoryWatcher.class);

    private final HandleFileEventUseCase handleFileEventUseCase;
    private final FilePort filePort;
    private final GraphState graphState;
    private final GraphEventLoop eventLoop;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread watchThread;

    @Inject
    public DirectoryWatcher(HandleFileEventUseCase handleFileEventUseCase,
                            FilePort filePort,
                            GraphState graphState,
                            GraphEventLoop eventLoop) {
        this.handleFileEventUseCase = handleFileEventUseCase;
        this.filePort = filePort;
        this.graphState = graphState;
        this.eventLoop = eventLoop;
    }

    @Override
    public synchronized void watch(List<String> roots) {
        stop();
        try {
            watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new UncheckedIOException("파일 감시를 시작할 수 없습니다", e);
        }
        WatchService service = watchService;
        roots.forEach(root -> registerTree(service, Path.of(root)));

        watchThread = new Thread(() -> pollLoop(service), "directory-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        log.infof("파일 감시 시작: %s (디렉터리 %d개)", roots, directories.size());
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warnf("파일 감시 종료 중 예외: %s", e.getMessage());
        }
        watchThread.interrupt();
        directories.clear();
        watchService = null;
        watchThread = null;
        log.info("파일 감시 중지");
    }

    private void pollLoop(WatchService service) {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path directory = directories.get(key);
            if (directory != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    handle(service, directory, event);
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    private void handle(WatchService service, Path directory, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            log.warn("파일 감시 이벤트가 넘쳤습니다. 일부 변경이 누락되었을 수 있습니다.");
            return;
        }
        Path path = directory.resolve((Path) event.context());
        String id = NodeIds.normalize(path);

        if (event.kind() == ENTRY_CREATE && Files.isDirectory(path)) {
            registerTree(service, path);
            filePort.scanNoteFiles(id).forEach(file -> submitRead(file, true));
            return;
        }
        if (event.kind() == ENTRY_DELETE) {
            deletedUnder(id).forEach(nodeId -> submit(FileSystemEvent.deleted(nodeId)));
            return;
        }
        if (NodeIds.isSupported(id) && Files.isRegularFile(path)) {
            submitRead(id, event.kind() == ENTRY_CREATE);
        }
    }

    /**
     * 삭제된 경로가 디렉터리였으면 그 아래 노드 전부, 파일이었으면 그 파일 하나.
     */
    private List<String> deletedUnder(String id) {
        List<String> deleted = new ArrayList<>();
        if (NodeIds.isSupported(id)) {
            deleted.add(id);
        }
        graphState.current().ids().stream()
                .filter(nodeId -> !nodeId.equals(id) && NodeIds.isUnder(nodeId, id))
                .sorted()
                .forEach(deleted::add);
        return deleted;
    }

    private void submitRead(String id, boolean added) {
        Optional<String> content = filePort.read(id);
        if (content.isEmpty()) {
            log.debugf("읽을 수 없는 파일 이벤트를 건너뜁니다: %s", id);
            return;
        }
        submit(added ? FileSystemEvent.added(id, content.get()) : FileSystemEvent.changed(id, content.get()));
    }

    private void submit(FileSystemEvent event) {
        eventLoop.execute(() -> handleFileEventUseCase.handle(event));
    }

    private void registerTree(WatchService service, Path root) {
        if (!Files.isDirectory(root)) {
            log.warnf("감시할 디렉터리가 없습니다: %s", root);
            return;
        }
        try (Stream<Path> tree = Files.walk(root)) {
            tree.filter(Files::isDirectory)
                    .filter(dir -> !isIgnored(root, dir))
                    .forEach(dir -> register(service, dir));
        } catch (IOException | UncheckedIOException e) {
            log.warnf("디렉터리 감시 등록 실패: %s (%s)", root, e.getMessage());
        }
    }

    private void register(WatchService service, Path directory) {
        try {
            WatchKey key = directory.register(service, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            directories.put(key, directory);
        } catch (IOException | ClosedWatchServiceException e) {
            log.warnf("디렉터리 감시 등록 실패: %s (%s)", directory, e.getMessage());
        }
    }

    private static boolean isIgnored(Path root, Path directory) {
        for (Path part : root.relativize(directory)) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals("node_modules")) {
                return true;
            }
        }
        return false;
    }
}
