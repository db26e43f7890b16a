package com.ryuqq.registration.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 실행별 임시 작업 디렉터리.
 *
 * <p>실행마다 고유 디렉터리를 생성하고, {@link #close()}에서 하위 내용까지 재귀 삭제합니다.
 * close는 여러 번 호출해도 안전합니다. 삭제 실패는 WARN 로그만 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkingDirectory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkingDirectory.class);

    private final Path path;
    private boolean closed;

    private WorkingDirectory(Path path) {
        this.path = path;
    }

    /**
     * 고유 작업 디렉터리 생성.
     *
     * @param parent 상위 디렉터리 (null이면 시스템 임시 디렉터리)
     * @param prefix 디렉터리 이름 접두사
     * @return 작업 디렉터리
     * @throws IOException 생성 실패 시
     */
    public static WorkingDirectory create(Path parent, String prefix) throws IOException {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        Path created = parent == null
            ? Files.createTempDirectory(prefix)
            : Files.createTempDirectory(Files.createDirectories(parent), prefix);
        log.debug("Created working directory {}", created);
        return new WorkingDirectory(created);
    }

    public Path path() {
        return path;
    }

    public Path resolve(String fileName) {
        return path.resolve(fileName);
    }

    public boolean exists() {
        return Files.exists(path);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 디렉터리 재귀 삭제.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list working directory {} for cleanup", path, e);
            return;
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException e) {
                log.warn("Failed to delete {} during cleanup", entry, e);
            }
        }
        log.debug("Removed working directory {}", path);
    }

    @Override
    public String toString() {
        return "WorkingDirectory{" + path + (closed ? ", closed" : "") + "}";
    }
}
