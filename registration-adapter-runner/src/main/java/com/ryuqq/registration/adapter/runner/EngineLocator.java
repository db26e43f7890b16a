package com.ryuqq.registration.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * 정합 엔진 실행 파일 탐색기.
 *
 * <p><strong>탐색 순서:</strong></p>
 * <ol>
 *   <li>명시적 실행 파일 경로</li>
 *   <li>후보 디렉터리 (설정 순서대로)</li>
 *   <li>{@code PATH} 환경 변수의 디렉터리</li>
 * </ol>
 *
 * <p>실행 가능한 일반 파일만 채택합니다. 명시적 경로가 실행 불가능하면 WARN 후 다음 단계로 넘어갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EngineLocator {

    private static final Logger log = LoggerFactory.getLogger(EngineLocator.class);

    private final EngineLocatorConfig config;
    private final Function<String, String> environment;
    private final boolean windows;

    /**
     * 생성자 (시스템 환경 변수 사용).
     *
     * @param config 탐색 설정
     */
    public EngineLocator(EngineLocatorConfig config) {
        this(config, System::getenv, isWindows());
    }

    /**
     * 생성자.
     *
     * @param config 탐색 설정
     * @param environment 환경 변수 조회 함수
     * @param windows Windows 실행 파일 규칙(".exe") 적용 여부
     */
    public EngineLocator(EngineLocatorConfig config, Function<String, String> environment, boolean windows) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.config = config;
        this.environment = environment;
        this.windows = windows;
    }

    /**
     * 고정 경로만 반환하는 탐색기.
     *
     * @param executable 실행 파일 경로
     * @return 탐색기
     */
    public static EngineLocator fixed(Path executable) {
        return new EngineLocator(new EngineLocatorConfig().withExplicitExecutable(executable), name -> null, false);
    }

    /**
     * 실행 파일 탐색.
     *
     * @return 실행 파일 경로 (찾지 못하면 empty)
     */
    public Optional<Path> locate() {
        Path explicit = config.explicitExecutable();
        if (explicit != null) {
            if (isExecutable(explicit)) {
                return Optional.of(explicit);
            }
            log.warn("Configured engine executable is not usable: {}", explicit);
        }
        for (Path directory : config.candidateDirectories()) {
            Optional<Path> found = findIn(directory);
            if (found.isPresent()) {
                return found;
            }
        }
        for (Path directory : pathDirectories()) {
            Optional<Path> found = findIn(directory);
            if (found.isPresent()) {
                return found;
            }
        }
        log.debug("Engine executable '{}' not found", config.executableName());
        return Optional.empty();
    }

    private Optional<Path> findIn(Path directory) {
        for (String name : executableNames()) {
            Path candidate = directory.resolve(name);
            if (isExecutable(candidate)) {
                log.debug("Found engine executable {}", candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private List<String> executableNames() {
        String name = config.executableName();
        if (windows && !name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            return List.of(name + ".exe", name);
        }
        return List.of(name);
    }

    private List<Path> pathDirectories() {
        String path = environment.apply("PATH");
        List<Path> directories = new ArrayList<>();
        if (path == null || path.isBlank()) {
            return directories;
        }
        for (String entry : path.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                directories.add(Paths.get(entry));
            } catch (InvalidPathException e) {
                log.debug("Skipping invalid PATH entry '{}'", entry);
            }
        }
        return directories;
    }

    private static boolean isExecutable(Path file) {
        return Files.isRegularFile(file) && Files.isExecutable(file);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
