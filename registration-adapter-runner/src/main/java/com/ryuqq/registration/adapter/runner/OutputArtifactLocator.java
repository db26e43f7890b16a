package com.ryuqq.registration.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 엔진 출력 디렉터리에서 결과 변환 파일을 찾는 로케이터.
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ol>
 *   <li>허용 확장자를 가진 일반 파일만 후보 (하위 디렉터리는 보지 않음)</li>
 *   <li>입력으로 내보낸 초기 변환 파일은 후보에서 제외</li>
 *   <li>이름에 결과 표식을 포함한 후보가 있으면 그 중 사전순 첫 번째</li>
 *   <li>없으면 전체 후보 중 사전순 첫 번째 (후보가 둘 이상이면 WARN)</li>
 * </ol>
 *
 * <p>확장자와 표식 비교는 대소문자를 구분하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OutputArtifactLocator {

    private static final Logger log = LoggerFactory.getLogger(OutputArtifactLocator.class);

    private final List<String> extensions;
    private final String resultMarker;
    private final String excludedFileName;

    /**
     * 생성자.
     *
     * @param extensions 허용 확장자 (예: ".h5")
     * @param resultMarker 결과 파일 이름 표식
     * @param excludedFileName 제외할 파일 이름 (null 허용)
     */
    public OutputArtifactLocator(List<String> extensions, String resultMarker, String excludedFileName) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("extensions cannot be null or empty");
        }
        if (resultMarker == null || resultMarker.isBlank()) {
            throw new IllegalArgumentException("resultMarker cannot be null or blank");
        }
        this.extensions = extensions.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
        this.resultMarker = resultMarker.toLowerCase(Locale.ROOT);
        this.excludedFileName = excludedFileName;
    }

    /**
     * 설정값으로 로케이터 생성.
     *
     * @param settings 정합 설정
     * @return 로케이터
     */
    public static OutputArtifactLocator from(RegistrationSettings settings) {
        return new OutputArtifactLocator(
            settings.artifactExtensions(), settings.resultMarker(), settings.initialTransformFileName());
    }

    /**
     * 결과 파일 탐색.
     *
     * @param directory 엔진 출력 디렉터리
     * @return 결과 파일 (없으면 empty)
     * @throws IOException 디렉터리를 읽을 수 없는 경우
     */
    public Optional<Path> locate(Path directory) throws IOException {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        List<Path> candidates;
        try (Stream<Path> listing = Files.list(directory)) {
            candidates = listing
                .filter(Files::isRegularFile)
                .filter(this::isCandidate)
                .sorted()
                .collect(Collectors.toList());
        }
        if (candidates.isEmpty()) {
            log.debug("No transform artifact in {}", directory);
            return Optional.empty();
        }
        for (Path candidate : candidates) {
            if (lowerName(candidate).contains(resultMarker)) {
                return Optional.of(candidate);
            }
        }
        if (candidates.size() > 1) {
            log.warn("Ambiguous transform artifacts in {}: {} (choosing {})",
                directory, candidates.size(), candidates.get(0).getFileName());
        }
        return Optional.of(candidates.get(0));
    }

    private boolean isCandidate(Path file) {
        String fileName = file.getFileName().toString();
        if (excludedFileName != null && fileName.equals(excludedFileName)) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static String lowerName(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
