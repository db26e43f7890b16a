package com.ryuqq.registration.adapter.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * EngineLocator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>explicitExecutable: 명시적 실행 파일 경로 (기본 null)</li>
 *   <li>candidateDirectories: 실행 파일을 찾을 디렉터리 목록 (기본 빈 목록)</li>
 *   <li>executableName: 실행 파일 이름 (기본 "MIRegistration", Windows에서는 ".exe" 추가 탐색)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param explicitExecutable 명시적 실행 파일 (null 허용)
 * @param candidateDirectories 후보 디렉터리 목록
 * @param executableName 실행 파일 이름 (빈 문자열 불가)
 */
public record EngineLocatorConfig(
    Path explicitExecutable,
    List<Path> candidateDirectories,
    String executableName
) {

    /**
     * 기본 설정 생성자.
     */
    public EngineLocatorConfig() {
        this(null, List.of(), "MIRegistration");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineLocatorConfig {
        if (candidateDirectories == null) {
            throw new IllegalArgumentException("candidateDirectories cannot be null");
        }
        if (executableName == null || executableName.isBlank()) {
            throw new IllegalArgumentException("executableName cannot be null or blank");
        }
        candidateDirectories = List.copyOf(candidateDirectories);
    }

    /**
     * explicitExecutable만 변경한 새 인스턴스 생성.
     */
    public EngineLocatorConfig withExplicitExecutable(Path explicitExecutable) {
        return new EngineLocatorConfig(explicitExecutable, candidateDirectories, executableName);
    }

    /**
     * candidateDirectories만 변경한 새 인스턴스 생성.
     */
    public EngineLocatorConfig withCandidateDirectories(List<Path> candidateDirectories) {
        return new EngineLocatorConfig(explicitExecutable, candidateDirectories, executableName);
    }

    /**
     * executableName만 변경한 새 인스턴스 생성.
     */
    public EngineLocatorConfig withExecutableName(String executableName) {
        return new EngineLocatorConfig(explicitExecutable, candidateDirectories, executableName);
    }
}
