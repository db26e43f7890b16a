package com.ryuqq.registration.adapter.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * DefaultRegistrationOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: 프로세스 종료 확인 간격 (기본 100ms)</li>
 *   <li>workRoot: 작업 디렉터리 상위 경로 (기본 null = 시스템 임시 디렉터리)</li>
 *   <li>workDirPrefix: 작업 디렉터리 이름 접두사 (기본 "registration_", 경로 구분자 불가)</li>
 *   <li>resultMarker: 결과 변환 파일 이름 표식 (기본 "registration_transform")</li>
 *   <li>initialTransformFileName: 초기 변환 내보내기 파일 이름 (기본 "initial_transform.h5")</li>
 *   <li>artifactExtensions: 결과 변환 확장자 (기본 ".h5", ".tfm")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollingIntervalMs 폴링 간격 (밀리초, 양수여야 함)
 * @param workRoot 작업 디렉터리 상위 경로 (null 허용)
 * @param workDirPrefix 작업 디렉터리 접두사
 * @param resultMarker 결과 파일 표식
 * @param initialTransformFileName 초기 변환 파일 이름
 * @param artifactExtensions 결과 파일 확장자 목록 (비어 있으면 안 됨)
 */
public record RegistrationSettings(
    long pollingIntervalMs,
    Path workRoot,
    String workDirPrefix,
    String resultMarker,
    String initialTransformFileName,
    List<String> artifactExtensions
) {

    /**
     * 기본 설정 생성자.
     */
    public RegistrationSettings() {
        this(100, null, "registration_", "registration_transform", "initial_transform.h5", List.of(".h5", ".tfm"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RegistrationSettings {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (workDirPrefix == null) {
            throw new IllegalArgumentException("workDirPrefix cannot be null");
        }
        if (workDirPrefix.indexOf('/') >= 0 || workDirPrefix.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("workDirPrefix cannot contain a path separator: " + workDirPrefix);
        }
        if (resultMarker == null || resultMarker.isBlank()) {
            throw new IllegalArgumentException("resultMarker cannot be null or blank");
        }
        if (initialTransformFileName == null || initialTransformFileName.isBlank()) {
            throw new IllegalArgumentException("initialTransformFileName cannot be null or blank");
        }
        if (artifactExtensions == null || artifactExtensions.isEmpty()) {
            throw new IllegalArgumentException("artifactExtensions cannot be null or empty");
        }
        artifactExtensions = List.copyOf(artifactExtensions);
    }

    /**
     * pollingIntervalMs만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withPollingIntervalMs(long pollingIntervalMs) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }

    /**
     * workRoot만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withWorkRoot(Path workRoot) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }

    /**
     * workDirPrefix만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withWorkDirPrefix(String workDirPrefix) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }

    /**
     * resultMarker만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withResultMarker(String resultMarker) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }

    /**
     * initialTransformFileName만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withInitialTransformFileName(String initialTransformFileName) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }

    /**
     * artifactExtensions만 변경한 새 인스턴스 생성.
     */
    public RegistrationSettings withArtifactExtensions(List<String> artifactExtensions) {
        return new RegistrationSettings(pollingIntervalMs, workRoot, workDirPrefix, resultMarker, initialTransformFileName, artifactExtensions);
    }
}
