package com.ryuqq.registration.core.model;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 정합 설정 선택 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>strategy: 알고리즘 전략 (기본 RIGID)</li>
 *   <li>customConfigPath: 사용자 지정 설정 파일 (선택, 존재하면 전략보다 우선)</li>
 *   <li>samplingPercentage: 샘플링 비율 (0 초과 1 이하, 기본 0.1)</li>
 *   <li>initMode: 초기 정렬 모드 (기본 GEOMETRY)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param strategy 알고리즘 전략
 * @param customConfigPath 사용자 지정 설정 파일 (null 가능)
 * @param samplingPercentage 샘플링 비율 (0 초과 1 이하)
 * @param initMode 초기 정렬 모드
 */
public record ConfigSelection(
    RegistrationStrategy strategy,
    Path customConfigPath,
    double samplingPercentage,
    InitMode initMode
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: strategy=RIGID, customConfigPath=null, samplingPercentage=0.1, initMode=GEOMETRY</p>
     */
    public ConfigSelection() {
        this(RegistrationStrategy.RIGID, null, 0.10, InitMode.GEOMETRY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConfigSelection {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (initMode == null) {
            throw new IllegalArgumentException("initMode cannot be null");
        }
        if (!(samplingPercentage > 0.0 && samplingPercentage <= 1.0)) {
            throw new IllegalArgumentException(
                "samplingPercentage must be in (0, 1] (current: " + samplingPercentage + ")"
            );
        }
        // customConfigPath는 null 허용
    }

    /**
     * 사용자 지정 설정 파일 조회.
     *
     * @return 사용자 지정 설정 파일 (없으면 empty)
     */
    public Optional<Path> customConfig() {
        return Optional.ofNullable(customConfigPath);
    }

    /**
     * strategy만 변경한 새 인스턴스 생성.
     */
    public ConfigSelection withStrategy(RegistrationStrategy strategy) {
        return new ConfigSelection(strategy, customConfigPath, samplingPercentage, initMode);
    }

    /**
     * customConfigPath만 변경한 새 인스턴스 생성.
     */
    public ConfigSelection withCustomConfigPath(Path customConfigPath) {
        return new ConfigSelection(strategy, customConfigPath, samplingPercentage, initMode);
    }

    /**
     * samplingPercentage만 변경한 새 인스턴스 생성.
     */
    public ConfigSelection withSamplingPercentage(double samplingPercentage) {
        return new ConfigSelection(strategy, customConfigPath, samplingPercentage, initMode);
    }

    /**
     * initMode만 변경한 새 인스턴스 생성.
     */
    public ConfigSelection withInitMode(InitMode initMode) {
        return new ConfigSelection(strategy, customConfigPath, samplingPercentage, initMode);
    }
}
