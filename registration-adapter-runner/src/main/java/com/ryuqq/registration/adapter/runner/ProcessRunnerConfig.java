package com.ryuqq.registration.adapter.runner;

/**
 * ExternalProcessRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>gracePeriodMs: 정상 종료 요청 후 강제 종료까지 대기 시간 (기본 5000ms)</li>
 *   <li>threadNamePrefix: 출력 수집/강제 종료 스레드 이름 접두사 (기본 "registration-engine")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param gracePeriodMs 강제 종료 유예 시간 (밀리초, 양수여야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (빈 문자열 불가)
 */
public record ProcessRunnerConfig(
    long gracePeriodMs,
    String threadNamePrefix
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: gracePeriodMs=5000ms, threadNamePrefix="registration-engine"</p>
     */
    public ProcessRunnerConfig() {
        this(5000, "registration-engine");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProcessRunnerConfig {
        if (gracePeriodMs <= 0) {
            throw new IllegalArgumentException(
                "gracePeriodMs must be positive (current: " + gracePeriodMs + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * gracePeriodMs만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withGracePeriodMs(long gracePeriodMs) {
        return new ProcessRunnerConfig(gracePeriodMs, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ProcessRunnerConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ProcessRunnerConfig(gracePeriodMs, threadNamePrefix);
    }
}
