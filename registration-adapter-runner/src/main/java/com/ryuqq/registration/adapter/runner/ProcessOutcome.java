package com.ryuqq.registration.adapter.runner;

/**
 * 외부 프로세스 종료 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param exitCode 종료 코드
 * @param cancelled stop() 요청 여부 (종료 코드와 무관하게 취소로 취급)
 */
public record ProcessOutcome(int exitCode, boolean cancelled) {

    /**
     * 정상 종료 여부.
     *
     * @return 취소되지 않았고 종료 코드가 0이면 true
     */
    public boolean succeeded() {
        return !cancelled && exitCode == 0;
    }
}
