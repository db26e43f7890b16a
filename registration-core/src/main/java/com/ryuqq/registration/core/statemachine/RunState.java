package com.ryuqq.registration.core.statemachine;

/**
 * 정합 실행의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * IDLE
 *    │
 *    ▼ (submit)
 * PREPARING ──► FAILED (검증/설정/내보내기 실패)
 *    │
 *    ▼ (프로세스 시작)
 * RUNNING
 *    │
 *    ├─► COMPLETED (결과 복구 성공)
 *    ├─► FAILED (종료 코드 ≠ 0, 결과 없음, 변환 읽기 실패)
 *    └─► CANCELLED (취소)
 *
 * 종료 상태 ──► IDLE (정리 후 재사용)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 대기 중 (실행 없음).
     */
    IDLE,

    /**
     * 입력 검증 및 작업 디렉터리 준비 중.
     */
    PREPARING,

    /**
     * 외부 엔진 실행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 IDLE로만 전이할 수 있습니다.</p>
     *
     * @return COMPLETED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 실행이 진행 중인지 확인.
     *
     * @return PREPARING 또는 RUNNING인 경우 true
     */
    public boolean isActive() {
        return this == PREPARING || this == RUNNING;
    }
}
