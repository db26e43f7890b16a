package com.ryuqq.registration.core.statemachine;

/**
 * 실행 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → PREPARING</li>
 *   <li>PREPARING → RUNNING, FAILED</li>
 *   <li>RUNNING → COMPLETED, FAILED, CANCELLED</li>
 *   <li>COMPLETED, FAILED, CANCELLED → IDLE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 IDLE 외의 상태로 전이 불가</li>
 *   <li>종료 상태를 거치지 않고 IDLE로 돌아갈 수 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunStateTransition {

    // Utility class - prevent instantiation
    private RunStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunState from, RunState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case IDLE -> to == RunState.PREPARING;
            case PREPARING -> to == RunState.RUNNING || to == RunState.FAILED;
            case RUNNING -> to == RunState.COMPLETED || to == RunState.FAILED || to == RunState.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> to == RunState.IDLE;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid run state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }
}
