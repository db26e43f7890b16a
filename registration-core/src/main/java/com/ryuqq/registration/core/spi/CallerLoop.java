package com.ryuqq.registration.core.spi;

/**
 * 호출자의 단일 스레드 협력형 루프.
 *
 * <p>호출자 상태(출력 슬롯, 실행 상태, 콜백)는 이 루프에서만 변경됩니다.
 * 백그라운드 스레드나 외부 프로세스의 완료는 {@link #scheduleAtFixedRate(Runnable, long)}로
 * 등록한 비블로킹 폴링으로만 관찰합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>모든 작업은 하나의 스레드에서 순서대로 실행되어야 합니다.</li>
 *   <li>{@code execute}와 {@code scheduleAtFixedRate}는 즉시 반환해야 합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CallerLoop {

    /**
     * 다음 루프 회차에 작업 실행.
     *
     * @param task 실행할 작업
     * @throws IllegalArgumentException task가 null인 경우
     */
    void execute(Runnable task);

    /**
     * 고정 간격 반복 작업 등록.
     *
     * @param task 반복할 작업 (비블로킹이어야 함)
     * @param periodMs 반복 간격 (밀리초, 양수)
     * @return 등록된 작업 핸들
     * @throws IllegalArgumentException task가 null이거나 periodMs가 양수가 아닌 경우
     */
    LoopTask scheduleAtFixedRate(Runnable task, long periodMs);
}
