package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.core.spi.CallerLoop;
import com.ryuqq.registration.core.spi.LoopTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * 호출자 루프 위의 비차단 종료 감시기.
 *
 * <p>고정 간격으로 종료 조건을 확인하고, 처음 참이 되는 순간 반복 작업을 취소한 뒤
 * 완료 동작을 정확히 한 번 실행합니다. 조건과 완료 동작 모두 호출자 루프 스레드에서 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompletionWatch {

    private static final Logger log = LoggerFactory.getLogger(CompletionWatch.class);

    private final CallerLoop loop;
    private final long intervalMs;
    private final BooleanSupplier finished;
    private final Runnable onFinished;

    private LoopTask task;
    private boolean fired;

    /**
     * 생성자.
     *
     * @param loop 호출자 루프
     * @param intervalMs 확인 간격 (밀리초, 양수여야 함)
     * @param finished 종료 조건
     * @param onFinished 완료 동작
     */
    public CompletionWatch(CallerLoop loop, long intervalMs, BooleanSupplier finished, Runnable onFinished) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        if (finished == null || onFinished == null) {
            throw new IllegalArgumentException("finished and onFinished cannot be null");
        }
        this.loop = loop;
        this.intervalMs = intervalMs;
        this.finished = finished;
        this.onFinished = onFinished;
    }

    /**
     * 감시 시작.
     *
     * @throws IllegalStateException 이미 시작한 경우
     */
    public void start() {
        if (task != null) {
            throw new IllegalStateException("CompletionWatch already started");
        }
        task = loop.scheduleAtFixedRate(this::tick, intervalMs);
    }

    /**
     * 완료 동작 실행 여부.
     *
     * @return 실행했으면 true
     */
    public boolean isFired() {
        return fired;
    }

    private void tick() {
        if (fired || !finished.getAsBoolean()) {
            return;
        }
        fired = true;
        task.cancel();
        try {
            onFinished.run();
        } catch (RuntimeException e) {
            log.error("Completion handler failed", e);
        }
    }
}
