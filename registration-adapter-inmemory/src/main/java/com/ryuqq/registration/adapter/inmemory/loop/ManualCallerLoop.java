package com.ryuqq.registration.adapter.inmemory.loop;

import com.ryuqq.registration.core.spi.CallerLoop;
import com.ryuqq.registration.core.spi.LoopTask;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * 수동 구동 {@link CallerLoop} 구현체 (테스트용).
 *
 * <p>작업은 {@link #runPending()} 또는 {@link #runUntil(BooleanSupplier, Duration)}를 호출한
 * 스레드에서만 실행됩니다. 테스트 스레드가 곧 호출자 루프가 되므로,
 * 콜백과 상태 변경이 어느 스레드에서 일어나는지 결정적으로 검증할 수 있습니다.</p>
 *
 * <p><strong>주의:</strong> 스레드 안전하지 않습니다. 루프를 구동하는 한 스레드에서만 사용해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManualCallerLoop implements CallerLoop {

    private static final long IDLE_SLEEP_MS = 5;

    private final Deque<Runnable> immediate = new ArrayDeque<>();
    private final List<Periodic> periodic = new ArrayList<>();
    private Thread ownerThread;
    private int executedCount;

    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        immediate.addLast(task);
    }

    @Override
    public LoopTask scheduleAtFixedRate(Runnable task, long periodMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (periodMs <= 0) {
            throw new IllegalArgumentException("periodMs must be positive (current: " + periodMs + ")");
        }
        Periodic entry = new Periodic(task, periodMs * 1_000_000L, System.nanoTime() + periodMs * 1_000_000L);
        periodic.add(entry);
        return entry;
    }

    /**
     * 즉시 작업 전부와 기한이 된 반복 작업을 한 번씩 실행.
     *
     * @return 실행한 작업 수
     */
    public int runPending() {
        ownerThread = Thread.currentThread();
        int ran = 0;
        Runnable task;
        while ((task = immediate.pollFirst()) != null) {
            task.run();
            ran++;
        }
        long now = System.nanoTime();
        for (Periodic entry : new ArrayList<>(periodic)) {
            if (entry.cancelled) {
                continue;
            }
            if (now - entry.nextRunNanos >= 0) {
                entry.nextRunNanos = now + entry.periodNanos;
                entry.task.run();
                ran++;
            }
        }
        periodic.removeIf(entry -> entry.cancelled);
        executedCount += ran;
        return ran;
    }

    /**
     * 조건이 참이 될 때까지 루프 구동.
     *
     * @param condition 종료 조건 (루프 스레드에서 평가)
     * @param timeout 최대 대기 시간
     * @return 시간 안에 조건이 참이 되었으면 true
     */
    public boolean runUntil(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            runPending();
            if (condition.getAsBoolean()) {
                return true;
            }
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(IDLE_SLEEP_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Loop interrupted", e);
            }
        }
    }

    /**
     * 지정한 시간 동안 루프 구동.
     *
     * @param duration 구동 시간
     */
    public void runFor(Duration duration) {
        runUntil(() -> false, duration);
    }

    /**
     * 활성 반복 작업 수.
     *
     * @return 취소되지 않은 반복 작업 수
     */
    public int activePeriodicCount() {
        int count = 0;
        for (Periodic entry : periodic) {
            if (!entry.cancelled) {
                count++;
            }
        }
        return count;
    }

    /**
     * 대기 중인 즉시 작업 수.
     *
     * @return 즉시 작업 수
     */
    public int pendingImmediateCount() {
        return immediate.size();
    }

    /**
     * 지금까지 실행한 작업 수.
     *
     * @return 실행 수
     */
    public int executedCount() {
        return executedCount;
    }

    /**
     * 마지막으로 루프를 구동한 스레드.
     *
     * @return 루프 스레드 (아직 구동 전이면 null)
     */
    public Thread ownerThread() {
        return ownerThread;
    }

    private static final class Periodic implements LoopTask {

        private final Runnable task;
        private final long periodNanos;
        private long nextRunNanos;
        private boolean cancelled;

        private Periodic(Runnable task, long periodNanos, long nextRunNanos) {
            this.task = task;
            this.periodNanos = periodNanos;
            this.nextRunNanos = nextRunNanos;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
