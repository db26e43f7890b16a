package com.ryuqq.registration.adapter.inmemory.loop;

import com.ryuqq.registration.core.spi.CallerLoop;
import com.ryuqq.registration.core.spi.LoopTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 단일 스레드 {@link CallerLoop} 구현체.
 *
 * <p>하나의 데몬 스레드를 가진 {@link ScheduledExecutorService} 위에서 모든 작업을 순서대로 실행합니다.
 * UI 툴킷의 이벤트 루프가 없는 환경(CLI, 서버)에서 호출자 루프로 사용합니다.</p>
 *
 * <p>반복 작업에서 발생한 예외는 로그로 남기고 삼켜서 스케줄이 중단되지 않게 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SingleThreadCallerLoop implements CallerLoop, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadCallerLoop.class);

    private final ScheduledExecutorService scheduler;
    private volatile Thread loopThread;

    /**
     * 생성자 (스레드 이름 "caller-loop").
     */
    public SingleThreadCallerLoop() {
        this("caller-loop");
    }

    /**
     * 생성자.
     *
     * @param threadName 루프 스레드 이름
     * @throws IllegalArgumentException threadName이 null/빈 문자열인 경우
     */
    public SingleThreadCallerLoop(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        scheduler.execute(() -> runSafely(task));
    }

    @Override
    public LoopTask scheduleAtFixedRate(Runnable task, long periodMs) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (periodMs <= 0) {
            throw new IllegalArgumentException("periodMs must be positive (current: " + periodMs + ")");
        }
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
            () -> runSafely(task), periodMs, periodMs, TimeUnit.MILLISECONDS);
        return new LoopTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    /**
     * 현재 스레드가 루프 스레드인지 확인.
     *
     * @return 루프 스레드이면 true
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * 루프 종료. 대기 중인 작업은 실행되지 않습니다.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Caller loop task failed", e);
        }
    }
}
