package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.application.evaluation.IntensityAgreementEvaluator;
import com.ryuqq.registration.application.evaluation.MiCallback;
import com.ryuqq.registration.core.evaluation.MiResult;
import com.ryuqq.registration.core.model.NodeRef;
import com.ryuqq.registration.core.spi.CallerLoop;
import com.ryuqq.registration.core.spi.IntensityAgreementEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 작업 스레드 기반 {@link IntensityAgreementEvaluator} 구현체.
 *
 * <p>상호 정보량 계산을 데몬 작업 스레드에서 실행하고,
 * 호출자 루프에서 작업 스레드 종료를 확인한 뒤 콜백을 한 번 호출합니다.</p>
 *
 * <p><strong>결과 규칙:</strong></p>
 * <ul>
 *   <li>엔진 예외, 유한하지 않은 값, 취소 요청 → success=false, result=null</li>
 *   <li>정상 → success=true, MiResult(value, 마스크 사용 여부, 엔진 방법 이름)</li>
 * </ul>
 *
 * <p>동시에 하나의 평가만 허용합니다. 모든 공개 메서드는 호출자 루프 스레드에서 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerThreadIntensityEvaluator implements IntensityAgreementEvaluator {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadIntensityEvaluator.class);

    private static final long DEFAULT_POLLING_INTERVAL_MS = 100;
    private static final String WORKER_THREAD_NAME = "mi-evaluation";

    private final CallerLoop loop;
    private final IntensityAgreementEngine engine;
    private final long pollingIntervalMs;

    private Evaluation current;

    /**
     * 생성자 (기본 폴링 간격 100ms).
     *
     * @param loop 호출자 루프
     * @param engine 상호 정보량 엔진
     */
    public WorkerThreadIntensityEvaluator(CallerLoop loop, IntensityAgreementEngine engine) {
        this(loop, engine, DEFAULT_POLLING_INTERVAL_MS);
    }

    /**
     * 생성자.
     *
     * @param loop 호출자 루프
     * @param engine 상호 정보량 엔진
     * @param pollingIntervalMs 작업 스레드 종료 확인 간격
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public WorkerThreadIntensityEvaluator(CallerLoop loop, IntensityAgreementEngine engine, long pollingIntervalMs) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException("pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")");
        }
        this.loop = loop;
        this.engine = engine;
        this.pollingIntervalMs = pollingIntervalMs;
    }

    @Override
    public void submitMiEvaluation(NodeRef fixed, NodeRef moving, NodeRef transform, NodeRef fixedMask, MiCallback callback) {
        if (fixed == null || moving == null) {
            throw new IllegalArgumentException("fixed and moving cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (current != null) {
            throw new IllegalStateException("MI evaluation already in progress");
        }

        Evaluation evaluation = new Evaluation(fixedMask != null, callback);
        evaluation.worker = new Thread(
            () -> evaluation.compute(engine, fixed, moving, transform, fixedMask), WORKER_THREAD_NAME);
        evaluation.worker.setDaemon(true);
        current = evaluation;

        log.info("Computing {} (mask: {})", engine.methodTag(), fixedMask != null ? "yes" : "no");
        evaluation.worker.start();
        new CompletionWatch(loop, pollingIntervalMs,
            () -> !evaluation.worker.isAlive(), () -> complete(evaluation)).start();
    }

    @Override
    public void cancel() {
        Evaluation evaluation = current;
        if (evaluation == null) {
            return;
        }
        log.info("Cancelling MI evaluation");
        evaluation.stopRequested = true;
        evaluation.worker.interrupt();
    }

    @Override
    public boolean isBusy() {
        return current != null;
    }

    private void complete(Evaluation evaluation) {
        current = null;
        MiResult result = null;
        boolean success = evaluation.success && !evaluation.stopRequested;
        if (success) {
            result = new MiResult(evaluation.value, evaluation.maskUsed, engine.methodTag());
            log.info(String.format(Locale.ROOT, "MI = %.6f", evaluation.value));
        } else if (evaluation.stopRequested) {
            log.info("MI evaluation cancelled");
        } else if (evaluation.failure != null) {
            log.warn("MI evaluation failed: {}", evaluation.failure.toString());
        } else {
            log.warn("MI evaluation produced a non-finite value");
        }
        try {
            evaluation.callback.onComplete(success, result);
        } catch (RuntimeException e) {
            log.error("MI callback failed", e);
        }
    }

    private static final class Evaluation {

        private final boolean maskUsed;
        private final MiCallback callback;
        private Thread worker;

        private volatile boolean success;
        private volatile double value = Double.NaN;
        private volatile Exception failure;
        private volatile boolean stopRequested;

        private Evaluation(boolean maskUsed, MiCallback callback) {
            this.maskUsed = maskUsed;
            this.callback = callback;
        }

        private void compute(IntensityAgreementEngine engine, NodeRef fixed, NodeRef moving, NodeRef transform, NodeRef fixedMask) {
            try {
                double computed = engine.evaluate(fixed, moving, transform, fixedMask);
                value = computed;
                success = Double.isFinite(computed);
            } catch (Exception e) {
                failure = e;
                success = false;
            }
        }
    }
}
