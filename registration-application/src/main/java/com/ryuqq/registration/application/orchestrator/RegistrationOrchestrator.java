package com.ryuqq.registration.application.orchestrator;

import com.ryuqq.registration.core.model.RegistrationRequest;
import com.ryuqq.registration.core.outcome.RegistrationResult;
import com.ryuqq.registration.core.statemachine.RunState;

import java.util.Optional;

/**
 * 외부 정합 엔진 실행 조정자.
 *
 * <p>요청을 검증하고 작업 디렉터리를 준비한 뒤 엔진 프로세스를 시작하며,
 * 호출자 루프의 고정 간격 폴링으로 종료를 관찰합니다. 결과는 콜백으로 정확히 한 번 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * orchestrator.submitRegistration(request, (success, slot) -&gt; {
 *     if (success) {
 *         // slot.content()에 정합 결과
 *     }
 * });
 *
 * // 필요 시 취소 (비동기, 콜백은 success=false로 호출됨)
 * orchestrator.cancel();
 * </pre>
 *
 * <p><strong>스레드 모델:</strong> 모든 메서드는 호출자 루프 스레드에서 호출해야 하며, 블로킹하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RegistrationOrchestrator {

    /**
     * 정합 실행 제출.
     *
     * <p>콜백은 이 메서드 안에서 호출되지 않습니다. 검증 실패도 다음 루프 회차에 콜백으로 전달됩니다.</p>
     *
     * @param request 정합 요청
     * @param callback 완료 콜백 (필요 없으면 {@link RegistrationCallback#NO_OP})
     * @throws IllegalArgumentException request 또는 callback이 null인 경우
     * @throws IllegalStateException 이미 실행 중인 정합이 있는 경우
     */
    void submitRegistration(RegistrationRequest request, RegistrationCallback callback);

    /**
     * 콜백 없이 정합 실행 제출.
     *
     * @param request 정합 요청
     * @throws IllegalArgumentException request가 null인 경우
     * @throws IllegalStateException 이미 실행 중인 정합이 있는 경우
     */
    default void submitRegistration(RegistrationRequest request) {
        submitRegistration(request, RegistrationCallback.NO_OP);
    }

    /**
     * 실행 중인 정합 취소 요청.
     *
     * <p>최선 노력(best-effort)이며 즉시 효과를 보장하지 않습니다.
     * 종료는 폴링으로 관찰되고, 정리 후 콜백이 {@code success=false}로 호출됩니다.
     * 실행 중인 정합이 없으면 아무 일도 하지 않습니다.</p>
     */
    void cancel();

    /**
     * 현재 실행 상태 조회.
     *
     * @return 실행 상태
     */
    RunState state();

    /**
     * 가장 최근 실행의 결과 조회.
     *
     * @return 최근 결과 (아직 종료된 실행이 없으면 empty)
     */
    Optional<RegistrationResult> lastResult();

    /**
     * 실행 중인 정합이 있는지 확인.
     *
     * @return IDLE이 아니면 true
     */
    default boolean isBusy() {
        return state() != RunState.IDLE;
    }
}
