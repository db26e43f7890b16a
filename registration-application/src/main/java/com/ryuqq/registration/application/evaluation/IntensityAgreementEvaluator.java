package com.ryuqq.registration.application.evaluation;

import com.ryuqq.registration.core.model.NodeRef;

/**
 * 밝기 일치도(상호 정보량) 비동기 평가기.
 *
 * <p>느린 동기식 계산을 워커 스레드에서 실행하고, 호출자 루프의 고정 간격 폴링으로
 * 워커 종료를 관찰한 뒤 콜백을 정확히 한 번 호출합니다.</p>
 *
 * <p><strong>스레드 모델:</strong> 모든 메서드는 호출자 루프 스레드에서 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface IntensityAgreementEvaluator {

    /**
     * MI 평가 제출.
     *
     * @param fixed 고정 볼륨
     * @param moving 이동 볼륨
     * @param transform 이동 볼륨에 적용할 변환
     * @param fixedMask 고정 볼륨 마스크 (null 가능)
     * @param callback 완료 콜백
     * @throws IllegalArgumentException fixed, moving, transform, callback 중 하나라도 null인 경우
     * @throws IllegalStateException 이미 진행 중인 평가가 있는 경우
     */
    void submitMiEvaluation(NodeRef fixed, NodeRef moving, NodeRef transform, NodeRef fixedMask, MiCallback callback);

    /**
     * 진행 중인 평가 취소 요청 (협력적 중단 플래그).
     *
     * <p>취소된 평가는 {@code success=false}로 완료됩니다.</p>
     */
    void cancel();

    /**
     * 진행 중인 평가가 있는지 확인.
     *
     * @return 평가 진행 중이면 true
     */
    boolean isBusy();
}
