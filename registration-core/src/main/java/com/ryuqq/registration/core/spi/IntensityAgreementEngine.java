package com.ryuqq.registration.core.spi;

import com.ryuqq.registration.core.model.NodeRef;

/**
 * 밝기 일치도(상호 정보량) 계산 엔진 SPI.
 *
 * <p>동기식이며 오래 걸릴 수 있습니다. 호출자는 이 메서드를 직접 부르지 않고
 * {@code IntensityAgreementEvaluator}를 통해 워커 스레드에서 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface IntensityAgreementEngine {

    /**
     * 상호 정보량 계산.
     *
     * @param fixed 고정 볼륨
     * @param moving 이동 볼륨
     * @param transform 이동 볼륨에 적용할 변환
     * @param fixedMask 고정 볼륨 마스크 (null 가능)
     * @return 유사도 값
     * @throws Exception 네이티브 계산 실패 시
     */
    double evaluate(NodeRef fixed, NodeRef moving, NodeRef transform, NodeRef fixedMask) throws Exception;

    /**
     * 계산 방식 태그.
     *
     * @return 방식 이름 (기본 "Mattes MI")
     */
    default String methodTag() {
        return "Mattes MI";
    }
}
