package com.ryuqq.registration.application.orchestrator;

import com.ryuqq.registration.core.model.TransformSlot;

/**
 * 정합 완료 콜백.
 *
 * <p>실행마다 정확히 한 번, 호출자 루프에서, 작업 디렉터리 정리 후에 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegistrationCallback {

    /**
     * 아무것도 하지 않는 콜백 (콜백이 필요 없는 호출자용).
     */
    RegistrationCallback NO_OP = (success, outputSlot) -> { };

    /**
     * 실행 종료 통지.
     *
     * @param success 성공 여부
     * @param outputSlot 성공 시 결과가 복사된 출력 슬롯, 실패 시 null
     */
    void onComplete(boolean success, TransformSlot outputSlot);
}
