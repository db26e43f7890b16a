package com.ryuqq.registration.application.evaluation;

import com.ryuqq.registration.core.evaluation.MiResult;

/**
 * MI 평가 완료 콜백.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MiCallback {

    /**
     * 아무것도 하지 않는 콜백.
     */
    MiCallback NO_OP = (success, result) -> { };

    /**
     * 평가 종료 통지.
     *
     * @param success 성공 여부
     * @param result 성공 시 결과, 실패 시 null
     */
    void onComplete(boolean success, MiResult result);
}
