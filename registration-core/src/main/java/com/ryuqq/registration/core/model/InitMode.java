package com.ryuqq.registration.core.model;

/**
 * 초기 정렬 모드.
 *
 * <p>초기 변환이 주어지지 않았을 때 엔진이 사용할 초기 정렬 방식입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InitMode {

    /**
     * 초기 정렬 없음 (초기 변환 사용 시).
     */
    NONE,

    /**
     * 기하 중심 정렬.
     */
    GEOMETRY,

    /**
     * 질량 중심(모멘트) 정렬.
     */
    MOMENTS;

    /**
     * 초기 변환 유무에 따른 실제 적용 모드.
     *
     * <p>초기 변환이 있으면 항상 NONE, 없으면 NONE은 GEOMETRY로 대체됩니다.</p>
     *
     * @param hasInitialTransform 초기 변환 유무
     * @return 실제 적용 모드
     */
    public InitMode effective(boolean hasInitialTransform) {
        if (hasInitialTransform) {
            return NONE;
        }
        return this == NONE ? GEOMETRY : this;
    }
}
