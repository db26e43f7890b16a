package com.ryuqq.registration.core.spi;

/**
 * {@link CallerLoop}에 등록된 반복 작업 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LoopTask {

    /**
     * 반복 작업 취소. 여러 번 호출해도 안전합니다.
     */
    void cancel();

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    boolean isCancelled();
}
