package com.ryuqq.registration.adapter.runner;

/**
 * 외부 프로세스 수명 상태.
 *
 * <pre>
 * NOT_STARTED → SPAWNED → STREAMING → EXITED
 *                  │           │
 *                  └───────────┴──→ KILLED (stop 요청)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ProcessState {

    /** start() 호출 전. */
    NOT_STARTED,

    /** 프로세스 생성 완료, 출력 수신 전. */
    SPAWNED,

    /** 출력 라인 수신 중. */
    STREAMING,

    /** 프로세스 종료 및 출력 소진 완료. */
    EXITED,

    /** stop() 요청으로 종료됨. */
    KILLED
}
