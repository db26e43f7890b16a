package com.ryuqq.registration.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 외부 프로세스 출력 라인 수신자.
 *
 * <p>출력 수집 스레드에서 호출됩니다. 구현체는 빠르게 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LineSink {

    /**
     * 출력 라인 수신.
     *
     * @param line 줄바꿈이 제거된 출력 라인
     */
    void accept(String line);

    /**
     * "registration.engine" 로거에 INFO로 기록하는 수신자.
     *
     * @return 로깅 수신자
     */
    static LineSink logging() {
        Logger engineLog = LoggerFactory.getLogger("registration.engine");
        return line -> engineLog.info("{}", line);
    }
}
