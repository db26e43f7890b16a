package com.ryuqq.registration.core.outcome;

/**
 * 정합 실패 분류.
 *
 * <p>모든 실패는 오케스트레이션 경계에서 {@link Fail}로 정규화되어
 * 단일 {@code (success, result|null)} 콜백으로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 입력 검증 실패 (fixed/moving 누락 등). 비용이 큰 작업 전에 감지됩니다.
     */
    VALIDATION("REG-001"),

    /**
     * 설정 실패 (설정 파일 또는 엔진 실행 파일을 찾을 수 없음). 프로세스 시작 전에 감지됩니다.
     */
    CONFIGURATION("REG-002"),

    /**
     * 입력 내보내기 실패 (작업 디렉터리 생성 또는 볼륨/변환 내보내기).
     */
    EXPORT("REG-003"),

    /**
     * 엔진 프로세스 실패 (0이 아닌 종료 코드 또는 시작 실패).
     */
    PROCESS_FAILURE("REG-004"),

    /**
     * 엔진은 정상 종료했으나 변환 결과 파일이 없음.
     */
    MISSING_OUTPUT("REG-005"),

    /**
     * 결과 파일은 있으나 변환으로 읽을 수 없음.
     */
    TRANSFORM_LOAD("REG-006"),

    /**
     * 호출자 요청에 의한 취소.
     */
    CANCELLED("REG-007");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 외부 노출용 오류 코드.
     *
     * @return 오류 코드 (예: REG-005)
     */
    public String code() {
        return code;
    }
}
