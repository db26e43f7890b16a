package com.ryuqq.registration.core.outcome;

/**
 * 정합 실패.
 *
 * <p>검증, 설정, 프로세스, 결과 복구 실패 및 취소를 모두 같은 채널로 표현합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>fixed 볼륨 누락 → VALIDATION</li>
 *   <li>엔진 종료 코드 1 → PROCESS_FAILURE</li>
 *   <li>종료 코드 0, 결과 파일 없음 → MISSING_OUTPUT</li>
 *   <li>cancel() 호출 → CANCELLED</li>
 * </ul>
 *
 * @param errorCode 오류 분류
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    ErrorCode errorCode,
    String message,
    String cause
) implements RegistrationResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode가 null이거나 message가 null/빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     *
     * @param errorCode 오류 분류
     * @param message 오류 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorCode errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     *
     * @param errorCode 오류 분류
     * @param message 오류 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(ErrorCode errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    /**
     * 취소에 의한 실패인지 확인.
     *
     * @return errorCode가 CANCELLED이면 true
     */
    public boolean isCancelled() {
        return errorCode == ErrorCode.CANCELLED;
    }
}
