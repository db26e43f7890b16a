package com.ryuqq.registration.core.evaluation;

/**
 * 밝기 일치도(상호 정보량) 계산 결과.
 *
 * @param value 유사도 값
 * @param maskUsed 고정 볼륨 마스크 사용 여부
 * @param method 계산 방식 태그 (예: "Mattes MI")
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MiResult(
    double value,
    boolean maskUsed,
    String method
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 유한하지 않거나 method가 null/빈 문자열인 경우
     */
    public MiResult {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite (current: " + value + ")");
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
    }

    /**
     * 부호를 뒤집은 값 (최적화기가 최소화하는 비용 형태).
     *
     * @return -value
     */
    public double negativeValue() {
        return -value;
    }
}
