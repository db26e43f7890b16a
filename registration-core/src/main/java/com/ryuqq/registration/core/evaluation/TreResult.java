package com.ryuqq.registration.core.evaluation;

import java.util.List;

/**
 * 목표 정합 오차(TRE) 계산 결과.
 *
 * @param distances 점 쌍별 거리 (입력 순서 유지, mm)
 * @param mean 평균
 * @param max 최대
 * @param min 최소
 * @param standardDeviation 모표준편차
 * @param count 점 쌍 개수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TreResult(
    List<Double> distances,
    double mean,
    double max,
    double min,
    double standardDeviation,
    int count
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException distances가 null이거나 count와 크기가 다른 경우
     */
    public TreResult {
        if (distances == null) {
            throw new IllegalArgumentException("distances cannot be null");
        }
        if (distances.size() != count) {
            throw new IllegalArgumentException(
                "count must match distances size (count: " + count + ", size: " + distances.size() + ")");
        }
        distances = List.copyOf(distances);
    }
}
