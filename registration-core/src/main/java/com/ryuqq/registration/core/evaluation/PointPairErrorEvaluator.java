package com.ryuqq.registration.core.evaluation;

import com.ryuqq.registration.core.model.AffineTransform3D;
import com.ryuqq.registration.core.model.Point3;
import com.ryuqq.registration.core.model.PointPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 목표 정합 오차(TRE) 계산기.
 *
 * <p>인덱스 i마다 {@code distance_i = |fixed_i − T(moving_i)|}를 계산하고
 * 평균, 최대, 최소, 모표준편차를 구합니다.</p>
 *
 * <p><strong>특성:</strong></p>
 * <ul>
 *   <li>순수 함수, 동기식, 상태 없음 (어떤 스레드에서도 호출 가능)</li>
 *   <li>빈 입력 또는 길이 불일치는 거리 계산 전에 거부 (부분 결과 없음)</li>
 *   <li>transform이 null이면 항등 변환으로 간주</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PointPairErrorEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PointPairErrorEvaluator.class);

    /**
     * 두 점 시퀀스로 TRE 계산.
     *
     * @param fixedPoints 고정 공간 점 (순서 있음)
     * @param movingPoints 이동 공간 점 (같은 길이, 같은 순서)
     * @param transform 이동 점에 적용할 변환 (null이면 항등)
     * @return TRE 결과
     * @throws IllegalArgumentException 입력이 null/비어 있거나 길이가 다른 경우
     */
    public TreResult computeTre(List<Point3> fixedPoints, List<Point3> movingPoints, AffineTransform3D transform) {
        if (fixedPoints == null || movingPoints == null) {
            throw new IllegalArgumentException("Point sequences cannot be null");
        }
        if (fixedPoints.size() != movingPoints.size()) {
            throw new IllegalArgumentException(
                "Point count mismatch (fixed: " + fixedPoints.size() + ", moving: " + movingPoints.size() + ")");
        }
        if (fixedPoints.isEmpty()) {
            throw new IllegalArgumentException("At least one point pair is required");
        }

        List<PointPair> pairs = new ArrayList<>(fixedPoints.size());
        for (int i = 0; i < fixedPoints.size(); i++) {
            Point3 fixed = fixedPoints.get(i);
            Point3 moving = movingPoints.get(i);
            if (fixed == null || moving == null) {
                throw new IllegalArgumentException("Point at index " + i + " cannot be null");
            }
            pairs.add(new PointPair(fixed, moving));
        }
        return compute(pairs, transform);
    }

    /**
     * 대응점 쌍 목록으로 TRE 계산.
     *
     * @param pairs 대응점 쌍 (1개 이상)
     * @param transform 이동 점에 적용할 변환 (null이면 항등)
     * @return TRE 결과
     * @throws IllegalArgumentException pairs가 null이거나 비어 있거나 null 원소를 포함한 경우
     */
    public TreResult computeTre(List<PointPair> pairs, AffineTransform3D transform) {
        if (pairs == null || pairs.isEmpty()) {
            throw new IllegalArgumentException("At least one point pair is required");
        }
        for (int i = 0; i < pairs.size(); i++) {
            if (pairs.get(i) == null) {
                throw new IllegalArgumentException("Point pair at index " + i + " cannot be null");
            }
        }
        return compute(pairs, transform);
    }

    private TreResult compute(List<PointPair> pairs, AffineTransform3D transform) {
        AffineTransform3D effective = transform == null ? AffineTransform3D.identity() : transform;

        List<Double> distances = new ArrayList<>(pairs.size());
        double sum = 0.0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (PointPair pair : pairs) {
            double distance = pair.fixed().distanceTo(effective.apply(pair.moving()));
            distances.add(distance);
            sum += distance;
            max = Math.max(max, distance);
            min = Math.min(min, distance);
        }

        int n = distances.size();
        double mean = sum / n;
        double squaredDeviations = 0.0;
        for (double distance : distances) {
            double deviation = distance - mean;
            squaredDeviations += deviation * deviation;
        }
        double std = Math.sqrt(squaredDeviations / n);

        TreResult result = new TreResult(distances, mean, max, min, std, n);
        log.info("TRE computed: n={}, mean={}, max={}, min={}, std={}",
            n, format(mean), format(max), format(min), format(std));
        return result;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
