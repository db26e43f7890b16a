package com.ryuqq.registration.core.model;

/**
 * 대응점 쌍.
 *
 * <p>고정 공간 좌표와 이동 공간 좌표를 시퀀스 인덱스로 대응시킵니다 (라벨로 대응시키지 않음).</p>
 *
 * @param fixed 고정 공간 좌표
 * @param moving 이동 공간 좌표
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PointPair(Point3 fixed, Point3 moving) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fixed 또는 moving이 null인 경우
     */
    public PointPair {
        if (fixed == null) {
            throw new IllegalArgumentException("fixed cannot be null");
        }
        if (moving == null) {
            throw new IllegalArgumentException("moving cannot be null");
        }
    }
}
