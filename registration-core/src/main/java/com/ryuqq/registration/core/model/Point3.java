package com.ryuqq.registration.core.model;

/**
 * 3차원 좌표 (mm 단위, 월드 좌표계).
 *
 * @param x X 좌표
 * @param y Y 좌표
 * @param z Z 좌표
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Point3(double x, double y, double z) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 좌표에 NaN 또는 무한대가 포함된 경우
     */
    public Point3 {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException(
                "Point coordinates must be finite (current: " + x + ", " + y + ", " + z + ")");
        }
    }

    /**
     * Point3 생성.
     *
     * @param x X 좌표
     * @param y Y 좌표
     * @param z Z 좌표
     * @return Point3 인스턴스
     */
    public static Point3 of(double x, double y, double z) {
        return new Point3(x, y, z);
    }

    /**
     * 다른 점까지의 유클리드 거리.
     *
     * @param other 대상 점
     * @return 유클리드 거리
     * @throws IllegalArgumentException other가 null인 경우
     */
    public double distanceTo(Point3 other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
