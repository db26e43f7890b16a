package com.ryuqq.registration.core.model;

import java.util.Arrays;

/**
 * 3차원 동차(homogeneous) 아핀 변환 행렬 (4x4, row-major).
 *
 * <p>강체(rigid) 또는 아핀(affine) 변환을 표현합니다. 마지막 행은 항상 {@code 0 0 0 1}이어야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 내부 배열은 방어적으로 복사되며 외부에 노출되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AffineTransform3D t = AffineTransform3D.translation(1.0, 0.0, 0.0);
 * Point3 moved = t.apply(Point3.of(0, 0, 0)); // (1, 0, 0)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AffineTransform3D {

    private static final double LAST_ROW_TOLERANCE = 1e-9;
    private static final AffineTransform3D IDENTITY = new AffineTransform3D(new double[] {
        1, 0, 0, 0,
        0, 1, 0, 0,
        0, 0, 1, 0,
        0, 0, 0, 1
    });

    private final double[] matrix;

    private AffineTransform3D(double[] matrix) {
        this.matrix = matrix;
    }

    /**
     * 행렬 값으로 변환 생성.
     *
     * <p>16개 값(4x4 전체) 또는 12개 값(상위 3행, 마지막 행은 {@code 0 0 0 1}로 보완)을 받습니다.</p>
     *
     * @param values row-major 행렬 값
     * @return AffineTransform3D 인스턴스
     * @throws IllegalArgumentException 값 개수가 12 또는 16이 아니거나, 유한하지 않은 값이 있거나,
     *                                  마지막 행이 {@code 0 0 0 1}이 아닌 경우
     */
    public static AffineTransform3D of(double... values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (values.length != 12 && values.length != 16) {
            throw new IllegalArgumentException(
                "Affine transform requires 12 or 16 values (current: " + values.length + ")");
        }
        double[] m = Arrays.copyOf(values, 16);
        if (values.length == 12) {
            m[12] = 0;
            m[13] = 0;
            m[14] = 0;
            m[15] = 1;
        }
        for (double v : m) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Affine transform values must be finite");
            }
        }
        if (Math.abs(m[12]) > LAST_ROW_TOLERANCE || Math.abs(m[13]) > LAST_ROW_TOLERANCE
            || Math.abs(m[14]) > LAST_ROW_TOLERANCE || Math.abs(m[15] - 1.0) > LAST_ROW_TOLERANCE) {
            throw new IllegalArgumentException(
                "Last row of an affine transform must be 0 0 0 1 (current: "
                    + m[12] + " " + m[13] + " " + m[14] + " " + m[15] + ")");
        }
        return new AffineTransform3D(m);
    }

    /**
     * 항등 변환.
     *
     * @return 항등 변환
     */
    public static AffineTransform3D identity() {
        return IDENTITY;
    }

    /**
     * 평행 이동 변환.
     *
     * @param tx X 이동량
     * @param ty Y 이동량
     * @param tz Z 이동량
     * @return 평행 이동 변환
     */
    public static AffineTransform3D translation(double tx, double ty, double tz) {
        return of(
            1, 0, 0, tx,
            0, 1, 0, ty,
            0, 0, 1, tz
        );
    }

    /**
     * 점에 변환 적용 ({@code M · [x y z 1]ᵀ}).
     *
     * @param point 변환할 점
     * @return 변환된 점
     * @throws IllegalArgumentException point가 null인 경우
     */
    public Point3 apply(Point3 point) {
        if (point == null) {
            throw new IllegalArgumentException("point cannot be null");
        }
        double x = point.x();
        double y = point.y();
        double z = point.z();
        return new Point3(
            matrix[0] * x + matrix[1] * y + matrix[2] * z + matrix[3],
            matrix[4] * x + matrix[5] * y + matrix[6] * z + matrix[7],
            matrix[8] * x + matrix[9] * y + matrix[10] * z + matrix[11]
        );
    }

    /**
     * 행렬 원소 조회.
     *
     * @param row 행 (0~3)
     * @param column 열 (0~3)
     * @return 원소 값
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public double get(int row, int column) {
        if (row < 0 || row > 3 || column < 0 || column > 3) {
            throw new IndexOutOfBoundsException("row/column must be in [0, 3] (current: " + row + ", " + column + ")");
        }
        return matrix[row * 4 + column];
    }

    /**
     * 항등 변환인지 확인.
     *
     * @return 항등 변환이면 true
     */
    public boolean isIdentity() {
        return Arrays.equals(matrix, IDENTITY.matrix);
    }

    /**
     * 행렬 값 복사본 조회.
     *
     * @return row-major 16개 값의 복사본
     */
    public double[] toArray() {
        return Arrays.copyOf(matrix, 16);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(matrix, ((AffineTransform3D) o).matrix);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(matrix);
    }

    @Override
    public String toString() {
        return "AffineTransform3D" + Arrays.toString(matrix);
    }
}
