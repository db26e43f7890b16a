package com.ryuqq.registration.adapter.inmemory.scene;

import com.ryuqq.registration.core.model.AffineTransform3D;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 변환 행렬 텍스트 형식.
 *
 * <p>공백으로 구분된 12개(상위 3행) 또는 16개(4x4 전체) 숫자. {@code #}로 시작하는 줄은 주석입니다.</p>
 *
 * <pre>
 * # registration transform
 * 1 0 0 5
 * 0 1 0 0
 * 0 0 1 0
 * 0 0 0 1
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MatrixTextFormat {

    // Utility class - prevent instantiation
    private MatrixTextFormat() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 텍스트를 변환으로 해석.
     *
     * @param text 행렬 텍스트
     * @return 변환
     * @throws IllegalArgumentException 숫자가 아니거나 개수가 12/16이 아닌 경우
     */
    public static AffineTransform3D parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        List<Double> values = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            for (String token : trimmed.split("[\\s,]+")) {
                try {
                    values.add(Double.parseDouble(token));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a number in transform text: " + token, e);
                }
            }
        }
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return AffineTransform3D.of(array);
    }

    /**
     * 변환을 4줄 텍스트로 변환.
     *
     * @param transform 변환
     * @return 4x4 행렬 텍스트
     */
    public static String format(AffineTransform3D transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                if (column > 0) {
                    sb.append(' ');
                }
                sb.append(String.format(Locale.ROOT, "%.17g", transform.get(row, column)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * 파일에서 변환 읽기.
     *
     * @param file 파일 경로
     * @return 변환
     * @throws IOException 파일을 읽을 수 없는 경우
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static AffineTransform3D read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * 파일에 변환 쓰기.
     *
     * @param file 파일 경로
     * @param transform 변환
     * @throws IOException 파일을 쓸 수 없는 경우
     */
    public static void write(Path file, AffineTransform3D transform) throws IOException {
        Files.writeString(file, format(transform), StandardCharsets.UTF_8);
    }
}
