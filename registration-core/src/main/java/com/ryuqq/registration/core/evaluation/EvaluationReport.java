package com.ryuqq.registration.core.evaluation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 정합 평가 결과 표.
 *
 * <p>TRE와 MI 결과를 {@code Metric / Value} 행으로 정리합니다. 둘 중 하나만 있어도 됩니다.</p>
 *
 * <p><strong>행 순서:</strong></p>
 * <pre>
 * TRE - Mean (mm), TRE - Max (mm), TRE - Min (mm), TRE - Std (mm), TRE - Num Points,
 * Mattes MI, Mattes MI (negative), MI - Used Mask, MI - Method
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EvaluationReport {

    private final List<Row> rows;

    private EvaluationReport(List<Row> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * 평가 결과 표 생성.
     *
     * @param treResult TRE 결과 (null 가능)
     * @param miResult MI 결과 (null 가능)
     * @return EvaluationReport 인스턴스
     */
    public static EvaluationReport of(TreResult treResult, MiResult miResult) {
        List<Row> rows = new ArrayList<>();
        if (treResult != null) {
            rows.add(new Row("TRE - Mean (mm)", fixed4(treResult.mean())));
            rows.add(new Row("TRE - Max (mm)", fixed4(treResult.max())));
            rows.add(new Row("TRE - Min (mm)", fixed4(treResult.min())));
            rows.add(new Row("TRE - Std (mm)", fixed4(treResult.standardDeviation())));
            rows.add(new Row("TRE - Num Points", Integer.toString(treResult.count())));
        }
        if (miResult != null) {
            rows.add(new Row("Mattes MI", fixed6(miResult.value())));
            rows.add(new Row("Mattes MI (negative)", fixed6(miResult.negativeValue())));
            rows.add(new Row("MI - Used Mask", miResult.maskUsed() ? "Yes" : "No"));
            rows.add(new Row("MI - Method", miResult.method()));
        }
        return new EvaluationReport(rows);
    }

    /**
     * 표 행 조회.
     *
     * @return 순서 있는 행 목록 (수정 불가)
     */
    public List<Row> rows() {
        return rows;
    }

    /**
     * 행이 없는지 확인.
     *
     * @return TRE, MI 모두 없으면 true
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * 탭 구분 텍스트 표로 변환 (헤더 포함).
     *
     * @return {@code Metric\tValue} 헤더와 행들
     */
    public String toTable() {
        StringBuilder sb = new StringBuilder("Metric\tValue\n");
        for (Row row : rows) {
            sb.append(row.metric()).append('\t').append(row.value()).append('\n');
        }
        return sb.toString();
    }

    private static String fixed4(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String fixed6(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    /**
     * 평가 표의 한 행.
     *
     * @param metric 지표 이름
     * @param value 형식화된 값
     */
    public record Row(String metric, String value) {
    }
}
