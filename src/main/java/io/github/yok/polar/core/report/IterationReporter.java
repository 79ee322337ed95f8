package io.github.yok.polar.core.report;

/**
 * 反復ごとの経過（反復番号・相対変化量・目的関数値）を受け取る報告先です。
 */
@FunctionalInterface
public interface IterationReporter {

    /**
     * 1 反復分の経過を受け取ります。
     *
     * @param iteration 反復番号です（1 始まり）
     * @param relativeError 相対変化量 {@code ‖Uₖ − Uₖ₋₁‖_F / ‖Uₖ‖_F} です
     * @param objective 正規直交性からのずれ {@code ‖UₖᵗUₖ − I‖_F²} です
     */
    void report(int iteration, double relativeError, double objective);

    /**
     * 何もしない報告先を返します。
     *
     * @return 何もしない報告先です
     */
    static IterationReporter silent() {
        return (iteration, relativeError, objective) -> {
            // 報告しない
        };
    }
}
