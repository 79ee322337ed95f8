package io.github.yok.polar.core.solver;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 収束ループ 1 回分の実行結果です。
 *
 * <p>
 * {@link PolarResult} に加えて、最終反復の計量と更新規則の最終状態を保持します。
 * </p>
 *
 * @param <S> 更新規則の状態の型です
 */
@Value
public class IterationOutcome<S> {

    /**
     * 最終的な直交因子 U です。
     */
    DMatrixRMaj u;

    /**
     * 対称化済みの H です。
     */
    DMatrixRMaj h;

    /**
     * 実行した反復回数です。
     */
    int iterations;

    /**
     * 収束したかどうかです。
     */
    boolean converged;

    /**
     * 最終反復の相対変化量です。
     */
    double lastRelativeError;

    /**
     * 最終反復の目的関数値 {@code ‖UᵗU − I‖_F²} です。
     */
    double lastObjective;

    /**
     * 更新規則の最終状態です。
     */
    S finalState;

    /**
     * 結果オブジェクトに変換します。
     *
     * @return 結果です
     */
    public PolarResult toResult() {
        return PolarResult.iterative(u, h, iterations, converged);
    }
}
