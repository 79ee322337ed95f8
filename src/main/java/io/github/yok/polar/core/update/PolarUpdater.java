package io.github.yok.polar.core.update;

import org.ejml.data.DMatrixRMaj;

/**
 * 極分解の反復で、直交因子の近似 U を 1 ステップ更新する規則を表すインタフェースです。
 *
 * <p>
 * 反復ごとの内部状態（スケーリングの有無、下界 L など）は状態値 {@code S} として受け渡し、 実装クラス自体は可変状態を持ちません。
 * </p>
 *
 * @param <S> 反復ごとに引き継ぐ状態の型です
 */
public interface PolarUpdater<S> {

    /**
     * 反復開始前の準備を行い、初期状態を返します。
     *
     * <p>
     * 形状の検証や、初期行列の正規化（U₀ の上書き）を行う場合があります。
     * </p>
     *
     * @param u 初期行列 U₀ です（入力行列のコピー、上書きされる場合があります）
     * @return 初期状態です
     */
    S prepare(DMatrixRMaj u);

    /**
     * U を 1 ステップ更新し、次の状態を返します。
     *
     * @param u 現在の反復行列です（更新後の値で上書きされます）
     * @param state 現在の状態です
     * @return 次の状態です
     */
    S update(DMatrixRMaj u, S state);
}
