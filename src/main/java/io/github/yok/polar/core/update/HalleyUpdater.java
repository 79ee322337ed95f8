package io.github.yok.polar.core.update;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Halley 法の更新規則です。
 *
 * <p>
 * {@code U ← U·(3I + UᵗU)·(I + 3UᵗU)⁻¹} で更新します。収束域では三次収束しますが、 条件数の大きい入力では収束域に入るまでに多くの反復を要することがあります。
 * </p>
 *
 * <p>
 * 参考: Y. Nakatsukasa, Z. Bai and F. Gygi, Optimizing Halley's iteration for computing the matrix
 * polar decomposition, SIAM J. Matrix Anal. Appl. 31(5), 2010.
 * </p>
 */
public final class HalleyUpdater implements PolarUpdater<Stateless> {

    /**
     * (I + 3UᵗU) の逆行列を計算するバックエンドです。
     */
    private final DecompositionBackend backend;

    /**
     * Halley 法の更新規則を生成します。
     *
     * @param backend 逆行列を計算するバックエンドです（null 不可）
     */
    public HalleyUpdater(DecompositionBackend backend) {
        this.backend = Preconditions.checkNotNull(backend, "backend が null です。");
    }

    /**
     * rows ≧ cols であることを検証します。
     *
     * @param u 初期行列です
     * @return 状態なしを表す値です
     * @throws io.github.yok.polar.core.error.ShapeMismatchException rows &lt; cols の場合に発生します
     */
    @Override
    public Stateless prepare(DMatrixRMaj u) {
        Shapes.requireTallOrSquare(u, PolarAlgorithm.HALLEY);
        return Stateless.INSTANCE;
    }

    /**
     * U を 1 ステップ更新します。
     *
     * @param u 現在の反復行列です（上書きされます）
     * @param state 状態なしを表す値です
     * @return 状態なしを表す値です
     */
    @Override
    public Stateless update(DMatrixRMaj u, Stateless state) {
        int n = u.numCols;

        DMatrixRMaj gram = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(u, u, gram);

        // 3I + UᵗU
        DMatrixRMaj numerator = gram.copy();
        // I + 3UᵗU
        DMatrixRMaj denominator = gram.copy();
        CommonOps_DDRM.scale(3.0, denominator);
        for (int i = 0; i < n; i++) {
            numerator.add(i, i, 3.0);
            denominator.add(i, i, 1.0);
        }

        DMatrixRMaj rational = new DMatrixRMaj(n, n);
        CommonOps_DDRM.mult(numerator, backend.invert(denominator), rational);

        DMatrixRMaj next = new DMatrixRMaj(u.numRows, n);
        CommonOps_DDRM.mult(u, rational, next);
        u.setTo(next);
        return state;
    }
}
