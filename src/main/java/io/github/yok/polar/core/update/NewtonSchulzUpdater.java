package io.github.yok.polar.core.update;

import io.github.yok.polar.core.config.PolarAlgorithm;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * Newton–Schulz 法の更新規則です。
 *
 * <p>
 * {@code U ← ½·U·(3I − UᵗU)} で更新します。逆行列を使わない代わりに、‖A‖ &lt; √3 のときだけ収束が保証されます。
 * この前提は反復中には検査せず、条件を満たさない場合は反復開始時に警告ログを出すだけです（発散は未収束として返ります）。
 * </p>
 */
@Slf4j
public final class NewtonSchulzUpdater implements PolarUpdater<Stateless> {

    /**
     * 収束が保証されるノルムの上限 √3 です。
     */
    public static final double CONVERGENCE_BOUND = Math.sqrt(3.0);

    /**
     * 正方行列であることを検証し、‖A‖_F ≧ √3 の場合は警告ログを出します。
     *
     * @param u 初期行列です
     * @return 状態なしを表す値です
     * @throws io.github.yok.polar.core.error.ShapeMismatchException 正方行列でない場合に発生します
     */
    @Override
    public Stateless prepare(DMatrixRMaj u) {
        Shapes.requireSquare(u, PolarAlgorithm.SCHULZ);
        double norm = NormOps_DDRM.normF(u);
        if (!(norm < CONVERGENCE_BOUND)) {
            log.warn("Newton–Schulz 法の収束条件を満たしていません。‖A‖_F={}（上限 √3={}）",
                    String.format(Locale.ROOT, "%.5f", norm),
                    String.format(Locale.ROOT, "%.5f", CONVERGENCE_BOUND));
        }
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

        // 1.5·I − 0.5·UᵗU
        DMatrixRMaj factor = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(-0.5, u, u, factor);
        for (int i = 0; i < n; i++) {
            factor.add(i, i, 1.5);
        }

        DMatrixRMaj next = new DMatrixRMaj(u.numRows, n);
        CommonOps_DDRM.mult(u, factor, next);
        u.setTo(next);
        return state;
    }
}
