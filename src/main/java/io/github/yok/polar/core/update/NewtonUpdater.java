package io.github.yok.polar.core.update;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.error.SingularMatrixException;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * スケーリング付き Newton 法の更新規則です。
 *
 * <p>
 * {@code U ← ½(γ·U + γ⁻¹·U⁻ᵗ)} で更新します。 γ は 1-ノルムと ∞-ノルムから求める Higham のスケーリング
 * {@code γ = ((‖U⁻¹‖₁‖U⁻¹‖∞)/(‖U‖₁‖U‖∞))^(1/4)} です。 1 ステップの相対変化量が {@link #SCALING_CUTOFF}
 * を下回った時点でスケーリングを止め（γ=1）、以降は二次収束する素の Newton 法になります。
 * </p>
 */
@Slf4j
public final class NewtonUpdater implements PolarUpdater<NewtonState> {

    /**
     * スケーリングを止める相対変化量の閾値です。
     */
    public static final double SCALING_CUTOFF = 1e-2;

    /**
     * 逆行列を計算するバックエンドです。
     */
    private final DecompositionBackend backend;

    /**
     * Newton 法の更新規則を生成します。
     *
     * @param backend 逆行列を計算するバックエンドです（null 不可）
     */
    public NewtonUpdater(DecompositionBackend backend) {
        this.backend = Preconditions.checkNotNull(backend, "backend が null です。");
    }

    /**
     * 正方行列であることを検証し、スケーリング有効の初期状態を返します。
     *
     * @param u 初期行列です
     * @return 初期状態です
     * @throws io.github.yok.polar.core.error.ShapeMismatchException 正方行列でない場合に発生します
     */
    @Override
    public NewtonState prepare(DMatrixRMaj u) {
        Shapes.requireSquare(u, PolarAlgorithm.NEWTON);
        return NewtonState.initial();
    }

    /**
     * U を 1 ステップ更新します。
     *
     * @param u 現在の反復行列です（上書きされます）
     * @param state 現在の状態です
     * @return 次の状態です
     * @throws SingularMatrixException U が数値的に特異な場合に発生します
     */
    @Override
    public NewtonState update(DMatrixRMaj u, NewtonState state) {
        DMatrixRMaj inverse = backend.invert(u);
        double gamma = state.isScaling() ? scalingFactor(u, inverse) : 1.0;

        DMatrixRMaj inverseTransposed = new DMatrixRMaj(u.numCols, u.numRows);
        CommonOps_DDRM.transpose(inverse, inverseTransposed);

        DMatrixRMaj next = new DMatrixRMaj(u.numRows, u.numCols);
        CommonOps_DDRM.add(0.5 * gamma, u, 0.5 / gamma, inverseTransposed, next);

        NewtonState nextState = state;
        if (state.isScaling() && MatrixMetrics.relativeDifference(next, u) < SCALING_CUTOFF) {
            log.debug("Newton 法のスケーリングを終了します（γ={}）", gamma);
            nextState = state.withoutScaling();
        }

        u.setTo(next);
        return nextState;
    }

    /**
     * 1,∞-ノルムによるスケーリング係数 γ を返します。
     *
     * @param u 現在の反復行列です
     * @param inverse U の逆行列です
     * @return スケーリング係数です
     */
    static double scalingFactor(DMatrixRMaj u, DMatrixRMaj inverse) {
        double numerator = NormOps_DDRM.normP1(inverse) * NormOps_DDRM.normPInf(inverse);
        double denominator = NormOps_DDRM.normP1(u) * NormOps_DDRM.normPInf(u);
        return Math.pow(numerator / denominator, 0.25);
    }
}
