package io.github.yok.polar.core.update;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * Newton 法で開始し、十分に直交へ近づいた後は Newton–Schulz 法へ切り替えるハイブリッド法の更新規則です。
 *
 * <p>
 * Newton ステップの後に {@code ‖UᵗU − I‖_F} を評価し、切り替え閾値を下回ったら以降はすべて Newton–Schulz
 * ステップにします。 Newton–Schulz 法は ‖UᵗU − I‖₂ &lt; 1 で収束するため、閾値はその内側に取ります。
 * </p>
 */
@Slf4j
public final class HybridUpdater implements PolarUpdater<HybridState> {

    /**
     * 切り替え閾値の既定値です。
     */
    public static final double DEFAULT_SWITCH_THRESHOLD = 1e-2;

    /**
     * 内部の Newton 法です。
     */
    private final NewtonUpdater newton;

    /**
     * 内部の Newton–Schulz 法です。
     */
    private final NewtonSchulzUpdater schulz;

    /**
     * Newton–Schulz 法へ切り替える {@code ‖UᵗU − I‖_F} の閾値です。
     */
    @Getter
    private final double switchThreshold;

    /**
     * 既定の切り替え閾値でハイブリッド法を生成します。
     *
     * @param backend 逆行列を計算するバックエンドです（null 不可）
     */
    public HybridUpdater(DecompositionBackend backend) {
        this(backend, DEFAULT_SWITCH_THRESHOLD);
    }

    /**
     * ハイブリッド法を生成します。
     *
     * @param backend 逆行列を計算するバックエンドです（null 不可）
     * @param switchThreshold 切り替え閾値です（0 より大きく 1 未満）
     * @throws IllegalArgumentException switchThreshold が範囲外の場合に発生します
     */
    public HybridUpdater(DecompositionBackend backend, double switchThreshold) {
        Preconditions.checkArgument(switchThreshold > 0.0 && switchThreshold < 1.0,
                "切り替え閾値は (0, 1) が必要です。threshold=%s", switchThreshold);
        this.newton = new NewtonUpdater(backend);
        this.schulz = new NewtonSchulzUpdater();
        this.switchThreshold = switchThreshold;
    }

    /**
     * 正方行列であることを検証し、Newton モードの初期状態を返します。
     *
     * @param u 初期行列です
     * @return 初期状態です
     * @throws io.github.yok.polar.core.error.ShapeMismatchException 正方行列でない場合に発生します
     */
    @Override
    public HybridState prepare(DMatrixRMaj u) {
        Shapes.requireSquare(u, PolarAlgorithm.HYBRID);
        return HybridState.initial();
    }

    /**
     * 現在のモードで U を 1 ステップ更新します。
     *
     * @param u 現在の反復行列です（上書きされます）
     * @param state 現在の状態です
     * @return 次の状態です
     * @throws io.github.yok.polar.core.error.SingularMatrixException Newton モードで U が特異な場合に発生します
     */
    @Override
    public HybridState update(DMatrixRMaj u, HybridState state) {
        if (state.isSwitched()) {
            schulz.update(u, Stateless.INSTANCE);
            return state.afterSchulzStep();
        }

        NewtonState nextNewton = newton.update(u, state.getNewton());

        double deviation = MatrixMetrics.orthonormalityDeviation(u);
        if (deviation < switchThreshold) {
            log.debug("Newton–Schulz 法へ切り替えます。Newtonステップ数={}、‖UᵗU−I‖_F={}",
                    state.getNewtonSteps() + 1, String.format(Locale.ROOT, "%.3e", deviation));
            return state.afterNewtonStep(nextNewton, HybridState.Mode.SCHULZ);
        }
        return state.afterNewtonStep(nextNewton, HybridState.Mode.NEWTON);
    }
}
