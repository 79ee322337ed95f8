package io.github.yok.polar.core.update;

import lombok.Value;

/**
 * ハイブリッド法の反復状態です。
 *
 * <p>
 * モードは NEWTON から SCHULZ へ一度だけ切り替わり、戻ることはありません。
 * </p>
 */
@Value
public class HybridState {

    /**
     * 現在のモードです。
     */
    Mode mode;

    /**
     * 内部の Newton 法の状態です。
     */
    NewtonState newton;

    /**
     * 実行した Newton ステップ数（= 逆行列の計算回数）です。
     */
    int newtonSteps;

    /**
     * 実行した Newton–Schulz ステップ数です。
     */
    int schulzSteps;

    /**
     * 反復開始時の状態を返します。
     *
     * @return 初期状態です
     */
    public static HybridState initial() {
        return new HybridState(Mode.NEWTON, NewtonState.initial(), 0, 0);
    }

    /**
     * Newton–Schulz モードへ切り替え済みかどうかを返します。
     *
     * @return 切り替え済みの場合は true です
     */
    public boolean isSwitched() {
        return mode == Mode.SCHULZ;
    }

    HybridState afterNewtonStep(NewtonState nextNewton, Mode nextMode) {
        return new HybridState(nextMode, nextNewton, newtonSteps + 1, schulzSteps);
    }

    HybridState afterSchulzStep() {
        return new HybridState(mode, newton, newtonSteps, schulzSteps + 1);
    }

    /**
     * ハイブリッド法のモードです。
     */
    public enum Mode {
        NEWTON, SCHULZ
    }
}
