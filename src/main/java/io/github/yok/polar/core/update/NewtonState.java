package io.github.yok.polar.core.update;

import lombok.Value;

/**
 * スケーリング付き Newton 法の反復状態です。
 */
@Value
public class NewtonState {

    /**
     * スケーリングを続けるかどうかです。一度 false になると true には戻りません。
     */
    boolean scaling;

    /**
     * 反復開始時の状態（スケーリング有効）を返します。
     *
     * @return 初期状態です
     */
    public static NewtonState initial() {
        return new NewtonState(true);
    }

    /**
     * スケーリングを止めた状態を返します。
     *
     * @return スケーリング無効の状態です
     */
    public NewtonState withoutScaling() {
        return scaling ? new NewtonState(false) : this;
    }
}
