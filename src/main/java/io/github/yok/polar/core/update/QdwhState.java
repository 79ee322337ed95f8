package io.github.yok.polar.core.update;

import lombok.Value;

/**
 * QDWH 法の反復状態です。
 */
@Value
public class QdwhState {

    /**
     * 正規化した反復行列の最小特異値の下界 L です。反復ごとに単調に 1 へ近づきます。
     */
    double lowerBound;

    /**
     * 直前のステップで使った重みです（反復開始前は null）。
     */
    DwhParameters lastParameters;
}
