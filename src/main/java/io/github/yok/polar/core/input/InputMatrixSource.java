package io.github.yok.polar.core.input;

import org.ejml.data.DMatrixRMaj;

/**
 * 極分解の入力行列を生成するインターフェースです。
 */
public interface InputMatrixSource {

    /**
     * 入力行列を生成します。
     *
     * @return 入力行列です
     */
    DMatrixRMaj create();
}
