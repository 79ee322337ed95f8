package io.github.yok.polar.out;

import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.solver.PolarResult;
import org.ejml.data.DMatrixRMaj;

/**
 * 極分解の結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 極分解の結果を出力します。
     *
     * @param algorithm 使用したアルゴリズムです（出力名に使います）
     * @param input 入力行列 A です
     * @param result 極分解の結果です
     */
    void write(PolarAlgorithm algorithm, DMatrixRMaj input, PolarResult result);
}
