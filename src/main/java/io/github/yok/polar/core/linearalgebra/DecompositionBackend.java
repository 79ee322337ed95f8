package io.github.yok.polar.core.linearalgebra;

import io.github.yok.polar.core.error.SingularMatrixException;
import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 極分解の反復で使う行列分解（逆行列・QR・SVD）を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用する線形代数ライブラリを差し替えやすくするためのインタフェースです。 引数の行列は変更しません。
 * </p>
 */
public interface DecompositionBackend {

    /**
     * 正方行列の逆行列を返します。
     *
     * @param matrix 正方行列です
     * @return 逆行列です
     * @throws SingularMatrixException 行列が数値的に特異な場合に発生します
     */
    DMatrixRMaj invert(DMatrixRMaj matrix);

    /**
     * QR 分解の直交因子 Q（縮約形、rows×cols）を返します。
     *
     * @param matrix rows ≧ cols の行列です
     * @param pivot 列ピボットを使うかどうかです
     * @return 列が正規直交な Q です
     * @throws IllegalStateException QR 分解に失敗した場合に発生します
     */
    DMatrixRMaj orthonormalFactor(DMatrixRMaj matrix, boolean pivot);

    /**
     * 縮約形の特異値分解 A = P·S·Qᵗ を返します。
     *
     * @param matrix 任意形状の行列です
     * @return 特異値分解の結果です
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    SingularValueDecompositionResult decomposeSingularValues(DMatrixRMaj matrix);

    /**
     * 特異値分解の結果を保持するクラスです。
     *
     * <p>
     * k = min(rows, cols) として、左特異ベクトル P は rows×k、右特異ベクトル Q は cols×k です（列が特異ベクトル）。
     * </p>
     */
    @Value
    class SingularValueDecompositionResult {

        /**
         * 左特異ベクトル行列 P です。
         */
        DMatrixRMaj left;

        /**
         * 特異値（長さ k）です。
         */
        double[] singularValues;

        /**
         * 右特異ベクトル行列 Q です。
         */
        DMatrixRMaj right;
    }
}
