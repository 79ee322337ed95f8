package io.github.yok.polar.core.linearalgebra;

import io.github.yok.polar.core.error.SingularMatrixException;
import java.util.Arrays;
import org.ejml.UtilEjml;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.QRDecomposition;
import org.ejml.interfaces.decomposition.QRPDecomposition_F64;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * EJML を用いて、逆行列・QR 分解・特異値分解を行うクラスです。
 *
 * <p>
 * 分解器が入力を書き換える場合に備え、常に入力のコピーを渡します。
 * </p>
 */
public final class EjmlDecompositionBackend implements DecompositionBackend {

    /**
     * 逆行列を返します。
     *
     * <p>
     * LU 分解に失敗した場合のほか、1-ノルム条件数の逆数がマシンイプシロンを下回る場合も特異とみなします。
     * </p>
     *
     * @param matrix 正方行列です
     * @return 逆行列です
     * @throws IllegalArgumentException matrix が null、または正方でない場合に発生します
     * @throws SingularMatrixException 行列が数値的に特異な場合に発生します
     */
    @Override
    public DMatrixRMaj invert(DMatrixRMaj matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        if (matrix.numRows != matrix.numCols) {
            throw new IllegalArgumentException(
                    "正方行列が必要です: " + matrix.numRows + "x" + matrix.numCols);
        }

        DMatrixRMaj inverse = new DMatrixRMaj(matrix.numRows, matrix.numCols);
        if (!CommonOps_DDRM.invert(matrix.copy(), inverse)
                || MatrixFeatures_DDRM.hasUncountable(inverse)) {
            throw new SingularMatrixException("逆行列を計算できません（特異行列）");
        }

        // rcond = 1 / (‖A‖₁ ‖A⁻¹‖₁)
        double rcond = 1.0 / (NormOps_DDRM.normP1(matrix) * NormOps_DDRM.normP1(inverse));
        if (!(rcond >= UtilEjml.EPS)) {
            throw new SingularMatrixException("行列が数値的に特異です: rcond=" + rcond);
        }
        return inverse;
    }

    /**
     * QR 分解の直交因子 Q（縮約形）を返します。
     *
     * @param matrix rows ≧ cols の行列です
     * @param pivot 列ピボットを使うかどうかです
     * @return 列が正規直交な Q です
     * @throws IllegalArgumentException matrix が null、または rows &lt; cols の場合に発生します
     * @throws IllegalStateException QR 分解に失敗した場合に発生します
     */
    @Override
    public DMatrixRMaj orthonormalFactor(DMatrixRMaj matrix, boolean pivot) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        int rows = matrix.numRows;
        int cols = matrix.numCols;
        if (rows < cols) {
            throw new IllegalArgumentException("rows ≧ cols が必要です: " + rows + "x" + cols);
        }

        QRDecomposition<DMatrixRMaj> qr;
        if (pivot) {
            QRPDecomposition_F64<DMatrixRMaj> qrp = DecompositionFactory_DDRM.qrp(rows, cols);
            qr = qrp;
        } else {
            qr = DecompositionFactory_DDRM.qr(rows, cols);
        }

        if (!qr.decompose(matrix.copy())) {
            throw new IllegalStateException("QR 分解に失敗しました（EJML）: pivot=" + pivot);
        }
        return qr.getQ(null, true);
    }

    /**
     * 縮約形の特異値分解を返します。
     *
     * @param matrix 任意形状の行列です
     * @return 特異値分解の結果です
     * @throws IllegalArgumentException matrix が null の場合に発生します
     * @throws IllegalStateException 特異値分解に失敗した場合に発生します
     */
    @Override
    public SingularValueDecompositionResult decomposeSingularValues(DMatrixRMaj matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }

        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                DecompositionFactory_DDRM.svd(matrix.numRows, matrix.numCols, true, true, true);
        if (!svd.decompose(matrix.copy())) {
            throw new IllegalStateException("特異値分解に失敗しました（EJML）");
        }

        DMatrixRMaj left = svd.getU(null, false);
        DMatrixRMaj right = svd.getV(null, false);
        // 内部配列は numberOfSingularValues() より長いことがあるため切り詰めます。
        double[] singularValues =
                Arrays.copyOf(svd.getSingularValues(), svd.numberOfSingularValues());

        return new SingularValueDecompositionResult(left, singularValues, right);
    }
}
