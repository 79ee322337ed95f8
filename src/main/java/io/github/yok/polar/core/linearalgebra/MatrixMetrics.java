package io.github.yok.polar.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * 極分解の収束判定・検証で使う行列の計量をまとめたユーティリティです。
 */
public final class MatrixMetrics {

    private MatrixMetrics() {}

    /**
     * 正規直交性からのずれ {@code ‖UᵗU − I‖_F} を返します。
     *
     * @param u 行列です（rows×cols）
     * @return Frobenius ノルムでのずれです（u が NaN/∞ を含む場合は NaN）
     */
    public static double orthonormalityDeviation(DMatrixRMaj u) {
        if (MatrixFeatures_DDRM.hasUncountable(u)) {
            return Double.NaN;
        }
        int n = u.numCols;
        DMatrixRMaj gram = new DMatrixRMaj(n, n);
        CommonOps_DDRM.multTransA(u, u, gram);
        for (int i = 0; i < n; i++) {
            gram.add(i, i, -1.0);
        }
        return NormOps_DDRM.normF(gram);
    }

    /**
     * 相対変化量 {@code ‖current − previous‖_F / ‖current‖_F} を返します。
     *
     * <p>
     * current がゼロ行列の場合は、分母を付けない差のノルムを返します。 NormOps_DDRM.normF は NaN
     * を含む行列に 0 を返すため、NaN/∞ を含む場合は先に NaN を返します。
     * </p>
     *
     * @param current 現在の行列です
     * @param previous 直前の行列です
     * @return 相対変化量です（NaN/∞ を含む場合は NaN）
     */
    public static double relativeDifference(DMatrixRMaj current, DMatrixRMaj previous) {
        if (MatrixFeatures_DDRM.hasUncountable(current)
                || MatrixFeatures_DDRM.hasUncountable(previous)) {
            return Double.NaN;
        }
        DMatrixRMaj diff = new DMatrixRMaj(current.numRows, current.numCols);
        CommonOps_DDRM.subtract(current, previous, diff);
        double diffNorm = NormOps_DDRM.normF(diff);
        double currentNorm = NormOps_DDRM.normF(current);
        return (currentNorm > 0.0) ? diffNorm / currentNorm : diffNorm;
    }

    /**
     * 正方行列を {@code (H + Hᵗ)/2} で置き換えます。
     *
     * <p>
     * (i, j) と (j, i) に同じ浮動小数点演算を適用するため、結果はビット単位で対称です。
     * </p>
     *
     * @param h 正方行列です（上書きされます）
     */
    public static void symmetrizeInPlace(DMatrixRMaj h) {
        int n = h.numRows;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double mean = (h.get(i, j) + h.get(j, i)) * 0.5;
                h.set(i, j, mean);
                h.set(j, i, mean);
            }
        }
    }

    /**
     * 再構成誤差 {@code ‖U·H − A‖_F / ‖A‖_F} を返します。
     *
     * @param u 直交因子です（rows×cols）
     * @param h 対称因子です（cols×cols）
     * @param a 元の行列です（rows×cols）
     * @return 相対再構成誤差です（A がゼロ行列の場合は絶対誤差）
     */
    public static double reconstructionError(DMatrixRMaj u, DMatrixRMaj h, DMatrixRMaj a) {
        DMatrixRMaj product = new DMatrixRMaj(a.numRows, a.numCols);
        CommonOps_DDRM.mult(u, h, product);
        return relativeDifferenceTo(product, a);
    }

    private static double relativeDifferenceTo(DMatrixRMaj value, DMatrixRMaj reference) {
        if (MatrixFeatures_DDRM.hasUncountable(value)) {
            return Double.NaN;
        }
        DMatrixRMaj diff = new DMatrixRMaj(value.numRows, value.numCols);
        CommonOps_DDRM.subtract(value, reference, diff);
        double referenceNorm = NormOps_DDRM.normF(reference);
        double diffNorm = NormOps_DDRM.normF(diff);
        return (referenceNorm > 0.0) ? diffNorm / referenceNorm : diffNorm;
    }
}
