package io.github.yok.polar.core;

import java.util.Random;
import org.ejml.data.DMatrixRMaj;

/**
 * テスト用の行列を生成するユーティリティです。
 */
public final class TestMatrices {

    private TestMatrices() {}

    /**
     * シード固定の一様乱数 [-1, 1) の行列を行優先で生成します。
     */
    public static DMatrixRMaj uniform(int rows, int cols, long seed) {
        Random random = new Random(seed);
        DMatrixRMaj m = new DMatrixRMaj(rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                m.set(i, j, random.nextDouble() * 2.0 - 1.0);
            }
        }
        return m;
    }

    /**
     * x-y 平面内の回転行列（3×3）です。
     */
    public static DMatrixRMaj rotation(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return new DMatrixRMaj(new double[][] {{c, -s, 0.0}, {s, c, 0.0}, {0.0, 0.0, 1.0}});
    }

    /**
     * Householder 反射 I − 2vvᵗ/(vᵗv) です。
     */
    public static DMatrixRMaj reflection(double... v) {
        int n = v.length;
        double vtv = 0.0;
        for (double x : v) {
            vtv += x * x;
        }
        DMatrixRMaj m = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m.set(i, j, (i == j ? 1.0 : 0.0) - 2.0 * v[i] * v[j] / vtv);
            }
        }
        return m;
    }

    public static DMatrixRMaj diagonal(double... d) {
        DMatrixRMaj m = new DMatrixRMaj(d.length, d.length);
        for (int i = 0; i < d.length; i++) {
            m.set(i, i, d[i]);
        }
        return m;
    }

    public static DMatrixRMaj scaled(double alpha, DMatrixRMaj a) {
        DMatrixRMaj m = a.copy();
        for (int i = 0; i < m.data.length; i++) {
            m.data[i] *= alpha;
        }
        return m;
    }

    /**
     * H がビット単位で対称かどうかを返します。
     */
    public static boolean isBitwiseSymmetric(DMatrixRMaj h) {
        for (int i = 0; i < h.numRows; i++) {
            for (int j = 0; j < h.numCols; j++) {
                if (Double.doubleToRawLongBits(h.get(i, j)) != Double
                        .doubleToRawLongBits(h.get(j, i))) {
                    return false;
                }
            }
        }
        return true;
    }
}
