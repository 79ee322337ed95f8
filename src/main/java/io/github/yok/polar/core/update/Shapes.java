package io.github.yok.polar.core.update;

import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.error.ShapeMismatchException;
import org.ejml.data.DMatrixRMaj;

/**
 * 更新規則ごとの入力形状の検証です。
 */
final class Shapes {

    private Shapes() {}

    static void requireSquare(DMatrixRMaj u, PolarAlgorithm algorithm) {
        requireNonEmpty(u, algorithm);
        if (u.numRows != u.numCols) {
            throw new ShapeMismatchException(algorithm.getId() + " は正方行列のみ対応しています: "
                    + u.numRows + "x" + u.numCols);
        }
    }

    static void requireTallOrSquare(DMatrixRMaj u, PolarAlgorithm algorithm) {
        requireNonEmpty(u, algorithm);
        if (u.numRows < u.numCols) {
            throw new ShapeMismatchException(algorithm.getId() + " は rows ≧ cols の行列のみ対応しています: "
                    + u.numRows + "x" + u.numCols);
        }
    }

    private static void requireNonEmpty(DMatrixRMaj u, PolarAlgorithm algorithm) {
        if (u.numRows == 0 || u.numCols == 0) {
            throw new ShapeMismatchException(
                    algorithm.getId() + " に空の行列は渡せません: " + u.numRows + "x" + u.numCols);
        }
    }
}
