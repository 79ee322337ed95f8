package io.github.yok.polar.core.update;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.polar.core.TestMatrices;
import io.github.yok.polar.core.error.ShapeMismatchException;
import io.github.yok.polar.core.linearalgebra.EjmlDecompositionBackend;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class HalleyUpdaterTest {

    private final HalleyUpdater updater = new HalleyUpdater(new EjmlDecompositionBackend());

    @Test
    void stepMatchesScalarHalleyMapOnDiagonal() {
        DMatrixRMaj u = TestMatrices.diagonal(2.0, 0.5);

        updater.update(u, updater.prepare(u));

        // x(3 + x²)/(1 + 3x²)
        assertEquals(2.0 * 7.0 / 13.0, u.get(0, 0), 1e-14);
        assertEquals(0.5 * 3.25 / 1.75, u.get(1, 1), 1e-14);
        assertEquals(0.0, u.get(0, 1), 1e-15);
    }

    @Test
    void tallInputReducesOrthonormalityDeviation() {
        DMatrixRMaj u = TestMatrices.uniform(5, 3, 5);
        Stateless state = updater.prepare(u);
        double before = MatrixMetrics.orthonormalityDeviation(u);

        updater.update(u, state);

        assertEquals(5, u.numRows);
        assertEquals(3, u.numCols);
        assertTrue(MatrixMetrics.orthonormalityDeviation(u) < before);
    }

    @Test
    void wideInputIsRejected() {
        assertThrows(ShapeMismatchException.class,
                () -> updater.prepare(TestMatrices.uniform(2, 4, 5)));
    }
}
