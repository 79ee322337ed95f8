package io.github.yok.polar.core.update;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.polar.core.TestMatrices;
import io.github.yok.polar.core.error.ShapeMismatchException;
import io.github.yok.polar.core.error.SingularMatrixException;
import io.github.yok.polar.core.input.ConfiguredInputMatrixSource;
import io.github.yok.polar.core.linearalgebra.EjmlDecompositionBackend;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.solver.ConvergenceDriver;
import io.github.yok.polar.core.solver.IterationOutcome;
import java.util.List;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.junit.jupiter.api.Test;

class QdwhUpdaterTest {

    private final EjmlDecompositionBackend backend = new EjmlDecompositionBackend();

    @Test
    void prepareNormalizesByLargestSingularValue() {
        DMatrixRMaj u = TestMatrices.diagonal(1.0, 10.0, 100.0);
        QdwhUpdater updater = new QdwhUpdater(backend, true);

        QdwhState state = updater.prepare(u);

        assertEquals(1.0, NormOps_DDRM.normP2(u), 1e-12);
        // L₀ = σ_min(X₀)/√n = 0.01/√3
        assertEquals(0.01 / Math.sqrt(3.0), state.getLowerBound(), 1e-14);
        assertNull(state.getLastParameters());
    }

    @Test
    void lowerBoundIncreasesMonotonicallyTowardOne() {
        List<DMatrixRMaj> inputs = List.of(ConfiguredInputMatrixSource.hilbert(6, 6),
                TestMatrices.uniform(6, 6, 42), TestMatrices.uniform(5, 5, 3),
                TestMatrices.diagonal(1.0, 10.0, 100.0), TestMatrices.uniform(8, 8, 9));

        for (DMatrixRMaj a : inputs) {
            QdwhUpdater updater = new QdwhUpdater(backend, true);
            DMatrixRMaj u = a.copy();
            QdwhState state = updater.prepare(u);

            double previous = state.getLowerBound();
            for (int k = 0; k < 8; k++) {
                state = updater.update(u, state);
                double current = state.getLowerBound();
                assertTrue(current >= previous - 1e-12,
                        "L decreased: " + previous + " -> " + current);
                assertTrue(current <= 1.0 + 1e-12, "L exceeded 1: " + current);
                previous = current;
            }
            assertEquals(1.0, previous, 1e-12);
        }
    }

    @Test
    void hilbertConvergesWithAndWithoutPivoting() {
        DMatrixRMaj a = ConfiguredInputMatrixSource.hilbert(6, 6);

        for (boolean pivot : new boolean[] {true, false}) {
            IterationOutcome<QdwhState> outcome = new ConvergenceDriver()
                    .iterate(new QdwhUpdater(backend, pivot), a, 100, 1e-6,
                            IterationReporter.silent());

            assertTrue(outcome.isConverged(), "pivot=" + pivot);
            assertTrue(outcome.getIterations() <= 6, "pivot=" + pivot);
            assertTrue(MatrixMetrics.orthonormalityDeviation(outcome.getU()) < 1e-10);
            assertTrue(MatrixMetrics.reconstructionError(outcome.getU(), outcome.getH(), a) < 1e-10);
        }
    }

    @Test
    void singularInputIsRejected() {
        DMatrixRMaj u = new DMatrixRMaj(new double[][] {{1.0, 2.0}, {2.0, 4.0}});

        assertThrows(SingularMatrixException.class,
                () -> new QdwhUpdater(backend, true).prepare(u));
        assertThrows(SingularMatrixException.class,
                () -> new QdwhUpdater(backend, true).prepare(new DMatrixRMaj(3, 3)));
    }

    @Test
    void nonSquareInputIsRejected() {
        DMatrixRMaj tall = TestMatrices.uniform(5, 3, 1);

        assertThrows(ShapeMismatchException.class,
                () -> new QdwhUpdater(backend, false).prepare(tall));
    }

    @Test
    void identityStaysFixed() {
        DMatrixRMaj u = CommonOps_DDRM.identity(4);
        QdwhUpdater updater = new QdwhUpdater(backend, true);

        updater.update(u, updater.prepare(u));

        assertTrue(MatrixMetrics.relativeDifference(u, CommonOps_DDRM.identity(4)) < 1e-14);
    }

    @Test
    void nearlySingularInputIsStillFactorized() {
        List<DMatrixRMaj> inputs = List.of(ConfiguredInputMatrixSource.hilbert(12, 12),
                TestMatrices.diagonal(1.0, 1e-17));

        for (DMatrixRMaj a : inputs) {
            IterationOutcome<QdwhState> outcome = new ConvergenceDriver().iterate(
                    new QdwhUpdater(backend, true), a, 100, 1e-6, IterationReporter.silent());

            assertTrue(outcome.isConverged(), "n=" + a.numRows);
            assertTrue(outcome.getIterations() <= 10, "n=" + a.numRows);
            assertTrue(MatrixMetrics.orthonormalityDeviation(outcome.getU()) < 1e-8);
            assertTrue(
                    MatrixMetrics.reconstructionError(outcome.getU(), outcome.getH(), a) < 1e-10);
        }
    }

    @Test
    void inverseNormIsComputedWithoutConditionCutoff() {
        DMatrixRMaj x = TestMatrices.diagonal(1.0, 1e-17);

        assertEquals(1e17, QdwhUpdater.inverseNorm1(x), 1e3);
        assertThrows(SingularMatrixException.class, () -> QdwhUpdater
                .inverseNorm1(new DMatrixRMaj(new double[][] {{1.0, 2.0}, {2.0, 4.0}})));
    }
}
