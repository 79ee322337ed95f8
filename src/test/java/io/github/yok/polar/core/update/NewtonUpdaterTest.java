package io.github.yok.polar.core.update;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.polar.core.TestMatrices;
import io.github.yok.polar.core.error.ShapeMismatchException;
import io.github.yok.polar.core.error.SingularMatrixException;
import io.github.yok.polar.core.linearalgebra.EjmlDecompositionBackend;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.solver.ConvergenceDriver;
import io.github.yok.polar.core.solver.IterationOutcome;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class NewtonUpdaterTest {

    private final NewtonUpdater updater = new NewtonUpdater(new EjmlDecompositionBackend());

    @Test
    void singularIterateIsReported() {
        DMatrixRMaj u = new DMatrixRMaj(new double[][] {{1.0, 2.0}, {2.0, 4.0}});
        NewtonState state = updater.prepare(u);

        assertThrows(SingularMatrixException.class, () -> updater.update(u, state));
    }

    @Test
    void nonSquareInputIsRejected() {
        assertThrows(ShapeMismatchException.class,
                () -> updater.prepare(TestMatrices.uniform(4, 3, 1)));
        assertThrows(ShapeMismatchException.class, () -> updater.prepare(new DMatrixRMaj(0, 0)));
    }

    @Test
    void scalingFactorBalancesNorms() {
        DMatrixRMaj u = TestMatrices.scaled(4.0, CommonOps_DDRM.identity(3));
        DMatrixRMaj inverse = TestMatrices.scaled(0.25, CommonOps_DDRM.identity(3));

        // γ = ((1/4·1/4)/(4·4))^(1/4) = 1/4
        assertEquals(0.25, NewtonUpdater.scalingFactor(u, inverse), 1e-15);
    }

    @Test
    void scaledMultipleOfOrthogonalMatrixIsFixedInOneStep() {
        DMatrixRMaj q = TestMatrices.rotation(0.7);
        DMatrixRMaj u = TestMatrices.scaled(5.0, q);

        updater.update(u, updater.prepare(u));

        for (int i = 0; i < u.data.length; i++) {
            assertEquals(q.data[i], u.data[i], 1e-14);
        }
    }

    @Test
    void scalingIsSwitchedOffBeforeConvergence() {
        IterationOutcome<NewtonState> outcome = new ConvergenceDriver().iterate(updater,
                TestMatrices.uniform(6, 6, 42), 100, 1e-6, IterationReporter.silent());

        assertTrue(outcome.isConverged());
        assertFalse(outcome.getFinalState().isScaling());
    }

    @Test
    void withoutScalingIsSticky() {
        NewtonState off = NewtonState.initial().withoutScaling();

        assertFalse(off.isScaling());
        assertFalse(off.withoutScaling().isScaling());
    }
}
