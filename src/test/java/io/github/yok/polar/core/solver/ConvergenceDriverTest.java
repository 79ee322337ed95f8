package io.github.yok.polar.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.polar.core.TestMatrices;
import io.github.yok.polar.core.error.InvalidConfigException;
import io.github.yok.polar.core.input.ConfiguredInputMatrixSource;
import io.github.yok.polar.core.linearalgebra.EjmlDecompositionBackend;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.update.NewtonState;
import io.github.yok.polar.core.update.NewtonUpdater;
import io.github.yok.polar.core.update.PolarUpdater;
import io.github.yok.polar.core.update.Stateless;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.junit.jupiter.api.Test;

class ConvergenceDriverTest {

    private final ConvergenceDriver driver = new ConvergenceDriver();
    private final NewtonUpdater newton = new NewtonUpdater(new EjmlDecompositionBackend());

    @Test
    void reporterReceivesEveryIterationInOrder() {
        List<double[]> reports = new ArrayList<>();
        IterationReporter reporter =
                (iteration, relativeError, objective) -> reports.add(new double[] {iteration,
                        relativeError, objective});

        DMatrixRMaj a = ConfiguredInputMatrixSource.hilbert(6, 6);
        IterationOutcome<NewtonState> outcome = driver.iterate(newton, a, 100, 1e-6, reporter);

        assertTrue(outcome.isConverged());
        assertEquals(7, outcome.getIterations());
        assertEquals(outcome.getIterations(), reports.size());
        for (int k = 0; k < reports.size(); k++) {
            assertEquals(k + 1, (int) reports.get(k)[0]);
        }
        double[] last = reports.get(reports.size() - 1);
        assertTrue(last[1] <= 1e-6);
        assertEquals(outcome.getLastRelativeError(), last[1]);
        assertEquals(outcome.getLastObjective(), last[2]);
        assertTrue(last[2] < 1e-20);
    }

    @Test
    void exhaustionReportsNotConverged() {
        DMatrixRMaj a = ConfiguredInputMatrixSource.hilbert(6, 6);
        IterationOutcome<NewtonState> outcome =
                driver.iterate(newton, a, 2, 1e-6, IterationReporter.silent());

        assertFalse(outcome.isConverged());
        assertEquals(2, outcome.getIterations());
        assertTrue(outcome.getLastRelativeError() > 1e-6);

        PolarResult result = outcome.toResult();
        assertEquals(2, result.getIterations().getAsInt());
        assertFalse(result.getConverged().get());
    }

    @Test
    void symmetricFactorIsBitwiseSymmetric() {
        DMatrixRMaj a = TestMatrices.uniform(7, 7, 2024);

        IterationOutcome<NewtonState> outcome =
                driver.iterate(newton, a, 100, 1e-6, IterationReporter.silent());

        assertTrue(TestMatrices.isBitwiseSymmetric(outcome.getH()));
        assertTrue(TestMatrices.isBitwiseSymmetric(
                ConvergenceDriver.assembleSymmetricFactor(outcome.getU(), a)));
    }

    @Test
    void inputMatrixIsNotModified() {
        DMatrixRMaj a = TestMatrices.uniform(5, 5, 7);
        DMatrixRMaj before = a.copy();

        driver.iterate(newton, a, 100, 1e-6, IterationReporter.silent());

        assertTrue(MatrixFeatures_DDRM.isIdentical(before, a, 0.0));
    }

    @Test
    void invalidSettingsAreRejectedBeforePrepare() {
        CountingUpdater counting = new CountingUpdater();
        DMatrixRMaj a = TestMatrices.uniform(3, 3, 1);

        assertThrows(InvalidConfigException.class,
                () -> driver.iterate(counting, a, 1, 1e-6, IterationReporter.silent()));
        assertThrows(InvalidConfigException.class,
                () -> driver.iterate(counting, a, 10, 0.0, IterationReporter.silent()));
        assertThrows(NullPointerException.class,
                () -> driver.iterate(counting, null, 10, 1e-6, IterationReporter.silent()));
        assertEquals(0, counting.prepared.get());
    }

    @Test
    void nanRelativeErrorNeverConverges() {
        PolarUpdater<Stateless> poisoning = new PolarUpdater<Stateless>() {
            @Override
            public Stateless prepare(DMatrixRMaj u) {
                return Stateless.INSTANCE;
            }

            @Override
            public Stateless update(DMatrixRMaj u, Stateless state) {
                u.fill(Double.NaN);
                return state;
            }
        };

        IterationOutcome<Stateless> outcome = driver.iterate(poisoning,
                TestMatrices.uniform(3, 3, 1), 5, 1e-6, IterationReporter.silent());

        assertFalse(outcome.isConverged());
        assertEquals(5, outcome.getIterations());
        assertTrue(Double.isNaN(outcome.getLastRelativeError()));
    }

    private static final class CountingUpdater implements PolarUpdater<Stateless> {

        private final AtomicInteger prepared = new AtomicInteger();

        @Override
        public Stateless prepare(DMatrixRMaj u) {
            prepared.incrementAndGet();
            return Stateless.INSTANCE;
        }

        @Override
        public Stateless update(DMatrixRMaj u, Stateless state) {
            return state;
        }
    }
}
