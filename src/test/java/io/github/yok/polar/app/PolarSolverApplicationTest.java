package io.github.yok.polar.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.polar.PolarSolverApplication;
import io.github.yok.polar.core.input.ConfiguredInputMatrixSource;
import io.github.yok.polar.core.input.InputMatrixSource;
import io.github.yok.polar.core.solver.PolarFactorizer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(classes = PolarSolverApplication.class,
        properties = {"polar.algorithm=halley", "polar.input.kind=HILBERT", "polar.input.rows=4",
                "polar.input.cols=4", "polar.output.dir=target/polar-test-out"})
class PolarSolverApplicationTest {

    @Autowired
    private PolarProperties properties;

    @Autowired
    private InputMatrixSource inputMatrixSource;

    @Autowired
    private PolarFactorizer polarFactorizer;

    @Test
    void contextBindsPropertiesAndRunsCli() {
        assertEquals("halley", properties.getAlgorithm());
        assertEquals(ConfiguredInputMatrixSource.Kind.HILBERT, properties.getInput().getKind());
        assertEquals(4, inputMatrixSource.create().numRows);
        assertTrue(polarFactorizer.factorize(inputMatrixSource.create()).getConverged().get());

        // CommandLineRunner は起動時に実行済み
        Path meta = Paths.get("target/polar-test-out", "polar_meta_halley.csv");
        assertTrue(Files.exists(meta));
    }
}
