package io.github.yok.polar.app;

import io.github.yok.polar.core.input.ConfiguredInputMatrixSource;
import io.github.yok.polar.core.input.InputMatrixSource;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import io.github.yok.polar.core.linearalgebra.EjmlDecompositionBackend;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.report.LoggingIterationReporter;
import io.github.yok.polar.core.solver.ConvergenceDriver;
import io.github.yok.polar.core.solver.PolarFactorizer;
import io.github.yok.polar.out.CsvResultWriter;
import io.github.yok.polar.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 極分解ソルバ一式の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class PolarSolverConfiguration {

    /**
     * polar-solver の設定値（polar.*）です。
     */
    private final PolarProperties p;

    /**
     * 行列分解バックエンドを生成します。
     *
     * @return 行列分解バックエンドです
     */
    @Bean
    public DecompositionBackend decompositionBackend() {
        return new EjmlDecompositionBackend();
    }

    /**
     * 反復ごとの報告先を生成します。
     *
     * @return ログへ出力する報告先です
     */
    @Bean
    public IterationReporter iterationReporter() {
        return new LoggingIterationReporter();
    }

    /**
     * 共通の収束ループを生成します。
     *
     * @return 収束ループです
     */
    @Bean
    public ConvergenceDriver convergenceDriver() {
        return new ConvergenceDriver();
    }

    /**
     * 極分解の入口を生成します。
     *
     * @param backend 行列分解バックエンドです
     * @param driver 収束ループです
     * @param reporter 反復ごとの報告先です
     * @return 極分解の入口です
     */
    @Bean
    public PolarFactorizer polarFactorizer(DecompositionBackend backend, ConvergenceDriver driver,
            IterationReporter reporter) {
        return new PolarFactorizer(backend, driver, reporter);
    }

    /**
     * 入力行列の生成ロジックを生成します。
     *
     * @return 入力行列の生成ロジックです
     */
    @Bean
    public InputMatrixSource inputMatrixSource() {
        PolarProperties.Input in = p.getInput();
        return new ConfiguredInputMatrixSource(in.getKind(), in.getRows(), in.getCols(),
                in.getValues(), in.getSeed());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
