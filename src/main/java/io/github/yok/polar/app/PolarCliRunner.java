package io.github.yok.polar.app;

import io.github.yok.polar.core.config.AlgorithmConfig;
import io.github.yok.polar.core.input.InputMatrixSource;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import io.github.yok.polar.core.solver.PolarFactorizer;
import io.github.yok.polar.core.solver.PolarResult;
import io.github.yok.polar.out.ResultWriter;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.ejml.data.DMatrixRMaj;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で polar-solver を実行するクラスです。
 *
 * <p>
 * 設定から入力行列を生成して極分解し、反復回数・誤差を表示して結果を出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class PolarCliRunner implements CommandLineRunner {

    /**
     * polar-solver の設定値（polar.*）です。
     */
    private final PolarProperties properties;

    /**
     * 入力行列の生成ロジックです。
     */
    private final InputMatrixSource inputMatrixSource;

    /**
     * 極分解の入口です。
     */
    private final PolarFactorizer polarFactorizer;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== polar-solver start: polar decomposition A = U·H ===");
        System.out.print(properties.toMultilineString());

        // 行列演算の前に設定を検証
        AlgorithmConfig config = properties.toAlgorithmConfig();

        DMatrixRMaj a = inputMatrixSource.create();
        PolarResult result = polarFactorizer.factorize(a, config);

        DMatrixRMaj u = result.getU();
        DMatrixRMaj h = result.getH();

        resultWriter.write(config.getAlgorithm(), a, result);

        String niters = result.getIterations().isPresent()
                ? String.valueOf(result.getIterations().getAsInt())
                : "-";
        String converged = result.getConverged().map(String::valueOf).orElse("-");

        System.out.println("結果: algorithm=" + config.getAlgorithm().getId() + ", niters=" + niters
                + ", converged=" + converged);
        System.out.println("結果: ‖UH−A‖_F/‖A‖_F=" + fmt(MatrixMetrics.reconstructionError(u, h, a)));
    }

    /**
     * 数値を指数表記の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
