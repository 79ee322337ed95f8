package io.github.yok.polar.app;

import io.github.yok.polar.core.config.AlgorithmConfig;
import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.input.ConfiguredInputMatrixSource;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * polar-solver の設定値（polar.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "polar")
public class PolarProperties {

    /**
     * アルゴリズム識別子（newton / schulz / hybrid / halley / qdwh / svd）です。
     */
    @NotBlank
    private String algorithm = PolarAlgorithm.NEWTON.getId();

    /**
     * 最大反復回数です。
     */
    private int maxIter = AlgorithmConfig.DEFAULT_MAX_ITER;

    /**
     * 相対変化量の許容誤差です。
     */
    private double tol = AlgorithmConfig.DEFAULT_TOLERANCE;

    /**
     * 反復ごとの経過をログへ出力するかどうかです。
     */
    private boolean verbose = false;

    /**
     * QR 分解で列ピボットを使うかどうかです（qdwh のみ）。
     */
    private boolean pivot = true;

    /**
     * 入力行列の設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値からアルゴリズム設定を生成します。
     *
     * @return アルゴリズム設定です
     * @throws io.github.yok.polar.core.error.InvalidConfigException 設定値が不正な場合に発生します
     */
    public AlgorithmConfig toAlgorithmConfig() {
        return new AlgorithmConfig(PolarAlgorithm.fromId(algorithm), maxIter, tol, verbose, pivot);
    }

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "polar")
    public String toMultilineString() {
        String nl = System.lineSeparator();
        Input in = getInput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "algorithm",
                // algorithm: アルゴリズム識別子
                "algorithm", getAlgorithm(),
                // maxIter: 最大反復回数
                "maxIter", getMaxIter(),
                // tol: 相対変化量の許容誤差
                "tol", getTol(),
                // verbose: 反復ごとの経過を出力するかどうか
                "verbose", isVerbose(),
                // pivot: QR 分解で列ピボットを使うかどうか
                "pivot", isPivot());

        appendSection(sb, nl, "input",
                // kind: 入力行列の種別（EXPLICIT/HILBERT/RANDOM）
                "kind", in.getKind(),
                // rows, cols: 行列サイズ
                "rows", in.getRows(), "cols", in.getCols(),
                // values: EXPLICIT の要素列（行優先）
                "values", in.getValues(),
                // seed: RANDOM の乱数シード
                "seed", in.getSeed());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 入力行列の種別です。
         */
        @NotNull
        private ConfiguredInputMatrixSource.Kind kind = ConfiguredInputMatrixSource.Kind.RANDOM;

        /**
         * 行数です。
         */
        private int rows = 6;

        /**
         * 列数です。
         */
        private int cols = 6;

        /**
         * EXPLICIT の要素列（行優先）です。
         */
        private List<Double> values = List.of();

        /**
         * RANDOM の乱数シードです。
         */
        private long seed = 42L;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
