package io.github.yok.polar.out;

import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import io.github.yok.polar.core.solver.PolarResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 極分解の結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（algorithm はアルゴリズム識別子）。
 * </p>
 *
 * <ul>
 * <li>{@code polar_U_newton.csv}（row,col,value）</li>
 * <li>{@code polar_H_newton.csv}（row,col,value）</li>
 * <li>{@code polar_meta_newton.csv}（反復回数・収束判定・再構成誤差など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "polar";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 極分解の結果を出力します。
     *
     * @param algorithm 使用したアルゴリズムです
     * @param input 入力行列 A です
     * @param result 極分解の結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(PolarAlgorithm algorithm, DMatrixRMaj input, PolarResult result) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm は null 不可です");
        }
        if (input == null) {
            throw new IllegalArgumentException("input は null 不可です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        DMatrixRMaj u = result.getU();
        DMatrixRMaj h = result.getH();

        try {
            Files.createDirectories(outputDir);

            // 1) 直交因子 U
            writeMatrixCsv(outputDir.resolve(buildFileName("U", algorithm)), u);

            // 2) 対称因子 H
            writeMatrixCsv(outputDir.resolve(buildFileName("H", algorithm)), h);

            // 3) メタ（反復回数・収束判定・誤差）
            writeMetaCsv(outputDir.resolve(buildFileName("meta", algorithm)), algorithm, input,
                    result, u, h);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 行列を (row, col, value) の形式で出力します。
     *
     * @param file 出力ファイルです
     * @param matrix 行列です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeMatrixCsv(Path file, DMatrixRMaj matrix) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "value").build().print(w)) {

            for (int row = 0; row < matrix.numRows; row++) {
                for (int col = 0; col < matrix.numCols; col++) {
                    pr.printRecord(row, col, matrix.get(row, col));
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * <p>
     * SVD では反復回数・収束判定が存在しないため、空欄で出力します。
     * </p>
     *
     * @param file 出力ファイルです
     * @param algorithm 使用したアルゴリズムです
     * @param input 入力行列です
     * @param result 極分解の結果です
     * @param u 直交因子です
     * @param h 対称因子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private static void writeMetaCsv(Path file, PolarAlgorithm algorithm, DMatrixRMaj input,
            PolarResult result, DMatrixRMaj u, DMatrixRMaj h) throws IOException {

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("algorithm", algorithm.getId());
            pr.printRecord("rows", input.numRows);
            pr.printRecord("cols", input.numCols);

            pr.printRecord("niters",
                    result.getIterations().isPresent() ? result.getIterations().getAsInt() : "");
            pr.printRecord("converged", result.getConverged().map(String::valueOf).orElse(""));

            pr.printRecord("reconstructionError", MatrixMetrics.reconstructionError(u, h, input));
            pr.printRecord("orthonormalityError", orthonormalityError(u));
        }
    }

    /**
     * 正規直交性からのずれを返します（rows &lt; cols の場合は行の正規直交性を見ます）。
     *
     * @param u 直交因子です
     * @return {@code ‖UᵗU − I‖_F} または {@code ‖UUᵗ − I‖_F} です
     */
    private static double orthonormalityError(DMatrixRMaj u) {
        if (u.numRows >= u.numCols) {
            return MatrixMetrics.orthonormalityDeviation(u);
        }
        return MatrixMetrics.orthonormalityDeviation(CommonOps_DDRM.transpose(u, null));
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code polar_U_qdwh.csv}
     * </p>
     *
     * @param kind 量の識別子（U/H/meta）
     * @param algorithm アルゴリズムです
     * @return ファイル名です
     */
    static String buildFileName(String kind, PolarAlgorithm algorithm) {
        return FILE_HEAD + "_" + kind + "_" + algorithm.getId() + ".csv";
    }
}
