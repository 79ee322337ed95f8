package io.github.yok.polar.core.input;

import java.util.List;
import java.util.Objects;
import java.util.Random;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.RandomMatrices_DDRM;

/**
 * 設定値（種別・サイズ・要素）から入力行列を生成するクラスです。
 *
 * <ul>
 * <li>EXPLICIT: 行優先で並べた要素列から生成します</li>
 * <li>HILBERT: Hilbert 行列 {@code h(i,j) = 1/(i+j+1)} を生成します（条件数の大きい例）</li>
 * <li>RANDOM: シード固定の一様乱数 [-1, 1) で生成します</li>
 * </ul>
 */
@Slf4j
@Getter
public final class ConfiguredInputMatrixSource implements InputMatrixSource {

    /**
     * 入力行列の種別です。
     */
    public enum Kind {
        EXPLICIT, HILBERT, RANDOM
    }

    /**
     * 種別です。
     */
    private final Kind kind;

    /**
     * 行数です。
     */
    private final int rows;

    /**
     * 列数です。
     */
    private final int cols;

    /**
     * EXPLICIT の要素列（行優先）です。
     */
    private final List<Double> values;

    /**
     * RANDOM の乱数シードです。
     */
    private final long seed;

    /**
     * 入力行列の生成ロジックを生成します。
     *
     * @param kind 種別です（null 不可）
     * @param rows 行数です（1 以上）
     * @param cols 列数です（1 以上）
     * @param values EXPLICIT の要素列です（EXPLICIT では rows×cols 個が必要です）
     * @param seed RANDOM の乱数シードです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ConfiguredInputMatrixSource(Kind kind, int rows, int cols, List<Double> values,
            long seed) {
        if (kind == null) {
            throw new IllegalArgumentException("input.kind は null 不可です");
        }
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException(
                    "input.rows/cols は 1 以上を指定してください: " + rows + "x" + cols);
        }
        if (kind == Kind.EXPLICIT) {
            if (values == null || values.size() != rows * cols) {
                throw new IllegalArgumentException("input.values は rows×cols 個が必要です: rows×cols="
                        + (rows * cols) + ", values=" + (values == null ? 0 : values.size()));
            }
            if (values.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("input.values に null が含まれています");
            }
        }
        this.kind = kind;
        this.rows = rows;
        this.cols = cols;
        this.values = (values == null) ? List.of() : List.copyOf(values);
        this.seed = seed;
    }

    /**
     * 入力行列を生成します。
     *
     * @return 入力行列です
     */
    @Override
    public DMatrixRMaj create() {
        DMatrixRMaj matrix;
        switch (kind) {
            case EXPLICIT:
                matrix = explicit();
                break;
            case HILBERT:
                matrix = hilbert(rows, cols);
                break;
            case RANDOM:
                matrix = RandomMatrices_DDRM.rectangle(rows, cols, -1.0, 1.0, new Random(seed));
                break;
            default:
                throw new IllegalStateException("未対応の input.kind です: " + kind);
        }
        log.info("入力行列を生成しました。種別={}、サイズ={}x{}", kind, rows, cols);
        return matrix;
    }

    /**
     * Hilbert 行列を生成します。
     *
     * @param rows 行数です
     * @param cols 列数です
     * @return Hilbert 行列です
     */
    public static DMatrixRMaj hilbert(int rows, int cols) {
        DMatrixRMaj matrix = new DMatrixRMaj(rows, cols);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                matrix.set(i, j, 1.0 / (i + j + 1));
            }
        }
        return matrix;
    }

    private DMatrixRMaj explicit() {
        DMatrixRMaj matrix = new DMatrixRMaj(rows, cols);
        for (int i = 0; i < rows * cols; i++) {
            matrix.data[i] = values.get(i);
        }
        return matrix;
    }
}
