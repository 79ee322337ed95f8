package io.github.yok.polar.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.AlgorithmConfig;
import io.github.yok.polar.core.error.ShapeMismatchException;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend.SingularValueDecompositionResult;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.update.HalleyUpdater;
import io.github.yok.polar.core.update.HybridUpdater;
import io.github.yok.polar.core.update.NewtonSchulzUpdater;
import io.github.yok.polar.core.update.NewtonUpdater;
import io.github.yok.polar.core.update.PolarUpdater;
import io.github.yok.polar.core.update.QdwhUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 極分解 A = U·H の入口となるクラスです。
 *
 * <p>
 * 設定されたアルゴリズムに応じて更新規則を選び、共通の収束ループで解きます。 SVD の場合は反復せずに直接構成します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class PolarFactorizer {

    /**
     * 行列分解のバックエンドです。
     */
    private final DecompositionBackend backend;

    /**
     * 共通の収束ループです。
     */
    private final ConvergenceDriver driver;

    /**
     * verbose 指定時の報告先です。
     */
    private final IterationReporter reporter;

    /**
     * 既定の設定（Newton 法、最大反復 100、許容誤差 1e-6）で極分解します。
     *
     * @param a 入力行列です（変更しません）
     * @return 結果です
     */
    public PolarResult factorize(DMatrixRMaj a) {
        return factorize(a, AlgorithmConfig.defaults());
    }

    /**
     * 指定した設定で極分解します。
     *
     * @param a 入力行列です（変更しません）
     * @param config アルゴリズム設定です
     * @return 結果です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws ShapeMismatchException 入力形状がアルゴリズムに対応していない場合に発生します
     * @throws io.github.yok.polar.core.error.SingularMatrixException 反復中に特異な行列が現れた場合に発生します
     */
    public PolarResult factorize(DMatrixRMaj a, AlgorithmConfig config) {
        Preconditions.checkNotNull(a, "入力行列が null です。");
        Preconditions.checkNotNull(config, "config が null です。");

        if (!config.getAlgorithm().isIterative()) {
            return factorizeBySingularValues(a);
        }

        IterationReporter sink = config.isVerbose() ? reporter : IterationReporter.silent();
        return driver.run(updaterFor(config), a, config.getMaxIter(), config.getTolerance(), sink);
    }

    /**
     * 設定に対応する更新規則を生成します。
     *
     * @param config アルゴリズム設定です（反復法）
     * @return 更新規則です
     * @throws IllegalArgumentException 反復法でない設定の場合に発生します
     */
    public PolarUpdater<?> updaterFor(AlgorithmConfig config) {
        switch (config.getAlgorithm()) {
            case NEWTON:
                return new NewtonUpdater(backend);
            case SCHULZ:
                return new NewtonSchulzUpdater();
            case HYBRID:
                return new HybridUpdater(backend);
            case HALLEY:
                return new HalleyUpdater(backend);
            case QDWH:
                return new QdwhUpdater(backend, config.isPivot());
            default:
                throw new IllegalArgumentException(
                        "反復法ではありません: " + config.getAlgorithm().getId());
        }
    }

    /**
     * 特異値分解 A = P·S·Qᵗ から {@code U = P·Qᵗ}, {@code H = Q·S·Qᵗ} を構成します。
     *
     * @param a 入力行列です
     * @return 結果です（反復回数・収束判定なし）
     */
    private PolarResult factorizeBySingularValues(DMatrixRMaj a) {
        if (a.numRows == 0 || a.numCols == 0) {
            throw new ShapeMismatchException("svd に空の行列は渡せません: " + a.numRows + "x" + a.numCols);
        }

        SingularValueDecompositionResult svd = backend.decomposeSingularValues(a);
        DMatrixRMaj p = svd.getLeft();
        DMatrixRMaj q = svd.getRight();
        double[] s = svd.getSingularValues();

        DMatrixRMaj u = new DMatrixRMaj(a.numRows, a.numCols);
        CommonOps_DDRM.multTransB(p, q, u);

        // Q·S
        DMatrixRMaj qs = q.copy();
        for (int row = 0; row < qs.numRows; row++) {
            for (int col = 0; col < s.length; col++) {
                qs.set(row, col, qs.get(row, col) * s[col]);
            }
        }
        DMatrixRMaj h = new DMatrixRMaj(a.numCols, a.numCols);
        CommonOps_DDRM.multTransB(qs, q, h);
        MatrixMetrics.symmetrizeInPlace(h);

        log.info("SVD で極分解しました。サイズ={}x{}", a.numRows, a.numCols);
        return PolarResult.direct(u, h);
    }
}
