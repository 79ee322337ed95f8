package io.github.yok.polar.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.AlgorithmConfig;
import io.github.yok.polar.core.linearalgebra.MatrixMetrics;
import io.github.yok.polar.core.report.IterationReporter;
import io.github.yok.polar.core.update.PolarUpdater;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 極分解の反復法に共通の収束ループを実行するクラスです。
 *
 * <p>
 * U₀ = A → 更新規則の適用 → 相対変化量・目的関数値の計算 → 報告 → 収束判定、を反復し、 最後に
 * {@code H = sym(Uᵗ·A)} を組み立てます。
 * </p>
 *
 * <p>
 * 作業用の行列はすべて呼び出しごとに確保するため、このクラスは状態を持ちません。
 * </p>
 */
@Slf4j
public final class ConvergenceDriver {

    /**
     * 収束ループを実行し、結果を返します。
     *
     * @param updater 更新規則です
     * @param a 入力行列です（変更しません）
     * @param maxIter 最大反復回数です（2 以上）
     * @param tol 相対変化量の許容誤差です（正の値）
     * @param reporter 反復ごとの報告先です
     * @param <S> 更新規則の状態の型です
     * @return 結果です
     */
    public <S> PolarResult run(PolarUpdater<S> updater, DMatrixRMaj a, int maxIter, double tol,
            IterationReporter reporter) {
        return iterate(updater, a, maxIter, tol, reporter).toResult();
    }

    /**
     * 収束ループを実行し、更新規則の最終状態を含む実行結果を返します。
     *
     * @param updater 更新規則です
     * @param a 入力行列です（変更しません）
     * @param maxIter 最大反復回数です（2 以上）
     * @param tol 相対変化量の許容誤差です（正の値）
     * @param reporter 反復ごとの報告先です
     * @param <S> 更新規則の状態の型です
     * @return 実行結果です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws io.github.yok.polar.core.error.InvalidConfigException maxIter または tol が不正な場合に発生します
     */
    public <S> IterationOutcome<S> iterate(PolarUpdater<S> updater, DMatrixRMaj a, int maxIter,
            double tol, IterationReporter reporter) {
        Preconditions.checkNotNull(updater, "updater が null です。");
        Preconditions.checkNotNull(a, "入力行列が null です。");
        Preconditions.checkNotNull(reporter, "reporter が null です。");
        AlgorithmConfig.requireValidMaxIter(maxIter);
        AlgorithmConfig.requireValidTolerance(tol);

        long t0 = System.nanoTime();
        String name = updater.getClass().getSimpleName();

        DMatrixRMaj u = a.copy();
        S state = updater.prepare(u);
        DMatrixRMaj previous = new DMatrixRMaj(u.numRows, u.numCols);

        log.info("極分解の反復を開始します。更新規則={}、サイズ={}x{}、最大反復={}、許容誤差={}", name, a.numRows,
                a.numCols, maxIter, fmt(tol));

        boolean converged = false;
        int performedIterations = 0;
        double relativeError = Double.NaN;
        double objective = Double.NaN;

        for (int iter = 1; iter <= maxIter; iter++) {
            performedIterations = iter;

            // 1) 直前の U を保存
            previous.setTo(u);

            // 2) 更新
            state = updater.update(u, state);

            // 3) 収束判定用の相対変化量と、診断用の目的関数値
            relativeError = MatrixMetrics.relativeDifference(u, previous);
            double deviation = MatrixMetrics.orthonormalityDeviation(u);
            objective = deviation * deviation;

            reporter.report(iter, relativeError, objective);

            // NaN/∞ は収束とみなさない
            if (Double.isFinite(relativeError) && relativeError <= tol) {
                converged = true;
                break;
            }
        }

        DMatrixRMaj h = assembleSymmetricFactor(u, a);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        if (converged) {
            log.info("極分解が収束しました。更新規則={}、反復回数={}、相対変化量={}、所要時間={}ms", name,
                    performedIterations, fmt(relativeError), elapsedMs);
        } else {
            log.warn("極分解が未収束で終了しました。更新規則={}、反復回数={}、相対変化量={}、所要時間={}ms", name,
                    performedIterations, fmt(relativeError), elapsedMs);
        }

        return new IterationOutcome<>(u, h, performedIterations, converged, relativeError,
                objective, state);
    }

    /**
     * 最終的な U から {@code H = (Uᵗ·A + (Uᵗ·A)ᵗ)/2} を組み立てます。
     *
     * @param u 最終的な直交因子です
     * @param a 入力行列です
     * @return 対称化済みの H です
     */
    static DMatrixRMaj assembleSymmetricFactor(DMatrixRMaj u, DMatrixRMaj a) {
        DMatrixRMaj h = new DMatrixRMaj(u.numCols, a.numCols);
        CommonOps_DDRM.multTransA(u, a, h);
        MatrixMetrics.symmetrizeInPlace(h);
        return h;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
