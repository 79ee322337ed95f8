package io.github.yok.polar.core.solver;

import java.util.Optional;
import java.util.OptionalInt;
import lombok.ToString;
import org.ejml.data.DMatrixRMaj;

/**
 * 極分解 A = U·H の結果を表す不変クラスです。
 *
 * <p>
 * 反復回数と収束判定は反復法でのみ存在し、SVD による直接計算では空になります。 行列の取得メソッドはコピーを返します。
 * </p>
 */
@ToString
public final class PolarResult {

    /**
     * 直交因子 U（rows×cols）です。
     */
    private final DMatrixRMaj u;

    /**
     * 対称半正定値因子 H（cols×cols）です。
     */
    private final DMatrixRMaj h;

    /**
     * 反復回数です（SVD では null）。
     */
    private final Integer iterations;

    /**
     * 収束したかどうかです（SVD では null）。
     */
    private final Boolean converged;

    private PolarResult(DMatrixRMaj u, DMatrixRMaj h, Integer iterations, Boolean converged) {
        this.u = u;
        this.h = h;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * 反復法の結果を生成します。行列の所有権は結果へ移ります。
     *
     * @param u 直交因子です
     * @param h 対称因子です
     * @param iterations 反復回数です
     * @param converged 収束したかどうかです
     * @return 結果です
     */
    public static PolarResult iterative(DMatrixRMaj u, DMatrixRMaj h, int iterations,
            boolean converged) {
        return new PolarResult(u, h, iterations, converged);
    }

    /**
     * 反復を伴わない方法（SVD）の結果を生成します。行列の所有権は結果へ移ります。
     *
     * @param u 直交因子です
     * @param h 対称因子です
     * @return 結果です
     */
    public static PolarResult direct(DMatrixRMaj u, DMatrixRMaj h) {
        return new PolarResult(u, h, null, null);
    }

    /**
     * 直交因子 U のコピーを返します。
     *
     * @return U です
     */
    public DMatrixRMaj getU() {
        return u.copy();
    }

    /**
     * 対称因子 H のコピーを返します。
     *
     * @return H です
     */
    public DMatrixRMaj getH() {
        return h.copy();
    }

    /**
     * 反復回数を返します。
     *
     * @return 反復回数です（SVD では空）
     */
    public OptionalInt getIterations() {
        return (iterations == null) ? OptionalInt.empty() : OptionalInt.of(iterations);
    }

    /**
     * 収束したかどうかを返します。
     *
     * @return 収束判定です（SVD では空）
     */
    public Optional<Boolean> getConverged() {
        return Optional.ofNullable(converged);
    }
}
