package io.github.yok.polar.core.config;

import io.github.yok.polar.core.error.InvalidConfigException;
import lombok.Value;
import lombok.With;

/**
 * 極分解アルゴリズムの設定値（最大反復回数・許容誤差など）を保持するクラスです。
 *
 * <p>
 * 生成時に検証を行うため、生成済みのインスタンスは常に有効な設定です。
 * </p>
 */
@Value
@With
public class AlgorithmConfig {

    /**
     * 最大反復回数の既定値です。
     */
    public static final int DEFAULT_MAX_ITER = 100;

    /**
     * 許容誤差（相対変化量）の既定値です。
     */
    public static final double DEFAULT_TOLERANCE = 1e-6;

    /**
     * アルゴリズム種別です。
     */
    PolarAlgorithm algorithm;

    /**
     * 最大反復回数です（2 以上）。SVD では使いません。
     */
    int maxIter;

    /**
     * 収束判定に用いる相対変化量の許容誤差です（正の値）。SVD では使いません。
     */
    double tolerance;

    /**
     * 反復ごとの経過を報告するかどうかです。
     */
    boolean verbose;

    /**
     * QR 分解で列ピボットを使うかどうかです（QDWH のみ）。
     */
    boolean pivot;

    /**
     * 設定を生成します。
     *
     * @param algorithm アルゴリズム種別です（null 不可）
     * @param maxIter 最大反復回数です（2 以上）
     * @param tolerance 許容誤差です（正の値）
     * @param verbose 反復ごとの経過を報告するかどうかです
     * @param pivot QR 分解で列ピボットを使うかどうかです
     * @throws InvalidConfigException 設定値が不正な場合に発生します
     */
    public AlgorithmConfig(PolarAlgorithm algorithm, int maxIter, double tolerance,
            boolean verbose, boolean pivot) {
        if (algorithm == null) {
            throw new InvalidConfigException("algorithm は null 不可です");
        }
        this.algorithm = algorithm;
        this.maxIter = requireValidMaxIter(maxIter);
        this.tolerance = requireValidTolerance(tolerance);
        this.verbose = verbose;
        this.pivot = pivot;
    }

    /**
     * Newton 法の既定設定を返します。
     *
     * @return 既定設定です
     */
    public static AlgorithmConfig defaults() {
        return defaults(PolarAlgorithm.NEWTON);
    }

    /**
     * 指定したアルゴリズムの既定設定を返します。
     *
     * @param algorithm アルゴリズム種別です
     * @return 既定設定です
     */
    public static AlgorithmConfig defaults(PolarAlgorithm algorithm) {
        return new AlgorithmConfig(algorithm, DEFAULT_MAX_ITER, DEFAULT_TOLERANCE, false, true);
    }

    /**
     * 最大反復回数を検証します。
     *
     * @param maxIter 最大反復回数です
     * @return 検証済みの最大反復回数です
     * @throws InvalidConfigException 1 以下の場合に発生します
     */
    public static int requireValidMaxIter(int maxIter) {
        if (maxIter <= 1) {
            throw new InvalidConfigException("maxIter は 1 より大きい必要があります: " + maxIter);
        }
        return maxIter;
    }

    /**
     * 許容誤差を検証します。
     *
     * @param tolerance 許容誤差です
     * @return 検証済みの許容誤差です
     * @throws InvalidConfigException 正の有限値でない場合に発生します
     */
    public static double requireValidTolerance(double tolerance) {
        if (!(tolerance > 0.0) || Double.isInfinite(tolerance)) {
            throw new InvalidConfigException("tol は正の値が必要です: " + tolerance);
        }
        return tolerance;
    }
}
