package io.github.yok.polar.core.update;

import com.google.common.base.Preconditions;
import io.github.yok.polar.core.config.PolarAlgorithm;
import io.github.yok.polar.core.error.SingularMatrixException;
import io.github.yok.polar.core.linearalgebra.DecompositionBackend;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * QR ベースの動的重み付き Halley 法（QDWH）の更新規則です。
 *
 * <p>
 * 反復開始時に {@code X₀ = A/α}（α は最大特異値）へ正規化し、X₀ の最小特異値の下界
 * {@code L₀ = (‖X₀‖₁/κ₁(X₀))/√n} を求めます。 各ステップでは L から重み (a, b, c) を求め、
 * {@code [√c·U; I]} の QR 分解の Q を上 m 行 Q1・下 n 行 Q2 に分けて
 * {@code U ← (b/c)·U + ((a − b/c)/√c)·Q1·Q2ᵗ} で更新します。
 * </p>
 *
 * <p>
 * α には Frobenius ノルムではなく 2-ノルム（最大特異値）を使います。 Frobenius ノルムで割ると単位行列が
 * X₀ = I/√n となって最初のステップの不動点にならず、単位行列の極分解に 2 回以上の反復が必要になるためです。
 * </p>
 *
 * <p>
 * L₀ は見積もりなので、κ₁(X₀) が非常に大きい（数値的にほぼ特異な）入力も受け付けます。
 * 逆行列自体が計算できない場合のみ {@link SingularMatrixException} になります。
 * </p>
 *
 * <p>
 * 制限事項: 正方行列のみ対応しています（m &gt; n への拡張は未実装）。
 * </p>
 *
 * @see DwhParameters
 */
@Slf4j
public final class QdwhUpdater implements PolarUpdater<QdwhState> {

    /**
     * QR 分解を計算するバックエンドです。
     */
    private final DecompositionBackend backend;

    /**
     * QR 分解で列ピボットを使うかどうかです。
     */
    @Getter
    private final boolean pivot;

    /**
     * QDWH 法の更新規則を生成します。
     *
     * @param backend QR 分解を計算するバックエンドです（null 不可）
     * @param pivot QR 分解で列ピボットを使うかどうかです
     */
    public QdwhUpdater(DecompositionBackend backend, boolean pivot) {
        this.backend = Preconditions.checkNotNull(backend, "backend が null です。");
        this.pivot = pivot;
    }

    /**
     * U₀ を最大特異値で正規化し、下界 L₀ を持つ初期状態を返します。
     *
     * @param u 初期行列です（正規化した値で上書きされます）
     * @return 初期状態です
     * @throws io.github.yok.polar.core.error.ShapeMismatchException 正方行列でない場合に発生します
     * @throws SingularMatrixException 入力が特異な場合に発生します
     */
    @Override
    public QdwhState prepare(DMatrixRMaj u) {
        Shapes.requireSquare(u, PolarAlgorithm.QDWH);
        int n = u.numCols;

        double alpha = NormOps_DDRM.normP2(u);
        if (!(alpha > 0.0) || Double.isInfinite(alpha)) {
            throw new SingularMatrixException("最大特異値が正の有限値ではありません: " + alpha);
        }
        CommonOps_DDRM.scale(1.0 / alpha, u);

        // κ₁(X₀) = ‖X₀‖₁‖X₀⁻¹‖₁
        double norm1 = NormOps_DDRM.normP1(u);
        double condition = norm1 * inverseNorm1(u);
        double lowerBound = (norm1 / condition) / Math.sqrt(n);

        log.debug("QDWH を初期化しました。α={}、L₀={}", fmt(alpha), fmt(lowerBound));
        return new QdwhState(lowerBound, null);
    }

    /**
     * U を 1 ステップ更新し、下界 L を更新した状態を返します。
     *
     * @param u 現在の反復行列です（上書きされます）
     * @param state 現在の状態です
     * @return 次の状態です
     */
    @Override
    public QdwhState update(DMatrixRMaj u, QdwhState state) {
        DwhParameters p = DwhParameters.forLowerBound(state.getLowerBound());
        int m = u.numRows;
        int n = u.numCols;
        double sqrtC = Math.sqrt(p.getC());

        // [√c·U; I]
        DMatrixRMaj stacked = new DMatrixRMaj(m + n, n);
        DMatrixRMaj scaled = u.copy();
        CommonOps_DDRM.scale(sqrtC, scaled);
        CommonOps_DDRM.insert(scaled, stacked, 0, 0);
        CommonOps_DDRM.insert(CommonOps_DDRM.identity(n), stacked, m, 0);

        DMatrixRMaj q = backend.orthonormalFactor(stacked, pivot);
        DMatrixRMaj q1 = CommonOps_DDRM.extract(q, 0, m, 0, n);
        DMatrixRMaj q2 = CommonOps_DDRM.extract(q, m, m + n, 0, n);

        DMatrixRMaj q1q2t = new DMatrixRMaj(m, n);
        CommonOps_DDRM.multTransB(q1, q2, q1q2t);

        double bOverC = p.getB() / p.getC();
        DMatrixRMaj next = new DMatrixRMaj(m, n);
        CommonOps_DDRM.add(bOverC, u, (p.getA() - bOverC) / sqrtC, q1q2t, next);
        u.setTo(next);

        return new QdwhState(p.getNextLowerBound(), p);
    }

    /**
     * ‖X₀⁻¹‖₁ を返します。
     *
     * <p>
     * L₀ の見積もりにだけ使うため、条件数による棄却は行いません。 逆行列が計算できないか、NaN/∞ を含む場合のみ例外にします。
     * </p>
     *
     * @param x 正規化済みの行列です
     * @return 逆行列の 1-ノルムです
     * @throws SingularMatrixException x が特異な場合に発生します
     */
    static double inverseNorm1(DMatrixRMaj x) {
        DMatrixRMaj inverse = new DMatrixRMaj(x.numRows, x.numCols);
        if (!CommonOps_DDRM.invert(x.copy(), inverse)
                || MatrixFeatures_DDRM.hasUncountable(inverse)) {
            throw new SingularMatrixException("正規化した入力行列が特異です");
        }
        return NormOps_DDRM.normP1(inverse);
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
