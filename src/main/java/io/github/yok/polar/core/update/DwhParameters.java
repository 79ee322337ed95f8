package io.github.yok.polar.core.update;

import lombok.Value;
import org.ejml.data.Complex_F64;
import org.ejml.ops.ComplexMath_F64;

/**
 * 動的重み付き Halley 反復の重み (a, b, c) と、更新後の下界 L を保持するクラスです。
 *
 * <p>
 * 下界 L（正規化した反復行列の最小特異値の下界）から次の式で求めます。
 * </p>
 *
 * <pre>
 *   d = (4(1 − L²) / L⁴)^(1/3)
 *   a = √(1 + d) + ½·√(8 − 4d + 8(2 − L²) / (L²·√(1 + d)))
 *   b = (a − 1)² / 4
 *   c = a + b − 1
 *   L' = L·(a + b·L²) / (1 + c·L²)
 * </pre>
 *
 * <p>
 * 丸め誤差で L が 1 をわずかに超えると d の根号内が負になります。その場合は d と a を複素数で計算し、a の実部を使います。
 * </p>
 */
@Value
public class DwhParameters {

    /**
     * 重み a です。
     */
    double a;

    /**
     * 重み b です。
     */
    double b;

    /**
     * 重み c です。
     */
    double c;

    /**
     * 更新後の下界 L です。
     */
    double nextLowerBound;

    /**
     * 下界 L から重みを計算します。
     *
     * @param lowerBound 下界 L です（正の値）
     * @return 重みと更新後の下界です
     * @throws IllegalArgumentException lowerBound が正の有限値でない場合に発生します
     */
    public static DwhParameters forLowerBound(double lowerBound) {
        if (!(lowerBound > 0.0) || Double.isInfinite(lowerBound)) {
            throw new IllegalArgumentException("下界 L は正の有限値が必要です: " + lowerBound);
        }

        double l2 = lowerBound * lowerBound;
        double radicand = 4.0 * (1.0 - l2) / (l2 * l2);

        double a;
        if (radicand >= 0.0) {
            double d = Math.cbrt(radicand);
            double sqd = Math.sqrt(1.0 + d);
            a = sqd + 0.5 * Math.sqrt(8.0 - 4.0 * d + 8.0 * (2.0 - l2) / (l2 * sqd));
        } else {
            a = complexWeight(radicand, l2);
        }

        double b = (a - 1.0) * (a - 1.0) / 4.0;
        double c = a + b - 1.0;
        double next = lowerBound * (a + b * l2) / (1.0 + c * l2);
        return new DwhParameters(a, b, c, next);
    }

    /**
     * 根号内が負の場合の重み a を、主値の複素数根で計算して実部を返します。
     *
     * @param radicand 負の根号内です
     * @param l2 L² です
     * @return a の実部です
     */
    static double complexWeight(double radicand, double l2) {
        Complex_F64 d = new Complex_F64();
        ComplexMath_F64.root(new Complex_F64(radicand, 0.0), 3, 0, d);

        Complex_F64 sqd = new Complex_F64();
        ComplexMath_F64.sqrt(new Complex_F64(1.0 + d.real, d.imaginary), sqd);

        // 8(2 − L²) / (L²·√(1 + d))
        Complex_F64 quotient = new Complex_F64();
        ComplexMath_F64.divide(new Complex_F64(8.0 * (2.0 - l2), 0.0),
                new Complex_F64(l2 * sqd.real, l2 * sqd.imaginary), quotient);

        Complex_F64 inner = new Complex_F64(8.0 - 4.0 * d.real + quotient.real,
                -4.0 * d.imaginary + quotient.imaginary);
        Complex_F64 root = new Complex_F64();
        ComplexMath_F64.sqrt(inner, root);

        return sqd.real + 0.5 * root.real;
    }
}
