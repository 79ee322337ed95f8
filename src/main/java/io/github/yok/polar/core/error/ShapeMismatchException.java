package io.github.yok.polar.core.error;

/**
 * 入力行列の形状が、選択したアルゴリズムで扱えない場合に発生する例外です。
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public ShapeMismatchException(String message) {
        super(message);
    }
}
