package io.github.yok.polar.core.error;

/**
 * 逆行列を必要とする計算で、行列が数値的に特異だった場合に発生する例外です。
 */
public class SingularMatrixException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public SingularMatrixException(String message) {
        super(message);
    }
}
