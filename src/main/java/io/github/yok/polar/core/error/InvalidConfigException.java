package io.github.yok.polar.core.error;

/**
 * アルゴリズム設定が不正な場合に発生する例外です。
 *
 * <p>
 * 最大反復回数・許容誤差・アルゴリズム識別子の検証に失敗したときに、行列演算の前に送出されます。
 * </p>
 */
public class InvalidConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public InvalidConfigException(String message) {
        super(message);
    }
}
