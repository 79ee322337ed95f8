package io.github.yok.polar.core.config;

import io.github.yok.polar.core.error.InvalidConfigException;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 極分解のアルゴリズム種別を表す列挙型です。
 *
 * <p>
 * SVD 以外は共通の収束ループ（反復法）で解きます。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum PolarAlgorithm {

    /**
     * スケーリング付き Newton 法です。
     */
    NEWTON("newton", true),

    /**
     * Newton–Schulz 法です。
     */
    SCHULZ("schulz", true),

    /**
     * Newton 法から Newton–Schulz 法へ切り替えるハイブリッド法です。
     */
    HYBRID("hybrid", true),

    /**
     * Halley 法です。
     */
    HALLEY("halley", true),

    /**
     * QR ベースの動的重み付き Halley 法（QDWH）です。
     */
    QDWH("qdwh", true),

    /**
     * 特異値分解から直接構成する方法です（反復なし）。
     */
    SVD("svd", false);

    /**
     * 設定ファイルなどで使う識別子です。
     */
    private final String id;

    /**
     * 反復法かどうかです。
     */
    private final boolean iterative;

    /**
     * 識別子からアルゴリズム種別を解決します（大文字小文字は区別しません）。
     *
     * @param id 識別子です
     * @return アルゴリズム種別です
     * @throws InvalidConfigException 識別子が null、または未知の場合に発生します
     */
    public static PolarAlgorithm fromId(String id) {
        if (id == null) {
            throw new InvalidConfigException("algorithm は null 不可です");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (PolarAlgorithm algorithm : values()) {
            if (algorithm.id.equals(normalized)) {
                return algorithm;
            }
        }
        throw new InvalidConfigException("未知のアルゴリズムです: " + id);
    }
}
