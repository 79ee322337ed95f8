package io.github.yok.polar.core.update;

/**
 * 反復間で引き継ぐ状態を持たない更新規則のための状態値です。
 */
public enum Stateless {
    INSTANCE
}
