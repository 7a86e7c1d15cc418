package org.logicpool.expressions;

/**
 * 原子在构造时能够确定的真值。
 */
public enum Consistency {

    /** 恒真，例如 0 = 0 */
    ALWAYS_TRUE,
    /** 恒假，例如 1 <= 0 */
    ALWAYS_FALSE,
    /** 不能仅凭原子本身确定 */
    UNDETERMINED;

    public static Consistency of(boolean value) {
        return value ? ALWAYS_TRUE : ALWAYS_FALSE;
    }
}
