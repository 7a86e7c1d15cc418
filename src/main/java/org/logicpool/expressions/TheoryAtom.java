package org.logicpool.expressions;

/**
 * 公式池对理论原子（算术约束、位向量约束、未解释等式、伪布尔约束等）的要求。
 * <p>
 * 实现必须是不可变的，{@code equals}/{@code hashCode} 与 {@code compareTo} 一致，
 * 且 {@link #negation()} 与原子本身在全序中不相等。公式池用这一全序在一对互为否定的原子中
 * 选出较小者作为基公式存储。
 *
 * @param <T> 原子的具体类型。
 */
public interface TheoryAtom<T extends TheoryAtom<T>> extends Comparable<T>, ToZ3BoolExpr {

    /**
     * @return 逻辑上取反的原子。
     */
    T negation();

    /**
     * @return 原子在构造时能确定的真值。
     */
    Consistency isConsistent();

    default boolean isAlwaysConsistent() {
        return isConsistent() == Consistency.ALWAYS_TRUE;
    }

    default boolean isAlwaysInconsistent() {
        return isConsistent() == Consistency.ALWAYS_FALSE;
    }
}
