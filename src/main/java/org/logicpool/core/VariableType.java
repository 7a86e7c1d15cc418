package org.logicpool.core;

/**
 * 变量的类型（排序）。决定变量可以出现在哪一类原子中，以及转换到 Z3 时使用的 Sort。
 */
public enum VariableType {

    BOOL("Bool"),
    REAL("Real"),
    INT("Int"),
    BITVECTOR("BitVec"),
    UNINTERPRETED("U");

    private final String sortName;

    VariableType(String sortName) {
        this.sortName = sortName;
    }

    public String getSortName() {
        return sortName;
    }

    /**
     * 是否为算术类型 (REAL 或 INT)。
     */
    public boolean isArithmetic() {
        return this == REAL || this == INT;
    }
}
