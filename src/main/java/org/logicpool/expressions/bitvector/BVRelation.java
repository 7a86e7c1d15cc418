package org.logicpool.expressions.bitvector;

/**
 * 位向量上的（无符号）比较关系。
 */
public enum BVRelation {

    EQ("="),
    NEQ("!="),
    ULT("bvult"),
    ULE("bvule"),
    UGT("bvugt"),
    UGE("bvuge");

    private final String symbol;

    BVRelation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public BVRelation negate() {
        return switch (this) {
            case EQ -> NEQ;
            case NEQ -> EQ;
            case ULT -> UGE;
            case ULE -> UGT;
            case UGT -> ULE;
            case UGE -> ULT;
        };
    }

    public boolean isSymmetric() {
        return this == EQ || this == NEQ;
    }

    /**
     * @param cmp 左右操作数按无符号比较的结果。
     * @return 关系是否成立。
     */
    public boolean holds(int cmp) {
        return switch (this) {
            case EQ -> cmp == 0;
            case NEQ -> cmp != 0;
            case ULT -> cmp < 0;
            case ULE -> cmp <= 0;
            case UGT -> cmp > 0;
            case UGE -> cmp >= 0;
        };
    }
}
