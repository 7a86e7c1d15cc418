package org.logicpool.expressions;

public enum RelationType {

    /**
     * 运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    GT(">"),    // Greater Than
    GE(">="),   // Greater Equal
    EQ("="),    // Equal
    NEQ("!=");  // Not Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NEQ;
            case NEQ -> EQ;
        };
    }

    /**
     * 判断 "v ~ 0" 是否成立，其中 v 的符号为 signum。
     * @param signum 左侧值的符号 (-1, 0, 1)。
     * @return 关系是否成立。
     */
    public boolean holds(int signum) {
        return switch (this) {
            case LT -> signum < 0;
            case LE -> signum <= 0;
            case GT -> signum > 0;
            case GE -> signum >= 0;
            case EQ -> signum == 0;
            case NEQ -> signum != 0;
        };
    }
}
