package org.logicpool.formula;

/**
 * 公式节点的种类：布尔连接词、量词和各理论的原子。
 */
public enum FormulaType {

    // 核心理论
    TRUE("true"),
    FALSE("false"),
    BOOL("bool"),
    NOT("not"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    IFF("="),
    IMPLIES("=>"),
    ITE("ite"),
    EXISTS("exists"),
    FORALL("forall"),

    // 算术理论
    CONSTRAINT("constraint"),
    VARCOMPARE("varcompare"),
    VARASSIGN("varassign"),
    // 位向量理论
    BITVECTOR("bv"),
    // 未解释理论
    UEQ("ueq"),
    // 伪布尔
    PBCONSTRAINT("pb");

    private final String symbol;

    FormulaType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isConstant() {
        return this == TRUE || this == FALSE;
    }

    /**
     * 满足结合律、在池中以有序子公式集合存储的连接词。
     */
    public boolean isNary() {
        return this == AND || this == OR || this == XOR || this == IFF;
    }

    public boolean isQuantifier() {
        return this == EXISTS || this == FORALL;
    }

    /**
     * 包装理论原子的类型。这些节点的否定是同类型的取反原子，而不是 NOT 节点。
     */
    public boolean isTheoryAtom() {
        return switch (this) {
            case CONSTRAINT, VARCOMPARE, VARASSIGN, BITVECTOR, UEQ, PBCONSTRAINT -> true;
            default -> false;
        };
    }
}
