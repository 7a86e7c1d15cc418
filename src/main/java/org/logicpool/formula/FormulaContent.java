package org.logicpool.formula;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.AccessLevel;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.expressions.ToZ3BoolExpr;
import org.logicpool.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 公式池中一个公式的唯一代表（节点）。
 * <p>
 * 节点只由 {@link FormulaPool} 创建，发布后不可变：ID、形状、难度和否定链接都不再改变。
 * 使用计数不在节点上，而由池按基公式的 ID 单独记录。
 * 节点本身不持有引用计数，外部代码应通过 {@link Formula} 句柄持有公式；
 * 直接保存 FormulaContent 不会阻止它被回收。
 */
@Getter
public final class FormulaContent implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(FormulaContent.class);

    private final int id;
    @Getter(AccessLevel.PACKAGE)
    private final FormulaKey key;
    /** 是否为存放在池查找表中的那一侧 */
    private final boolean base;
    private final double difficulty;
    /** 逻辑否定，发布前由池设置一次；其他线程不经过池锁读取句柄时也能看到 */
    private volatile FormulaContent negation;

    FormulaContent(int id, FormulaKey key, boolean base, double difficulty) {
        this.id = id;
        this.key = key;
        this.base = base;
        this.difficulty = difficulty;
    }

    void linkNegation(FormulaContent negation) {
        if (this.negation != null) {
            logger.error("FormulaContent: 节点 {} 的否定已经设置", id);
            throw new IllegalStateException("FormulaContent: 节点 " + id + " 的否定已经设置");
        }
        this.negation = negation;
    }

    /**
     * 由子公式计算难度：常量为 0，变量和原子为 1，连接词为子公式难度之和。
     */
    static double difficultyOf(FormulaKey key) {
        return switch (key.getType()) {
            case TRUE, FALSE -> 0.0;
            case BOOL, CONSTRAINT, VARCOMPARE, VARASSIGN, BITVECTOR, UEQ, PBCONSTRAINT -> 1.0;
            default -> key.getSubformulas().stream().mapToDouble(FormulaContent::getDifficulty).sum();
        };
    }

    public FormulaType getType() {
        return key.getType();
    }

    /**
     * NOT 节点：唯一的操作数；n 元连接词：按 ID 升序；IMPLIES/ITE：按位置；量词：只含主体。
     */
    public List<FormulaContent> getSubformulas() {
        return key.getSubformulas();
    }

    /**
     * @return BOOL 节点包装的变量，其他类型为 null。
     */
    public Variable getVariable() {
        return key.getVariable();
    }

    /**
     * @return 理论原子节点的载荷，其他类型为 null。
     */
    public TheoryAtom<?> getAtom() {
        return key.getAtom();
    }

    public List<Variable> getBoundVariables() {
        return key.getBoundVariables();
    }

    public boolean isTrue() {
        return getType() == FormulaType.TRUE;
    }

    public boolean isFalse() {
        return getType() == FormulaType.FALSE;
    }

    /**
     * 前缀表示，例如 (and a (not b))。
     */
    @Override
    public String toString() {
        FormulaType type = getType();
        return switch (type) {
            case TRUE, FALSE -> type.getSymbol();
            case BOOL -> getVariable().getName();
            case CONSTRAINT, VARCOMPARE, VARASSIGN, BITVECTOR, UEQ, PBCONSTRAINT -> getAtom().toString();
            case EXISTS, FORALL -> "(" + type.getSymbol() + " ("
                    + getBoundVariables().stream().map(Variable::getName).collect(Collectors.joining(" "))
                    + ") " + getSubformulas().get(0) + ")";
            default -> "(" + type.getSymbol() + " "
                    + getSubformulas().stream().map(FormulaContent::toString).collect(Collectors.joining(" "))
                    + ")";
        };
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        List<FormulaContent> subformulas = getSubformulas();
        return switch (getType()) {
            case TRUE -> ctx.mkTrue();
            case FALSE -> ctx.mkFalse();
            case BOOL -> varManager.getBoolVar(getVariable());
            case NOT -> ctx.mkNot(subformulas.get(0).toZ3BoolExpr(ctx, varManager));
            case AND -> ctx.mkAnd(toZ3Operands(ctx, varManager));
            case OR -> ctx.mkOr(toZ3Operands(ctx, varManager));
            case XOR -> {
                BoolExpr[] operands = toZ3Operands(ctx, varManager);
                BoolExpr result = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    result = ctx.mkXor(result, operands[i]);
                }
                yield result;
            }
            case IFF -> {
                BoolExpr[] operands = toZ3Operands(ctx, varManager);
                BoolExpr result = operands[0];
                for (int i = 1; i < operands.length; i++) {
                    result = ctx.mkIff(result, operands[i]);
                }
                yield result;
            }
            case IMPLIES -> ctx.mkImplies(subformulas.get(0).toZ3BoolExpr(ctx, varManager),
                    subformulas.get(1).toZ3BoolExpr(ctx, varManager));
            case ITE -> (BoolExpr) ctx.mkITE(subformulas.get(0).toZ3BoolExpr(ctx, varManager),
                    subformulas.get(1).toZ3BoolExpr(ctx, varManager),
                    subformulas.get(2).toZ3BoolExpr(ctx, varManager));
            case EXISTS, FORALL -> {
                Expr<?>[] bound = getBoundVariables().stream()
                        .map(varManager::getZ3Var)
                        .toArray(Expr<?>[]::new);
                BoolExpr body = subformulas.get(0).toZ3BoolExpr(ctx, varManager);
                yield getType() == FormulaType.EXISTS
                        ? ctx.mkExists(bound, body, 1, null, null, null, null)
                        : ctx.mkForall(bound, body, 1, null, null, null, null);
            }
            case CONSTRAINT, VARCOMPARE, VARASSIGN, BITVECTOR, UEQ, PBCONSTRAINT -> getAtom().toZ3BoolExpr(ctx, varManager);
        };
    }

    private BoolExpr[] toZ3Operands(Context ctx, Z3VariableManager varManager) {
        return getSubformulas().stream()
                .map(sub -> sub.toZ3BoolExpr(ctx, varManager))
                .toArray(BoolExpr[]::new);
    }
}
