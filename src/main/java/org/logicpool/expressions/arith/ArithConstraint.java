package org.logicpool.expressions.arith;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.RelationType;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表一个算术约束，形式为 E1 ~ E2，其中 E1 和 E2 都是线性表达式。
 * 内部规范化为 E_normalized ~ 0 的形式。
 * 此类是不可变的。
 */
@Getter
public final class ArithConstraint implements TheoryAtom<ArithConstraint> {

    private static final Logger logger = LoggerFactory.getLogger(ArithConstraint.class);

    // 规范化后的形式：lhs ~ 0
    private final LinearExpression lhs;
    private final RelationType relation;

    private final int hashCode;

    private ArithConstraint(LinearExpression lhs, RelationType relation) {
        this.lhs = Objects.requireNonNull(lhs, "ArithConstraint-构造函数: lhs 表达式不能为 null");
        this.relation = Objects.requireNonNull(relation, "ArithConstraint-构造函数: relation 不能为 null");
        this.hashCode = Objects.hash(this.lhs, this.relation);
        logger.debug("创建 ArithConstraint: {}", this);
    }

    /**
     * 工厂方法：创建 E1 ~ E2，规范化为 (E1 - E2) ~ 0。
     * @param left     左侧表达式。
     * @param right    右侧表达式。
     * @param relation 关系类型。
     * @return ArithConstraint 实例。
     */
    public static ArithConstraint of(LinearExpression left, LinearExpression right, RelationType relation) {
        Objects.requireNonNull(left, "ArithConstraint-工厂方法: left 表达式不能为 null");
        Objects.requireNonNull(right, "ArithConstraint-工厂方法: right 表达式不能为 null");
        return new ArithConstraint(left.subtract(right), relation);
    }

    /**
     * 工厂方法：创建 E ~ 0。
     */
    public static ArithConstraint of(LinearExpression lhs, RelationType relation) {
        return new ArithConstraint(lhs, relation);
    }

    @Override
    public ArithConstraint negation() {
        // ¬(E ~ 0) => E ~' 0
        return new ArithConstraint(this.lhs, this.relation.negate());
    }

    /**
     * 只有当左侧不含变量时才能确定真值。
     */
    @Override
    public Consistency isConsistent() {
        if (!lhs.isConstant()) {
            return Consistency.UNDETERMINED;
        }
        boolean value = relation.holds(lhs.getConstant().signum());
        if (!value) {
            logger.debug("ArithConstraint: {} 恒假", this);
        }
        return Consistency.of(value);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr z3Lhs = lhs.toZ3ArithExpr(ctx, varManager);
        ArithExpr z3Zero = ctx.mkReal(0);

        return switch (relation) {
            case LT -> ctx.mkLt(z3Lhs, z3Zero);
            case LE -> ctx.mkLe(z3Lhs, z3Zero);
            case GT -> ctx.mkGt(z3Lhs, z3Zero);
            case GE -> ctx.mkGe(z3Lhs, z3Zero);
            case EQ -> ctx.mkEq(z3Lhs, z3Zero);
            case NEQ -> ctx.mkNot(ctx.mkEq(z3Lhs, z3Zero));
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ArithConstraint that = (ArithConstraint) o;
        return relation == that.relation && lhs.equals(that.lhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return lhs + " " + relation.getSymbol() + " 0";
    }

    @Override
    public int compareTo(ArithConstraint other) {
        int cmp = lhs.compareTo(other.lhs);
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
