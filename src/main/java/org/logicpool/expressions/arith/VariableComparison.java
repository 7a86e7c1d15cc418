package org.logicpool.expressions.arith;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.RelationType;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;
import org.logicpool.utils.Rational;

import java.util.Objects;

/**
 * 变量与一个值的比较 x ~ v。值在这里是有理数，由模型构造过程产生，
 * 因此这一原子从不在构造时化简。
 */
@Getter
public final class VariableComparison implements TheoryAtom<VariableComparison> {

    private final Variable variable;
    private final RelationType relation;
    private final Rational value;

    private final int hashCode;

    private VariableComparison(Variable variable, RelationType relation, Rational value) {
        this.variable = Objects.requireNonNull(variable, "VariableComparison-构造函数: variable 不能为 null");
        this.relation = Objects.requireNonNull(relation, "VariableComparison-构造函数: relation 不能为 null");
        this.value = Objects.requireNonNull(value, "VariableComparison-构造函数: value 不能为 null");
        if (!variable.getType().isArithmetic()) {
            throw new IllegalArgumentException("VariableComparison-构造函数: 变量 " + variable + " 不是算术类型");
        }
        this.hashCode = Objects.hash(variable, relation, value);
    }

    public static VariableComparison of(Variable variable, RelationType relation, Rational value) {
        return new VariableComparison(variable, relation, value);
    }

    @Override
    public VariableComparison negation() {
        return new VariableComparison(variable, relation.negate(), value);
    }

    @Override
    public Consistency isConsistent() {
        return Consistency.UNDETERMINED;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr z3Var = varManager.getArithVar(variable);
        ArithExpr z3Value = value.toZ3Real(ctx);
        return switch (relation) {
            case LT -> ctx.mkLt(z3Var, z3Value);
            case LE -> ctx.mkLe(z3Var, z3Value);
            case GT -> ctx.mkGt(z3Var, z3Value);
            case GE -> ctx.mkGe(z3Var, z3Value);
            case EQ -> ctx.mkEq(z3Var, z3Value);
            case NEQ -> ctx.mkNot(ctx.mkEq(z3Var, z3Value));
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableComparison that = (VariableComparison) o;
        return variable.equals(that.variable) && relation == that.relation && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return variable.getName() + " " + relation.getSymbol() + " " + value;
    }

    @Override
    public int compareTo(VariableComparison other) {
        int cmp = variable.compareTo(other.variable);
        if (cmp != 0) {
            return cmp;
        }
        cmp = value.compareTo(other.value);
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
