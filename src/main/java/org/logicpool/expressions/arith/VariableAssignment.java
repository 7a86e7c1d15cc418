package org.logicpool.expressions.arith;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;
import org.logicpool.utils.Rational;

import java.util.Objects;

/**
 * 变量赋值 x := v，以及它的否定形式。
 */
@Getter
public final class VariableAssignment implements TheoryAtom<VariableAssignment> {

    private final Variable variable;
    private final Rational value;
    private final boolean negated;

    private final int hashCode;

    private VariableAssignment(Variable variable, Rational value, boolean negated) {
        this.variable = Objects.requireNonNull(variable, "VariableAssignment-构造函数: variable 不能为 null");
        this.value = Objects.requireNonNull(value, "VariableAssignment-构造函数: value 不能为 null");
        if (!variable.getType().isArithmetic()) {
            throw new IllegalArgumentException("VariableAssignment-构造函数: 变量 " + variable + " 不是算术类型");
        }
        this.negated = negated;
        this.hashCode = Objects.hash(variable, value, negated);
    }

    public static VariableAssignment of(Variable variable, Rational value) {
        return new VariableAssignment(variable, value, false);
    }

    @Override
    public VariableAssignment negation() {
        return new VariableAssignment(variable, value, !negated);
    }

    @Override
    public Consistency isConsistent() {
        return Consistency.UNDETERMINED;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        BoolExpr eq = ctx.mkEq(varManager.getArithVar(variable), value.toZ3Real(ctx));
        return negated ? ctx.mkNot(eq) : eq;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableAssignment that = (VariableAssignment) o;
        return negated == that.negated && variable.equals(that.variable) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return variable.getName() + (negated ? " !-> " : " -> ") + value;
    }

    @Override
    public int compareTo(VariableAssignment other) {
        int cmp = variable.compareTo(other.variable);
        if (cmp != 0) {
            return cmp;
        }
        cmp = value.compareTo(other.value);
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(negated, other.negated);
    }
}
