package org.logicpool.expressions.uninterpreted;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;

import java.util.Objects;

/**
 * 未解释项之间的等式 lhs = rhs 或不等式 lhs != rhs。
 * 两侧按全序排列，因此 a = b 与 b = a 是同一个原子。
 */
@Getter
public final class UEquality implements TheoryAtom<UEquality> {

    private final UTerm lhs;
    private final UTerm rhs;
    private final boolean negated;

    private final int hashCode;

    private UEquality(UTerm lhs, UTerm rhs, boolean negated) {
        Objects.requireNonNull(lhs, "UEquality-构造函数: lhs 不能为 null");
        Objects.requireNonNull(rhs, "UEquality-构造函数: rhs 不能为 null");
        if (rhs.compareTo(lhs) < 0) {
            this.lhs = rhs;
            this.rhs = lhs;
        } else {
            this.lhs = lhs;
            this.rhs = rhs;
        }
        this.negated = negated;
        this.hashCode = Objects.hash(this.lhs, this.rhs, negated);
    }

    public static UEquality of(UTerm lhs, UTerm rhs, boolean negated) {
        return new UEquality(lhs, rhs, negated);
    }

    @Override
    public UEquality negation() {
        return new UEquality(lhs, rhs, !negated);
    }

    @Override
    public Consistency isConsistent() {
        if (lhs.equals(rhs)) {
            return Consistency.of(!negated);
        }
        return Consistency.UNDETERMINED;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        BoolExpr eq = ctx.mkEq(lhs.toZ3Expr(ctx, varManager), rhs.toZ3Expr(ctx, varManager));
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
        UEquality that = (UEquality) o;
        return negated == that.negated && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + (negated ? "!=" : "=") + " " + lhs + " " + rhs + ")";
    }

    @Override
    public int compareTo(UEquality other) {
        int cmp = lhs.compareTo(other.lhs);
        if (cmp != 0) {
            return cmp;
        }
        cmp = rhs.compareTo(other.rhs);
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(negated, other.negated);
    }
}
