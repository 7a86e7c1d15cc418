package org.logicpool.expressions.bitvector;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.symbolic.Z3VariableManager;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 定宽位向量项：位向量变量或无符号常量。
 * 常量按 2^width 取模存储。
 */
@Getter
public final class BVTerm implements Comparable<BVTerm> {

    private final Variable variable;
    private final BigInteger value;
    private final int width;

    private final int hashCode;

    private BVTerm(Variable variable, BigInteger value, int width) {
        checkWidth(width);
        this.variable = variable;
        this.value = value;
        this.width = width;
        this.hashCode = Objects.hash(variable, value, width);
    }

    public static BVTerm variable(Variable variable, int width) {
        Objects.requireNonNull(variable, "BVTerm-工厂方法: variable 不能为 null");
        if (variable.getType() != VariableType.BITVECTOR) {
            throw new IllegalArgumentException("BVTerm-工厂方法: 变量 " + variable + " 不是位向量类型");
        }
        return new BVTerm(variable, null, width);
    }

    public static BVTerm constant(long value, int width) {
        return constant(BigInteger.valueOf(value), width);
    }

    public static BVTerm constant(BigInteger value, int width) {
        Objects.requireNonNull(value, "BVTerm-工厂方法: value 不能为 null");
        // 取模之前检查，否则非正位宽会变成 ArithmeticException
        checkWidth(width);
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        return new BVTerm(null, value.mod(modulus), width);
    }

    private static void checkWidth(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("BVTerm: 位宽必须为正数: " + width);
        }
    }

    public boolean isConstant() {
        return variable == null;
    }

    public BitVecExpr toZ3BitVecExpr(Context ctx, Z3VariableManager varManager) {
        if (isConstant()) {
            return ctx.mkBV(value.toString(), width);
        }
        return varManager.getBitVecVar(variable, width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BVTerm that = (BVTerm) o;
        return width == that.width && Objects.equals(variable, that.variable) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return isConstant() ? "#" + value + "[" + width + "]" : variable.getName();
    }

    /**
     * 常量排在变量之前；常量之间按数值，变量之间按变量 ID。
     */
    @Override
    public int compareTo(BVTerm other) {
        int cmp = Integer.compare(width, other.width);
        if (cmp != 0) {
            return cmp;
        }
        if (isConstant() != other.isConstant()) {
            return isConstant() ? -1 : 1;
        }
        return isConstant() ? value.compareTo(other.value) : variable.compareTo(other.variable);
    }
}
