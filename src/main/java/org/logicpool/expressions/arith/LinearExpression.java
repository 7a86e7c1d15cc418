package org.logicpool.expressions.arith;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.expressions.ToZ3ArithExpr;
import org.logicpool.symbolic.Z3VariableManager;
import org.logicpool.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个算术变量上的线性表达式，形式为 c1*x1 + c2*x2 + ... + const。
 * 此类是不可变的。
 */
@Getter
public final class LinearExpression implements Comparable<LinearExpression>, ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    public static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), Rational.ZERO);

    private final SortedMap<Variable, Rational> coefficients;

    private final Rational constant;

    private final int hashCode;

    /**
     * 私有构造函数。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     */
    private LinearExpression(Map<Variable, Rational> coefficients, Rational constant) {
        // 过滤掉系数为零的变量，并确保有序性
        SortedMap<Variable, Rational> tempCoefficients = new TreeMap<>();
        for (Map.Entry<Variable, Rational> entry : Objects.requireNonNull(coefficients, "Coefficients map cannot be null").entrySet()) {
            Variable variable = Objects.requireNonNull(entry.getKey(), "Variable in coefficients map cannot be null");
            Rational coeff = Objects.requireNonNull(entry.getValue(), "Coefficient cannot be null");
            if (!variable.getType().isArithmetic()) {
                logger.error("LinearExpression-构造函数: 变量 {} 的类型 {} 不是算术类型", variable, variable.getType());
                throw new IllegalArgumentException("LinearExpression-构造函数: 变量 " + variable + " 不是算术类型");
            }
            if (!coeff.isZero()) {
                tempCoefficients.put(variable, coeff);
            }
        }
        this.coefficients = Collections.unmodifiableSortedMap(tempCoefficients);
        this.constant = Objects.requireNonNull(constant, "Constant term cannot be null");
        this.hashCode = Objects.hash(this.coefficients, this.constant);
        logger.debug("创建 LinearExpression: {}，常数项为{}", this.coefficients, this.constant);
    }

    public static LinearExpression of(Map<Variable, Rational> coefficients, Rational constant) {
        return new LinearExpression(coefficients, constant);
    }

    public static LinearExpression of(Rational constant) {
        return new LinearExpression(Collections.emptyMap(), constant);
    }

    public static LinearExpression of(long constant) {
        return of(Rational.valueOf(constant));
    }

    public static LinearExpression of(Variable variable) {
        return new LinearExpression(Map.of(variable, Rational.ONE), Rational.ZERO);
    }

    public static LinearExpression of(Variable variable, Rational coefficient) {
        return new LinearExpression(Map.of(variable, coefficient), Rational.ZERO);
    }

    public LinearExpression add(LinearExpression other) {
        Map<Variable, Rational> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value, Rational::add));
        return new LinearExpression(newCoefficients, this.constant.add(other.constant));
    }

    public LinearExpression subtract(LinearExpression other) {
        Map<Variable, Rational> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value.negate(), Rational::add));
        return new LinearExpression(newCoefficients, this.constant.subtract(other.constant));
    }

    public LinearExpression negate() {
        Map<Variable, Rational> negatedCoefficients = this.coefficients.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().negate()));
        return new LinearExpression(negatedCoefficients, this.constant.negate());
    }

    public LinearExpression multiply(Rational factor) {
        Map<Variable, Rational> scaled = this.coefficients.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().multiply(factor)));
        return new LinearExpression(scaled, this.constant.multiply(factor));
    }

    /**
     * @return 是否不含任何变量。
     */
    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;
        for (Map.Entry<Variable, Rational> entry : coefficients.entrySet()) {
            if (!firstTerm) {
                sb.append(" + ");
            }
            Rational coeff = entry.getValue();
            if (!coeff.equals(Rational.ONE)) {
                sb.append(coeff).append("*");
            }
            sb.append(entry.getKey().getName());
            firstTerm = false;
        }
        if (!constant.isZero()) {
            if (!firstTerm) {
                sb.append(" + ");
            }
            sb.append(constant);
        } else if (firstTerm) {
            return "0";
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return coefficients.equals(that.coefficients) && constant.equals(that.constant);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public ArithExpr toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr result = constant.toZ3Real(ctx);
        for (Map.Entry<Variable, Rational> entry : coefficients.entrySet()) {
            ArithExpr variableExpr = varManager.getArithVar(entry.getKey());
            ArithExpr z3Coeff = entry.getValue().toZ3Real(ctx);
            result = ctx.mkAdd(result, ctx.mkMul(z3Coeff, variableExpr));
        }
        return result;
    }

    @Override
    public int compareTo(LinearExpression other) {
        // 1. 比较常数项
        int cmp = this.constant.compareTo(other.constant);
        if (cmp != 0) {
            return cmp;
        }
        // 2. 按变量 ID 顺序比较系数
        Set<Variable> allVariables = new TreeSet<>(this.coefficients.keySet());
        allVariables.addAll(other.coefficients.keySet());
        for (Variable variable : allVariables) {
            Rational thisCoeff = this.coefficients.getOrDefault(variable, Rational.ZERO);
            Rational otherCoeff = other.coefficients.getOrDefault(variable, Rational.ZERO);
            cmp = thisCoeff.compareTo(otherCoeff);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
