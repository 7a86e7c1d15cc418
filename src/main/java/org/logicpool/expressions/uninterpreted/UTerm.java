package org.logicpool.expressions.uninterpreted;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.symbolic.Z3VariableManager;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 未解释理论中的项：未解释变量，或未解释函数作用在未解释变量上的实例 f(x1, ..., xn)。
 * 此类是不可变的。
 */
@Getter
public final class UTerm implements Comparable<UTerm> {

    private final Variable variable;
    private final String function;
    private final List<Variable> arguments;

    private final int hashCode;

    private UTerm(Variable variable, String function, List<Variable> arguments) {
        this.variable = variable;
        this.function = function;
        this.arguments = arguments;
        this.hashCode = Objects.hash(variable, function, arguments);
    }

    public static UTerm variable(Variable variable) {
        Objects.requireNonNull(variable, "UTerm-工厂方法: variable 不能为 null");
        checkUninterpreted(variable);
        return new UTerm(variable, null, Collections.emptyList());
    }

    public static UTerm apply(String function, List<Variable> arguments) {
        Objects.requireNonNull(function, "UTerm-工厂方法: function 不能为 null");
        Objects.requireNonNull(arguments, "UTerm-工厂方法: arguments 不能为 null");
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("UTerm-工厂方法: 函数实例 " + function + " 至少需要一个参数");
        }
        arguments.forEach(UTerm::checkUninterpreted);
        return new UTerm(null, function, List.copyOf(arguments));
    }

    private static void checkUninterpreted(Variable variable) {
        if (variable.getType() != VariableType.UNINTERPRETED) {
            throw new IllegalArgumentException("UTerm: 变量 " + variable + " 不是未解释类型");
        }
    }

    public boolean isVariable() {
        return variable != null;
    }

    public Expr<?> toZ3Expr(Context ctx, Z3VariableManager varManager) {
        if (isVariable()) {
            return varManager.getUninterpretedVar(variable);
        }
        FuncDecl<?> decl = varManager.getUninterpretedFunction(function, arguments.size());
        Expr<?>[] args = arguments.stream()
                .map(varManager::getUninterpretedVar)
                .toArray(Expr<?>[]::new);
        return ctx.mkApp(decl, args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UTerm that = (UTerm) o;
        return Objects.equals(variable, that.variable)
                && Objects.equals(function, that.function)
                && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (isVariable()) {
            return variable.getName();
        }
        return function + "(" + arguments.stream().map(Variable::getName).collect(Collectors.joining(", ")) + ")";
    }

    /**
     * 变量排在函数实例之前。
     */
    @Override
    public int compareTo(UTerm other) {
        if (isVariable() != other.isVariable()) {
            return isVariable() ? -1 : 1;
        }
        if (isVariable()) {
            return variable.compareTo(other.variable);
        }
        int cmp = function.compareTo(other.function);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(arguments.size(), other.arguments.size());
        for (int i = 0; cmp == 0 && i < arguments.size(); i++) {
            cmp = arguments.get(i).compareTo(other.arguments.get(i));
        }
        return cmp;
    }
}
