package org.logicpool.expressions.pseudobool;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.RelationType;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 伪布尔约束 c1*b1 + ... + cn*bn ~ k，其中 bi 是布尔变量，ci 和 k 是整数。
 * 同一变量的系数合并，系数为零的项被丢弃。
 * 此类是不可变的。
 */
@Getter
public final class PBConstraint implements TheoryAtom<PBConstraint> {

    private static final Logger logger = LoggerFactory.getLogger(PBConstraint.class);

    private final SortedMap<Variable, Integer> terms;
    private final RelationType relation;
    private final int rhs;

    private final int hashCode;

    private PBConstraint(Map<Variable, Integer> terms, RelationType relation, int rhs) {
        Objects.requireNonNull(terms, "PBConstraint-构造函数: terms 不能为 null");
        this.relation = Objects.requireNonNull(relation, "PBConstraint-构造函数: relation 不能为 null");
        SortedMap<Variable, Integer> normalized = new TreeMap<>();
        terms.forEach((variable, coeff) -> {
            if (variable.getType() != VariableType.BOOL) {
                logger.error("PBConstraint-构造函数: 变量 {} 不是布尔类型", variable);
                throw new IllegalArgumentException("PBConstraint-构造函数: 变量 " + variable + " 不是布尔类型");
            }
            if (coeff != 0) {
                normalized.put(variable, coeff);
            }
        });
        this.terms = Collections.unmodifiableSortedMap(normalized);
        this.rhs = rhs;
        this.hashCode = Objects.hash(this.terms, relation, rhs);
    }

    public static PBConstraint of(Map<Variable, Integer> terms, RelationType relation, int rhs) {
        return new PBConstraint(terms, relation, rhs);
    }

    @Override
    public PBConstraint negation() {
        return new PBConstraint(terms, relation.negate(), rhs);
    }

    /**
     * 比较左侧可能取到的最小值和最大值与右侧常数。
     */
    @Override
    public Consistency isConsistent() {
        long min = 0;
        long max = 0;
        for (int coeff : terms.values()) {
            if (coeff < 0) {
                min += coeff;
            } else {
                max += coeff;
            }
        }
        boolean holdsAtMin = relation.holds(Long.signum(min - rhs));
        boolean holdsAtMax = relation.holds(Long.signum(max - rhs));
        if (min == max) {
            return Consistency.of(holdsAtMin);
        }
        return switch (relation) {
            case LT, LE, GT, GE -> holdsAtMin == holdsAtMax ? Consistency.of(holdsAtMin) : Consistency.UNDETERMINED;
            // 区间之外的 k 永远取不到
            case EQ -> (rhs < min || rhs > max) ? Consistency.ALWAYS_FALSE : Consistency.UNDETERMINED;
            case NEQ -> (rhs < min || rhs > max) ? Consistency.ALWAYS_TRUE : Consistency.UNDETERMINED;
        };
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr sum = ctx.mkInt(0);
        for (Map.Entry<Variable, Integer> entry : terms.entrySet()) {
            BoolExpr bool = varManager.getBoolVar(entry.getKey());
            ArithExpr term = (ArithExpr) ctx.mkITE(bool, ctx.mkInt(entry.getValue()), ctx.mkInt(0));
            sum = ctx.mkAdd(sum, term);
        }
        ArithExpr bound = ctx.mkInt(rhs);
        return switch (relation) {
            case LT -> ctx.mkLt(sum, bound);
            case LE -> ctx.mkLe(sum, bound);
            case GT -> ctx.mkGt(sum, bound);
            case GE -> ctx.mkGe(sum, bound);
            case EQ -> ctx.mkEq(sum, bound);
            case NEQ -> ctx.mkNot(ctx.mkEq(sum, bound));
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
        PBConstraint that = (PBConstraint) o;
        return rhs == that.rhs && relation == that.relation && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String lhs = terms.isEmpty() ? "0" : terms.entrySet().stream()
                .map(entry -> entry.getValue() + "*" + entry.getKey().getName())
                .collect(Collectors.joining(" + "));
        return lhs + " " + relation.getSymbol() + " " + rhs;
    }

    @Override
    public int compareTo(PBConstraint other) {
        Iterator<Map.Entry<Variable, Integer>> thisIt = this.terms.entrySet().iterator();
        Iterator<Map.Entry<Variable, Integer>> otherIt = other.terms.entrySet().iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            Map.Entry<Variable, Integer> a = thisIt.next();
            Map.Entry<Variable, Integer> b = otherIt.next();
            int cmp = a.getKey().compareTo(b.getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = Integer.compare(a.getValue(), b.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        int cmp = Integer.compare(this.terms.size(), other.terms.size());
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(rhs, other.rhs);
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
