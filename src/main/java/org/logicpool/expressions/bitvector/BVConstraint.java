package org.logicpool.expressions.bitvector;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.logicpool.expressions.Consistency;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 位向量约束 lhs ~ rhs。对称关系 (=, !=) 的操作数按全序排列。
 * 此类是不可变的。
 */
@Getter
public final class BVConstraint implements TheoryAtom<BVConstraint> {

    private static final Logger logger = LoggerFactory.getLogger(BVConstraint.class);

    private final BVTerm lhs;
    private final BVRelation relation;
    private final BVTerm rhs;

    private final int hashCode;

    private BVConstraint(BVTerm lhs, BVRelation relation, BVTerm rhs) {
        Objects.requireNonNull(lhs, "BVConstraint-构造函数: lhs 不能为 null");
        Objects.requireNonNull(relation, "BVConstraint-构造函数: relation 不能为 null");
        Objects.requireNonNull(rhs, "BVConstraint-构造函数: rhs 不能为 null");
        if (lhs.getWidth() != rhs.getWidth()) {
            logger.error("BVConstraint-构造函数: 位宽不一致 {} 与 {}", lhs.getWidth(), rhs.getWidth());
            throw new IllegalArgumentException("BVConstraint-构造函数: 位宽不一致: " + lhs + " 与 " + rhs);
        }
        if (relation.isSymmetric() && rhs.compareTo(lhs) < 0) {
            this.lhs = rhs;
            this.rhs = lhs;
        } else {
            this.lhs = lhs;
            this.rhs = rhs;
        }
        this.relation = relation;
        this.hashCode = Objects.hash(this.lhs, this.relation, this.rhs);
    }

    public static BVConstraint of(BVTerm lhs, BVRelation relation, BVTerm rhs) {
        return new BVConstraint(lhs, relation, rhs);
    }

    @Override
    public BVConstraint negation() {
        return new BVConstraint(lhs, relation.negate(), rhs);
    }

    @Override
    public Consistency isConsistent() {
        if (lhs.equals(rhs)) {
            return Consistency.of(relation.holds(0));
        }
        if (lhs.isConstant() && rhs.isConstant()) {
            return Consistency.of(relation.holds(lhs.getValue().compareTo(rhs.getValue())));
        }
        // 无符号比较：任何值都 >= 0，没有值 < 0
        if (rhs.isConstant() && rhs.getValue().signum() == 0) {
            if (relation == BVRelation.UGE) {
                return Consistency.ALWAYS_TRUE;
            }
            if (relation == BVRelation.ULT) {
                return Consistency.ALWAYS_FALSE;
            }
        }
        if (lhs.isConstant() && lhs.getValue().signum() == 0) {
            if (relation == BVRelation.ULE) {
                return Consistency.ALWAYS_TRUE;
            }
            if (relation == BVRelation.UGT) {
                return Consistency.ALWAYS_FALSE;
            }
        }
        BigInteger maxValue = BigInteger.ONE.shiftLeft(lhs.getWidth()).subtract(BigInteger.ONE);
        if (rhs.isConstant() && rhs.getValue().equals(maxValue)) {
            if (relation == BVRelation.ULE) {
                return Consistency.ALWAYS_TRUE;
            }
            if (relation == BVRelation.UGT) {
                return Consistency.ALWAYS_FALSE;
            }
        }
        return Consistency.UNDETERMINED;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        BitVecExpr z3Lhs = lhs.toZ3BitVecExpr(ctx, varManager);
        BitVecExpr z3Rhs = rhs.toZ3BitVecExpr(ctx, varManager);
        return switch (relation) {
            case EQ -> ctx.mkEq(z3Lhs, z3Rhs);
            case NEQ -> ctx.mkNot(ctx.mkEq(z3Lhs, z3Rhs));
            case ULT -> ctx.mkBVULT(z3Lhs, z3Rhs);
            case ULE -> ctx.mkBVULE(z3Lhs, z3Rhs);
            case UGT -> ctx.mkBVUGT(z3Lhs, z3Rhs);
            case UGE -> ctx.mkBVUGE(z3Lhs, z3Rhs);
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
        BVConstraint that = (BVConstraint) o;
        return relation == that.relation && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "(" + relation.getSymbol() + " " + lhs + " " + rhs + ")";
    }

    @Override
    public int compareTo(BVConstraint other) {
        int cmp = lhs.compareTo(other.lhs);
        if (cmp != 0) {
            return cmp;
        }
        cmp = rhs.compareTo(other.rhs);
        if (cmp != 0) {
            return cmp;
        }
        return relation.compareTo(other.relation);
    }
}
