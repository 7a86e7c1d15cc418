package org.logicpool.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import com.microsoft.z3.UninterpretedSort;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理 Java Variable 对象到 Z3 常量的映射。
 * 确保每个 Java 变量在 Z3 Context 中有唯一的对应 Z3 变量。
 * 一个实例只绑定一个 Context，不是线程安全的。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，因为这个实例只在一个线程中和一个 Context 一起使用
    private final Map<Variable, Expr<?>> z3Vars;
    private final Map<Pair<String, Integer>, FuncDecl<UninterpretedSort>> uninterpretedFunctions;

    private final UninterpretedSort uninterpretedSort;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Vars = new HashMap<>();
        this.uninterpretedFunctions = new HashMap<>();
        this.uninterpretedSort = ctx.mkUninterpretedSort(VariableType.UNINTERPRETED.getSortName());
        logger.debug("Z3VariableManager 初始化完成");
    }

    /**
     * 获取布尔变量对应的 Z3 常量。
     */
    public BoolExpr getBoolVar(Variable variable) {
        checkType(variable, VariableType.BOOL);
        return (BoolExpr) z3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 布尔变量: {}", v.getName());
            return ctx.mkBoolConst(v.getName());
        });
    }

    /**
     * 获取算术变量对应的 Z3 常量。REAL 变量映射为 Real，INT 变量映射为 Int。
     */
    public ArithExpr getArithVar(Variable variable) {
        Objects.requireNonNull(variable, "variable cannot be null");
        if (!variable.getType().isArithmetic()) {
            logger.error("Z3VariableManager: 变量 {} 的类型 {} 不是算术类型", variable, variable.getType());
            throw new IllegalArgumentException("Z3VariableManager: 变量 " + variable + " 不是算术类型");
        }
        return (ArithExpr) z3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 算术变量: {}", v.getName());
            return v.getType() == VariableType.INT ? ctx.mkIntConst(v.getName()) : ctx.mkRealConst(v.getName());
        });
    }

    /**
     * 获取位向量变量对应的 Z3 常量。同一变量必须始终以同一位宽使用。
     */
    public BitVecExpr getBitVecVar(Variable variable, int width) {
        checkType(variable, VariableType.BITVECTOR);
        BitVecExpr expr = (BitVecExpr) z3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 位向量变量: {}[{}]", v.getName(), width);
            return ctx.mkBVConst(v.getName(), width);
        });
        if (expr.getSortSize() != width) {
            logger.error("Z3VariableManager: 位向量变量 {} 已以位宽 {} 创建，不能以 {} 使用", variable, expr.getSortSize(), width);
            throw new IllegalArgumentException("Z3VariableManager: 位向量变量 " + variable + " 的位宽不一致");
        }
        return expr;
    }

    @SuppressWarnings("unchecked")
    public Expr<UninterpretedSort> getUninterpretedVar(Variable variable) {
        checkType(variable, VariableType.UNINTERPRETED);
        return (Expr<UninterpretedSort>) z3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 未解释变量: {}", v.getName());
            return ctx.mkConst(v.getName(), uninterpretedSort);
        });
    }

    /**
     * 获取 U^arity -> U 的未解释函数声明。
     */
    public FuncDecl<UninterpretedSort> getUninterpretedFunction(String name, int arity) {
        return uninterpretedFunctions.computeIfAbsent(Pair.of(name, arity), key -> {
            Sort[] domain = new Sort[arity];
            Arrays.fill(domain, uninterpretedSort);
            logger.debug("创建 Z3 未解释函数: {}/{}", name, arity);
            return ctx.mkFuncDecl(name, domain, uninterpretedSort);
        });
    }

    /**
     * 按变量类型获取对应的 Z3 常量，用于量词的约束变量。
     */
    public Expr<?> getZ3Var(Variable variable) {
        return switch (variable.getType()) {
            case BOOL -> getBoolVar(variable);
            case REAL, INT -> getArithVar(variable);
            case UNINTERPRETED -> getUninterpretedVar(variable);
            case BITVECTOR -> {
                Expr<?> existing = z3Vars.get(variable);
                if (existing == null) {
                    logger.error("Z3VariableManager: 位向量变量 {} 的位宽未知", variable);
                    throw new IllegalStateException("Z3VariableManager: 位向量变量 " + variable + " 尚未以确定的位宽使用");
                }
                yield existing;
            }
        };
    }

    private void checkType(Variable variable, VariableType expected) {
        Objects.requireNonNull(variable, "variable cannot be null");
        if (variable.getType() != expected) {
            logger.error("Z3VariableManager: 变量 {} 的类型为 {}，期望 {}", variable, variable.getType(), expected);
            throw new IllegalArgumentException("Z3VariableManager: 变量 " + variable + " 的类型不是 " + expected);
        }
    }
}
