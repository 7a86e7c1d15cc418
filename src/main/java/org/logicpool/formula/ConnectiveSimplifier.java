package org.logicpool.formula;

import org.logicpool.core.Variable;
import org.logicpool.core.VariableType;
import org.logicpool.expressions.TheoryAtom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 连接词的规范化：在发布节点之前做局部化简，使逻辑上等价的简单形状落到同一个节点上。
 * <p>
 * 只由 {@link FormulaPool} 在持锁的情况下调用。返回的节点尚未登记使用，调用者必须立即包装成句柄。
 */
final class ConnectiveSimplifier {

    private static final Logger logger = LoggerFactory.getLogger(ConnectiveSimplifier.class);

    private static final Comparator<FormulaContent> BY_ID = Comparator.comparingInt(FormulaContent::getId);

    private final FormulaPool pool;

    ConnectiveSimplifier(FormulaPool pool) {
        this.pool = pool;
    }

    FormulaContent booleanVariable(Variable variable) {
        if (variable.getType() != VariableType.BOOL) {
            logger.error("ConnectiveSimplifier: 变量 {} 的类型 {} 不是布尔类型", variable, variable.getType());
            throw new IllegalArgumentException("变量 " + variable + " 不是布尔变量，而是 " + variable.getType());
        }
        return pool.internBase(FormulaKey.ofVariable(variable));
    }

    /**
     * AND 与 OR 是对偶的：AND 的吸收元为 FALSE、单位元为 TRUE，OR 反之。
     */
    FormulaContent andOr(FormulaType type, List<FormulaContent> operands) {
        if (operands.isEmpty()) {
            logger.warn("ConnectiveSimplifier: 空的 {} 按约定返回 FALSE", type);
            return pool.falseContent();
        }
        FormulaContent absorbing = type == FormulaType.AND ? pool.falseContent() : pool.trueContent();
        FormulaContent neutral = absorbing.getNegation();

        SortedSet<FormulaContent> sorted = new TreeSet<>(BY_ID);
        for (FormulaContent operand : operands) {
            if (operand.getType() == type) {
                sorted.addAll(operand.getSubformulas());
            } else {
                sorted.add(operand);
            }
        }

        List<FormulaContent> kept = new ArrayList<>(sorted.size());
        FormulaContent previous = null;
        for (FormulaContent current : sorted) {
            if (current == absorbing) {
                return absorbing;
            }
            // x 与 not x 的 ID 相邻，排序后必然相邻
            if (previous != null && previous.getNegation() == current) {
                return absorbing;
            }
            previous = current;
            if (current != neutral) {
                kept.add(current);
            }
        }
        return internOrSingle(type, kept, neutral);
    }

    FormulaContent xor(List<FormulaContent> operands) {
        if (operands.isEmpty()) {
            logger.warn("ConnectiveSimplifier: 空的 XOR 按约定返回 FALSE");
            return pool.falseContent();
        }
        SortedMap<FormulaContent, Integer> occurrences = new TreeMap<>(BY_ID);
        for (FormulaContent operand : operands) {
            if (operand.getType() == FormulaType.XOR) {
                for (FormulaContent sub : operand.getSubformulas()) {
                    occurrences.merge(sub, 1, Integer::sum);
                }
            } else {
                occurrences.merge(operand, 1, Integer::sum);
            }
        }

        boolean negated = false;
        Deque<FormulaContent> kept = new ArrayDeque<>();
        for (Map.Entry<FormulaContent, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() % 2 == 0) {
                continue;
            }
            FormulaContent current = entry.getKey();
            if (current.isTrue()) {
                negated = !negated;
            } else if (current.isFalse()) {
                continue;
            } else if (!kept.isEmpty() && kept.peekLast().getNegation() == current) {
                // x xor not x = true
                kept.pollLast();
                negated = !negated;
            } else {
                kept.addLast(current);
            }
        }

        FormulaContent result = internOrSingle(FormulaType.XOR, new ArrayList<>(kept), pool.falseContent());
        return negated ? result.getNegation() : result;
    }

    /**
     * 多于两个操作数时解释为链式等价 x1 <-> x2 <-> ... <-> xn，
     * 它等于全部操作数的异或，在操作数个数为偶数时再取反。
     */
    FormulaContent iff(List<FormulaContent> operands) {
        if (operands.isEmpty()) {
            logger.warn("ConnectiveSimplifier: 空的 IFF 按约定返回 FALSE");
            return pool.falseContent();
        }
        if (operands.size() == 1) {
            return pool.trueContent();
        }
        if (operands.size() > 2) {
            FormulaContent chained = xor(operands);
            return operands.size() % 2 == 0 ? chained.getNegation() : chained;
        }

        FormulaContent first = operands.get(0);
        FormulaContent second = operands.get(1);
        if (first.getId() > second.getId()) {
            FormulaContent tmp = first;
            first = second;
            second = tmp;
        }
        if (first == second) {
            return pool.trueContent();
        }
        if (first.getNegation() == second) {
            return pool.falseContent();
        }
        // TRUE 与 FALSE 的 ID 最小，常量总是排在前面
        if (first.isTrue()) {
            return second;
        }
        if (first.isFalse()) {
            return second.getNegation();
        }
        return pool.internBase(FormulaKey.ofOperands(FormulaType.IFF, List.of(first, second)));
    }

    FormulaContent implies(List<FormulaContent> operands) {
        checkArity(FormulaType.IMPLIES, operands, 2);
        FormulaContent antecedent = operands.get(0);
        FormulaContent consequent = operands.get(1);
        if (antecedent.isFalse() || consequent.isTrue()) {
            return pool.trueContent();
        }
        if (antecedent.isTrue()) {
            return consequent;
        }
        if (consequent.isFalse()) {
            return antecedent.getNegation();
        }
        if (antecedent == consequent) {
            return pool.trueContent();
        }
        if (antecedent.getNegation() == consequent) {
            return consequent;
        }
        return pool.internBase(FormulaKey.ofOperands(FormulaType.IMPLIES, operands));
    }

    FormulaContent ite(List<FormulaContent> operands) {
        checkArity(FormulaType.ITE, operands, 3);
        FormulaContent condition = operands.get(0);
        FormulaContent thenBranch = operands.get(1);
        FormulaContent elseBranch = operands.get(2);
        if (condition.isTrue()) {
            return thenBranch;
        }
        if (condition.isFalse()) {
            return elseBranch;
        }
        if (thenBranch == elseBranch) {
            return thenBranch;
        }
        if (thenBranch.isTrue() && elseBranch.isFalse()) {
            return condition;
        }
        if (thenBranch.isFalse() && elseBranch.isTrue()) {
            return condition.getNegation();
        }
        // 条件总是取基极性，NOT 节点和原子的非基极性一样处理
        if (!condition.isBase()) {
            condition = condition.getNegation();
            FormulaContent tmp = thenBranch;
            thenBranch = elseBranch;
            elseBranch = tmp;
        }
        return pool.internBase(FormulaKey.ofOperands(FormulaType.ITE, List.of(condition, thenBranch, elseBranch)));
    }

    FormulaContent quantifier(FormulaType type, Collection<Variable> variables, FormulaContent body) {
        if (type == null || !type.isQuantifier()) {
            logger.error("ConnectiveSimplifier: {} 不是量词类型", type);
            throw new IllegalArgumentException("ConnectiveSimplifier: " + type + " 不是量词类型");
        }
        if (variables.isEmpty() || body.getType().isConstant()) {
            return body;
        }
        SortedSet<Variable> bound = new TreeSet<>();
        for (Variable variable : variables) {
            bound.add(Objects.requireNonNull(variable, "ConnectiveSimplifier.quantifier: 约束变量不能为 null"));
        }
        return pool.internBase(FormulaKey.ofQuantifier(type, new ArrayList<>(bound), body));
    }

    <T extends TheoryAtom<T>> FormulaContent atom(FormulaType type, T atom) {
        if (pool.getConfig().isSimplify()) {
            switch (atom.isConsistent()) {
                case ALWAYS_TRUE -> {
                    logger.debug("原子 {} 恒真，折叠为 TRUE", atom);
                    return pool.trueContent();
                }
                case ALWAYS_FALSE -> {
                    logger.debug("原子 {} 恒假，折叠为 FALSE", atom);
                    return pool.falseContent();
                }
                default -> {
                }
            }
        }
        return pool.internAtom(type, atom);
    }

    FormulaContent exclusiveDisjunction(List<FormulaContent> multiset) {
        if (multiset.isEmpty()) {
            return pool.falseContent();
        }
        if (multiset.size() == 1) {
            return multiset.get(0);
        }
        return xor(multiset);
    }

    FormulaContent unary(FormulaType type, FormulaContent operand) {
        return switch (type) {
            case NOT -> operand.getNegation();
            case AND, OR, XOR -> operand;
            case IFF -> pool.trueContent();
            default -> {
                logger.error("ConnectiveSimplifier: 不能用单个子公式构造 {}", type);
                throw new IllegalArgumentException("ConnectiveSimplifier: 不能用单个子公式构造 " + type);
            }
        };
    }

    FormulaContent create(FormulaType type, List<FormulaContent> operands) {
        return switch (type) {
            case ITE -> ite(operands);
            case IMPLIES -> implies(operands);
            case AND, OR -> andOr(type, operands);
            case XOR -> xor(operands);
            case IFF -> iff(operands);
            default -> {
                logger.error("ConnectiveSimplifier: 不能用子公式列表构造 {}", type);
                throw new IllegalArgumentException("ConnectiveSimplifier: 不能用子公式列表构造 " + type);
            }
        };
    }

    private FormulaContent internOrSingle(FormulaType type, List<FormulaContent> kept, FormulaContent whenEmpty) {
        if (kept.isEmpty()) {
            return whenEmpty;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return pool.internBase(FormulaKey.ofOperands(type, kept));
    }

    private static void checkArity(FormulaType type, List<FormulaContent> operands, int arity) {
        if (operands.size() != arity) {
            logger.error("ConnectiveSimplifier: {} 需要 {} 个子公式，实际为 {}", type, arity, operands.size());
            throw new IllegalArgumentException("ConnectiveSimplifier: " + type + " 需要 " + arity
                    + " 个子公式，实际为 " + operands.size());
        }
    }
}
