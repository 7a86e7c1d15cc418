package org.logicpool.formula;

import lombok.Getter;
import org.logicpool.core.Variable;
import org.logicpool.expressions.TheoryAtom;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 公式的结构形状，用作公式池查找表的键。
 * 子公式按对象同一性比较：池中的子公式已经是唯一的代表，因此结构相等等价于同一性相等。
 * 此类是不可变的。
 */
@Getter
final class FormulaKey {

    private final FormulaType type;
    private final List<FormulaContent> subformulas;
    /** BOOL 节点包装的变量 */
    private final Variable variable;
    /** 理论原子节点的载荷 */
    private final TheoryAtom<?> atom;
    /** EXISTS/FORALL 的约束变量，按 ID 排序 */
    private final List<Variable> boundVariables;

    private final int hashCode;

    private FormulaKey(FormulaType type, List<FormulaContent> subformulas, Variable variable,
                       TheoryAtom<?> atom, List<Variable> boundVariables) {
        this.type = type;
        this.subformulas = subformulas;
        this.variable = variable;
        this.atom = atom;
        this.boundVariables = boundVariables;
        this.hashCode = Objects.hash(type, subformulas, variable, atom, boundVariables);
    }

    static FormulaKey ofConstant(FormulaType type) {
        return new FormulaKey(type, Collections.emptyList(), null, null, Collections.emptyList());
    }

    static FormulaKey ofVariable(Variable variable) {
        return new FormulaKey(FormulaType.BOOL, Collections.emptyList(), variable, null, Collections.emptyList());
    }

    static FormulaKey ofAtom(FormulaType type, TheoryAtom<?> atom) {
        return new FormulaKey(type, Collections.emptyList(), null, atom, Collections.emptyList());
    }

    /**
     * NOT、n 元连接词、IMPLIES 和 ITE 的形状。调用者负责操作数的规范顺序。
     */
    static FormulaKey ofOperands(FormulaType type, List<FormulaContent> operands) {
        return new FormulaKey(type, List.copyOf(operands), null, null, Collections.emptyList());
    }

    static FormulaKey ofQuantifier(FormulaType type, List<Variable> boundVariables, FormulaContent body) {
        return new FormulaKey(type, List.of(body), null, null, List.copyOf(boundVariables));
    }

    /**
     * 理论原子的取反形状，用于构造基公式的否定节点。
     */
    FormulaKey negatedAtom() {
        return ofAtom(type, atom.negation());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FormulaKey that = (FormulaKey) o;
        return type == that.type
                && subformulas.equals(that.subformulas)
                && Objects.equals(variable, that.variable)
                && Objects.equals(atom, that.atom)
                && boundVariables.equals(that.boundVariables);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
