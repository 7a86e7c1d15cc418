package org.logicpool.formula;

import org.apache.commons.lang3.mutable.MutableInt;
import org.logicpool.core.Variable;
import org.logicpool.expressions.TheoryAtom;
import org.logicpool.expressions.arith.ArithConstraint;
import org.logicpool.expressions.arith.VariableAssignment;
import org.logicpool.expressions.arith.VariableComparison;
import org.logicpool.expressions.bitvector.BVConstraint;
import org.logicpool.expressions.pseudobool.PBConstraint;
import org.logicpool.expressions.uninterpreted.UEquality;
import org.logicpool.expressions.uninterpreted.UTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 公式池：保证每个结构形状只有一个节点（hash-consing），并管理节点的生命周期。
 * <p>
 * 每次发布新节点时同时构造它的否定，两者获得相邻的 ID k 和 k+1，其中只有基公式存放在查找表中。
 * 节点的使用次数记录在按基公式 ID 索引的旁表中：外部句柄和父节点各算一次使用。
 * 使用次数降为 0 且不被 Tseitin 映射占用时，先从查找表删除，再释放它钉住的子公式。
 * <p>
 * 线程安全模式下，所有操作（包括整个构造过程）都在一把可重入锁内执行；
 * 单线程模式下锁为空操作，由调用者保证不会并发访问。
 * 池由调用者显式创建和持有，不存在全局单例。
 */
public final class FormulaPool {

    private static final Logger logger = LoggerFactory.getLogger(FormulaPool.class);

    private final PoolConfig config;
    private final Lock lock;
    private final ConnectiveSimplifier simplifier;

    /** ID 分配器，TRUE 为 1，FALSE 为 2 */
    private int idAllocator = 1;

    private final FormulaContent trueContent;
    private final FormulaContent falseContent;

    /** 查找表：形状 -> 基公式 */
    private final Map<FormulaKey, FormulaContent> table;
    /** 基公式 ID -> 使用次数 */
    private final Map<Integer, MutableInt> usages;

    /** 公式 -> Tseitin 占位变量公式 */
    private final Map<FormulaContent, FormulaContent> tseitinVars;
    /** Tseitin 占位变量公式 -> 公式 */
    private final Map<FormulaContent, FormulaContent> tseitinVarToFormula;

    /**
     * 使用 {@link PoolConfig#load()} 的配置创建公式池。
     */
    public FormulaPool() {
        this(PoolConfig.load());
    }

    public FormulaPool(PoolConfig config) {
        this.config = Objects.requireNonNull(config, "FormulaPool-构造函数: config 不能为 null");
        this.lock = config.isThreadSafe() ? new ReentrantLock() : new NoOpLock();
        this.table = new HashMap<>(config.getInitialCapacity());
        this.usages = new HashMap<>(config.getInitialCapacity());
        this.tseitinVars = new LinkedHashMap<>();
        this.tseitinVarToFormula = new HashMap<>();

        this.trueContent = new FormulaContent(idAllocator++, FormulaKey.ofConstant(FormulaType.TRUE), true, 0.0);
        this.falseContent = new FormulaContent(idAllocator++, FormulaKey.ofConstant(FormulaType.FALSE), false, 0.0);
        trueContent.linkNegation(falseContent);
        falseContent.linkNegation(trueContent);
        table.put(trueContent.getKey(), trueContent);

        this.simplifier = new ConnectiveSimplifier(this);
        logger.info("创建 FormulaPool: {}", config);
    }

    public PoolConfig getConfig() {
        return config;
    }

    // ========== 常量 ==========

    public Formula trueFormula() {
        return new Formula(this, trueContent);
    }

    public Formula falseFormula() {
        return new Formula(this, falseContent);
    }

    FormulaContent trueContent() {
        return trueContent;
    }

    FormulaContent falseContent() {
        return falseContent;
    }

    // ========== 构造入口 ==========

    /**
     * 包装一个布尔变量。
     */
    public Formula newBoolean(Variable variable) {
        Objects.requireNonNull(variable, "FormulaPool.newBoolean: variable 不能为 null");
        return construct(() -> simplifier.booleanVariable(variable));
    }

    public Formula newNot(Formula formula) {
        FormulaContent operand = contentOf(formula);
        return construct(() -> operand.getNegation());
    }

    public Formula newAnd(Formula... operands) {
        return newAnd(Arrays.asList(operands));
    }

    public Formula newAnd(Collection<Formula> operands) {
        List<FormulaContent> contents = contentsOf(operands);
        return construct(() -> simplifier.andOr(FormulaType.AND, contents));
    }

    public Formula newOr(Formula... operands) {
        return newOr(Arrays.asList(operands));
    }

    public Formula newOr(Collection<Formula> operands) {
        List<FormulaContent> contents = contentsOf(operands);
        return construct(() -> simplifier.andOr(FormulaType.OR, contents));
    }

    public Formula newXor(Formula... operands) {
        return newXor(Arrays.asList(operands));
    }

    public Formula newXor(Collection<Formula> operands) {
        List<FormulaContent> contents = contentsOf(operands);
        return construct(() -> simplifier.xor(contents));
    }

    public Formula newIff(Formula... operands) {
        return newIff(Arrays.asList(operands));
    }

    /**
     * 两个操作数时构造二元等价节点；多于两个时按链式等价 x1 <-> x2 <-> ... <-> xn 化为异或。
     */
    public Formula newIff(Collection<Formula> operands) {
        List<FormulaContent> contents = contentsOf(operands);
        return construct(() -> simplifier.iff(contents));
    }

    public Formula newImplies(Formula antecedent, Formula consequent) {
        List<FormulaContent> contents = contentsOf(Arrays.asList(antecedent, consequent));
        return construct(() -> simplifier.implies(contents));
    }

    public Formula newIte(Formula condition, Formula thenFormula, Formula elseFormula) {
        List<FormulaContent> contents = contentsOf(Arrays.asList(condition, thenFormula, elseFormula));
        return construct(() -> simplifier.ite(contents));
    }

    public Formula newExists(Collection<Variable> variables, Formula body) {
        return newQuantifier(FormulaType.EXISTS, variables, body);
    }

    public Formula newForall(Collection<Variable> variables, Formula body) {
        return newQuantifier(FormulaType.FORALL, variables, body);
    }

    public Formula newQuantifier(FormulaType type, Collection<Variable> variables, Formula body) {
        Objects.requireNonNull(variables, "FormulaPool.newQuantifier: variables 不能为 null");
        FormulaContent bodyContent = contentOf(body);
        return construct(() -> simplifier.quantifier(type, variables, bodyContent));
    }

    public Formula newConstraint(ArithConstraint constraint) {
        return newAtom(FormulaType.CONSTRAINT, constraint);
    }

    public Formula newVariableComparison(VariableComparison comparison) {
        return newAtom(FormulaType.VARCOMPARE, comparison);
    }

    public Formula newVariableAssignment(VariableAssignment assignment) {
        return newAtom(FormulaType.VARASSIGN, assignment);
    }

    public Formula newBitVector(BVConstraint constraint) {
        return newAtom(FormulaType.BITVECTOR, constraint);
    }

    public Formula newUEquality(UTerm lhs, UTerm rhs, boolean negated) {
        return newUEquality(UEquality.of(lhs, rhs, negated));
    }

    public Formula newUEquality(UEquality equality) {
        return newAtom(FormulaType.UEQ, equality);
    }

    public Formula newPseudoBoolean(PBConstraint constraint) {
        return newAtom(FormulaType.PBCONSTRAINT, constraint);
    }

    private <T extends TheoryAtom<T>> Formula newAtom(FormulaType type, T atom) {
        Objects.requireNonNull(atom, "FormulaPool: " + type + " 原子不能为 null");
        return construct(() -> simplifier.atom(type, atom));
    }

    /**
     * 把一个多重集合化为异或：成对出现的元素相互抵消，剩下出现奇数次的元素。
     * 空集合为 FALSE，单个元素为其本身。
     */
    public Formula newExclusiveDisjunction(Collection<Formula> multiset) {
        List<FormulaContent> contents = contentsOf(multiset);
        return construct(() -> simplifier.exclusiveDisjunction(contents));
    }

    /**
     * 一元形式：NOT 取否定，AND/OR/XOR 返回操作数本身，IFF 为 TRUE。
     */
    public Formula create(FormulaType type, Formula operand) {
        Objects.requireNonNull(type, "FormulaPool.create: type 不能为 null");
        FormulaContent content = contentOf(operand);
        return construct(() -> simplifier.unary(type, content));
    }

    /**
     * 按连接词分派到 ITE、IMPLIES 或 n 元构造。其他类型不能由子公式列表构造。
     */
    public Formula create(FormulaType type, Collection<Formula> operands) {
        Objects.requireNonNull(type, "FormulaPool.create: type 不能为 null");
        List<FormulaContent> contents = contentsOf(operands);
        return construct(() -> simplifier.create(type, contents));
    }

    private Formula construct(Supplier<FormulaContent> builder) {
        lock.lock();
        try {
            return new Formula(this, builder.get());
        } finally {
            lock.unlock();
        }
    }

    private FormulaContent contentOf(Formula formula) {
        Objects.requireNonNull(formula, "FormulaPool: formula 不能为 null");
        if (formula.getPool() != this) {
            logger.error("FormulaPool: 公式 {} 属于另一个公式池", formula);
            throw new IllegalArgumentException("FormulaPool: 公式 " + formula + " 属于另一个公式池");
        }
        formula.checkNotReleased();
        return formula.getContent();
    }

    private List<FormulaContent> contentsOf(Collection<Formula> formulas) {
        Objects.requireNonNull(formulas, "FormulaPool: operands 不能为 null");
        List<FormulaContent> contents = new ArrayList<>(formulas.size());
        for (Formula formula : formulas) {
            contents.add(contentOf(formula));
        }
        return contents;
    }

    // ========== 查找表 ==========

    FormulaContent internBase(FormulaKey key) {
        return intern(key, FormulaContent.difficultyOf(key));
    }

    /**
     * 把理论原子规范到基极性后插入：原子和它的否定中较小的一个存放在查找表中。
     * @return 请求的极性对应的节点。
     */
    <T extends TheoryAtom<T>> FormulaContent internAtom(FormulaType type, T atom) {
        T negated = atom.negation();
        int cmp = atom.compareTo(negated);
        if (cmp == 0) {
            logger.error("FormulaPool: 原子 {} 与其否定 {} 相等", atom, negated);
            throw new IllegalStateException("FormulaPool: 原子 " + atom + " 与其否定在全序中相等");
        }
        if (cmp < 0) {
            return internBase(FormulaKey.ofAtom(type, atom));
        }
        return internBase(FormulaKey.ofAtom(type, negated)).getNegation();
    }

    private FormulaContent intern(FormulaKey key, double difficulty) {
        lock.lock();
        try {
            FormulaContent existing = table.get(key);
            if (existing != null) {
                logger.trace("命中公式 {}: {}", existing.getId(), existing);
                return existing;
            }
            if (idAllocator > Integer.MAX_VALUE - 2) {
                logger.error("FormulaPool: ID 已耗尽");
                throw new IllegalStateException("FormulaPool: ID 已耗尽");
            }
            FormulaContent base = new FormulaContent(idAllocator++, key, true, difficulty);
            FormulaContent negation = createNegatedContent(base);
            base.linkNegation(negation);
            negation.linkNegation(base);
            // 父节点钉住子公式
            for (FormulaContent child : key.getSubformulas()) {
                registerUse(child);
            }
            usages.put(base.getId(), new MutableInt(0));
            table.put(key, base);
            logger.debug("发布公式 {}: {}，否定为 {}", base.getId(), base, negation.getId());
            return base;
        } finally {
            lock.unlock();
        }
    }

    private FormulaContent createNegatedContent(FormulaContent base) {
        FormulaKey negatedKey = base.getType().isTheoryAtom()
                ? base.getKey().negatedAtom()
                : FormulaKey.ofOperands(FormulaType.NOT, List.of(base));
        return new FormulaContent(idAllocator++, negatedKey, false, base.getDifficulty());
    }

    // ========== 生命周期 ==========

    private FormulaContent baseOf(FormulaContent content) {
        return content.isBase() ? content : content.getNegation();
    }

    void registerUse(FormulaContent content) {
        if (content.getType().isConstant()) {
            return;
        }
        lock.lock();
        try {
            FormulaContent base = baseOf(content);
            MutableInt count = usages.get(base.getId());
            if (count == null) {
                logger.error("FormulaPool: 公式 {} 未发布或已删除，不能登记使用", base.getId());
                throw new IllegalStateException("FormulaPool: 公式 " + base.getId() + " 未发布或已删除");
            }
            count.increment();
            logger.trace("登记公式 {}，当前使用次数 {}", base.getId(), count);
        } finally {
            lock.unlock();
        }
    }

    void release(FormulaContent content) {
        if (content.getType().isConstant()) {
            return;
        }
        lock.lock();
        try {
            FormulaContent base = baseOf(content);
            MutableInt count = usages.get(base.getId());
            if (count == null || count.intValue() <= 0) {
                logger.error("FormulaPool: 释放未被使用的公式 {}", base.getId());
                throw new IllegalStateException("FormulaPool: 公式 " + base.getId() + " 没有可释放的使用");
            }
            count.decrement();
            logger.trace("释放公式 {}，当前使用次数 {}", base.getId(), count);
            if (count.intValue() == 0) {
                collect(base);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean isInUse(FormulaContent base) {
        if (base.getType().isConstant()) {
            return true;
        }
        MutableInt count = usages.get(base.getId());
        return count != null && count.intValue() > 0;
    }

    /**
     * 删除不再使用的基公式及其否定，并级联释放它们钉住的子公式。
     * 用工作队列代替递归，深层公式不会耗尽栈。
     */
    private void collect(FormulaContent start) {
        Deque<FormulaContent> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            FormulaContent base = pending.pop();
            MutableInt count = usages.get(base.getId());
            if (count == null || count.intValue() > 0) {
                continue;
            }
            boolean stillStoredAsTseitinVariable = freeTseitinVariable(base, pending);
            if (freeTseitinVariable(base.getNegation(), pending)) {
                stillStoredAsTseitinVariable = true;
            }
            if (stillStoredAsTseitinVariable) {
                logger.debug("公式 {} 不再被使用，但仍被 Tseitin 映射占用", base.getId());
                continue;
            }
            delete(base, pending);
        }
    }

    /**
     * @return 该公式是否仍因 Tseitin 映射而必须保留。
     */
    private boolean freeTseitinVariable(FormulaContent formula, Deque<FormulaContent> pending) {
        boolean stillStoredAsTseitinVariable = false;
        // 该公式有 Tseitin 变量
        FormulaContent placeholder = tseitinVars.get(formula);
        if (placeholder != null) {
            FormulaContent placeholderBase = baseOf(placeholder);
            if (isInUse(placeholderBase)) {
                stillStoredAsTseitinVariable = true;
            } else {
                tseitinVars.remove(formula);
                tseitinVarToFormula.remove(placeholder);
                pending.push(placeholderBase);
            }
        }
        // 该公式本身是 Tseitin 变量
        FormulaContent mapped = tseitinVarToFormula.get(formula);
        if (mapped != null) {
            FormulaContent mappedBase = baseOf(mapped);
            if (isInUse(mappedBase)) {
                stillStoredAsTseitinVariable = true;
            } else {
                tseitinVars.remove(mapped);
                tseitinVarToFormula.remove(formula);
                pending.push(mappedBase);
            }
        }
        return stillStoredAsTseitinVariable;
    }

    private void delete(FormulaContent base, Deque<FormulaContent> pending) {
        table.remove(base.getKey());
        usages.remove(base.getId());
        logger.debug("删除公式 {} 及其否定 {}: {}", base.getId(), base.getNegation().getId(), base);
        for (FormulaContent child : base.getSubformulas()) {
            if (child.getType().isConstant()) {
                continue;
            }
            FormulaContent childBase = baseOf(child);
            MutableInt count = usages.get(childBase.getId());
            if (count == null || count.intValue() <= 0) {
                logger.error("FormulaPool: 子公式 {} 的使用次数已损坏", childBase.getId());
                throw new IllegalStateException("FormulaPool: 子公式 " + childBase.getId() + " 的使用次数已损坏");
            }
            count.decrement();
            if (count.intValue() == 0) {
                pending.push(childBase);
            }
        }
    }

    // ========== Tseitin 变量 ==========

    /**
     * @return 公式已有的 Tseitin 变量；没有时返回 TRUE，不会分配新变量。
     */
    public Formula getTseitinVar(Formula formula) {
        FormulaContent content = contentOf(formula);
        lock.lock();
        try {
            FormulaContent placeholder = tseitinVars.get(content);
            return new Formula(this, placeholder == null ? trueContent : placeholder);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 为公式分配一个新的布尔变量作为 Tseitin 占位变量，并记录双向映射。
     * 重复调用返回第一次分配的变量。占位变量的难度取自公式。
     */
    public Formula createTseitinVar(Formula formula) {
        FormulaContent content = contentOf(formula);
        lock.lock();
        try {
            FormulaContent placeholder = tseitinVars.get(content);
            if (placeholder == null) {
                Variable fresh = Variable.freshBooleanVariable();
                placeholder = intern(FormulaKey.ofVariable(fresh), content.getDifficulty());
                tseitinVars.put(content, placeholder);
                tseitinVarToFormula.put(placeholder, content);
                logger.debug("为公式 {} 创建 Tseitin 变量 {}", content.getId(), placeholder);
            }
            return new Formula(this, placeholder);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除 Tseitin 映射，并回收因此不再被占用的一侧。
     * <p>
     * 参数既可以是被映射的公式，也可以是它的占位变量。公式的最后一个句柄释放后，
     * 仍可以通过占位变量的句柄删除映射。
     * @return 是否存在该映射。
     */
    public boolean removeTseitinVar(Formula formulaOrPlaceholder) {
        FormulaContent content = contentOf(formulaOrPlaceholder);
        lock.lock();
        try {
            FormulaContent formula;
            FormulaContent placeholder = tseitinVars.get(content);
            if (placeholder != null) {
                formula = content;
            } else {
                formula = tseitinVarToFormula.get(content);
                if (formula == null) {
                    return false;
                }
                placeholder = content;
            }
            tseitinVars.remove(formula);
            tseitinVarToFormula.remove(placeholder);
            logger.debug("删除公式 {} 的 Tseitin 变量 {}", formula.getId(), placeholder);
            collect(baseOf(placeholder));
            collect(baseOf(formula));
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ========== 查询与诊断 ==========

    /**
     * @return 查找表中的基公式数量（包括 TRUE）。
     */
    public int size() {
        lock.lock();
        try {
            return table.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 公式（任一极性）的使用次数；TRUE/FALSE 不计数，返回 -1。
     */
    public int getUsageCount(Formula formula) {
        FormulaContent content = contentOf(formula);
        if (content.getType().isConstant()) {
            return -1;
        }
        lock.lock();
        try {
            return usages.get(baseOf(content).getId()).intValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return b 是否就是 a 的否定。
     */
    public boolean formulasInverse(Formula a, Formula b) {
        return contentOf(a).getNegation() == contentOf(b);
    }

    /**
     * 按 ID 顺序访问池中的每个公式及其否定。句柄只在回调期间有效。
     */
    public void forEach(Consumer<Formula> action) {
        Objects.requireNonNull(action, "FormulaPool.forEach: action 不能为 null");
        lock.lock();
        try {
            for (FormulaContent base : sortedBaseFormulas()) {
                try (Formula formula = new Formula(this, base)) {
                    action.accept(formula);
                }
                try (Formula negation = new Formula(this, base.getNegation())) {
                    action.accept(negation);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private List<FormulaContent> sortedBaseFormulas() {
        List<FormulaContent> bases = new ArrayList<>(table.values());
        bases.sort(Comparator.comparingInt(FormulaContent::getId));
        return bases;
    }

    /**
     * 诊断用的池内容清单：每个基公式的 ID、使用次数、内容和否定，以及 Tseitin 映射。
     * 格式不稳定，只用于调试。
     */
    public String dump() {
        lock.lock();
        try {
            StringBuilder sb = new StringBuilder("Formula pool contains:\n");
            for (FormulaContent base : sortedBaseFormulas()) {
                MutableInt count = usages.get(base.getId());
                sb.append(base.getId())
                        .append(" [usages=").append(count == null ? "pinned" : count.toString()).append("]: ")
                        .append(base)
                        .append(", negation ").append(base.getNegation().getId())
                        .append('\n');
            }
            sb.append("Tseitin variables:\n");
            tseitinVars.forEach((formula, placeholder) -> {
                sb.append("id ").append(formula.getId()).append("  ->  ").append(placeholder.getId());
                FormulaContent remapped = tseitinVarToFormula.get(placeholder);
                if (remapped != null) {
                    sb.append(" [remapping: ").append(placeholder.getId()).append(" -> ").append(remapped.getId()).append("]");
                } else {
                    sb.append(" [not yet remapped!]");
                }
                sb.append('\n');
            });
            return sb.toString();
        } finally {
            lock.unlock();
        }
    }

    public void print() {
        logger.info("\n{}", dump());
    }

    /**
     * 单线程模式使用的空锁。
     */
    private static final class NoOpLock implements Lock {

        @Override
        public void lock() {
        }

        @Override
        public void lockInterruptibly() {
        }

        @Override
        public boolean tryLock() {
            return true;
        }

        @Override
        public boolean tryLock(long time, TimeUnit unit) {
            return true;
        }

        @Override
        public void unlock() {
        }

        @Override
        public Condition newCondition() {
            throw new UnsupportedOperationException("单线程模式的公式池不支持 Condition");
        }
    }
}
