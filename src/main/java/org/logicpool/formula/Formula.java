package org.logicpool.formula;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.logicpool.expressions.ToZ3BoolExpr;
import org.logicpool.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 指向池中公式节点的句柄。
 * <p>
 * 每个句柄在基公式上登记一次使用，{@link #close()} 时释放；最后一个句柄释放后，
 * 节点和它的否定一起从池中删除（除非仍被 Tseitin 映射占用）。
 * 需要第二个独立持有者时用 {@link #copy()}。
 * <p>
 * 相等、哈希和顺序都只看节点 ID，因此比较是 O(1) 的，句柄可以直接作为 Map/Set 的键。
 * 关闭后的句柄仍可比较，但不能再用于构造新公式。
 */
public final class Formula implements Comparable<Formula>, AutoCloseable, ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    private final FormulaPool pool;
    private final FormulaContent content;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Formula(FormulaPool pool, FormulaContent content) {
        this.pool = Objects.requireNonNull(pool, "Formula-构造函数: pool 不能为 null");
        this.content = Objects.requireNonNull(content, "Formula-构造函数: content 不能为 null");
        pool.registerUse(content);
    }

    /**
     * @return 指向同一节点的新句柄（新登记一次使用）。
     */
    public Formula copy() {
        checkNotReleased();
        return new Formula(pool, content);
    }

    /**
     * @return 否定公式的新句柄，O(1)。
     */
    public Formula negation() {
        checkNotReleased();
        return new Formula(pool, content.getNegation());
    }

    /**
     * 释放本句柄登记的使用。重复调用无效果。
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(content);
        } else {
            logger.trace("句柄 {} 已经释放", content.getId());
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    public FormulaPool getPool() {
        return pool;
    }

    public FormulaContent getContent() {
        return content;
    }

    public int getId() {
        return content.getId();
    }

    public FormulaType getType() {
        return content.getType();
    }

    public double getDifficulty() {
        return content.getDifficulty();
    }

    public boolean isTrue() {
        return content.isTrue();
    }

    public boolean isFalse() {
        return content.isFalse();
    }

    void checkNotReleased() {
        if (released.get()) {
            logger.error("Formula: 句柄 {} 已释放，不能再使用", content.getId());
            throw new IllegalStateException("Formula: 句柄 " + content.getId() + " 已释放");
        }
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return content.toZ3BoolExpr(ctx, varManager);
    }

    @Override
    public int compareTo(Formula other) {
        return Integer.compare(content.getId(), other.content.getId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return content == that.content;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(content.getId());
    }

    @Override
    public String toString() {
        return content.toString();
    }
}
