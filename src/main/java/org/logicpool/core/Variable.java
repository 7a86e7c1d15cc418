package org.logicpool.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 公式中的变量。ID 由进程级的计数器分配，保证唯一性和线程安全。
 * 此类是不可变的，比较和相等都只基于 ID。
 * @author Ayalyt
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    // 进程级的新变量分配器
    private static final AtomicInteger NEXT_ID = new AtomicInteger(1);

    private static final String FRESH_BOOLEAN_PREFIX = "_t";

    private final int id;
    private final String name;
    private final VariableType type;

    private final int hashCode;

    private Variable(int id, String name, VariableType type) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Variable: {} ({}) with id {}", name, type, id);
    }

    /**
     * 创建一个指定名称和类型的新变量。
     * 同名的两次调用得到两个不同的变量。
     * @param name 变量名称。
     * @param type 变量类型。
     * @return 新的 Variable 实例。
     */
    public static Variable createNewVariable(String name, VariableType type) {
        Objects.requireNonNull(name, "Variable-工厂方法: name 不能为 null");
        Objects.requireNonNull(type, "Variable-工厂方法: type 不能为 null");
        if (name.isEmpty()) {
            logger.error("Variable-工厂方法: 变量名称不能为空");
            throw new IllegalArgumentException("Variable-工厂方法: 变量名称不能为空");
        }
        return new Variable(NEXT_ID.getAndIncrement(), name, type);
    }

    /**
     * 创建一个新的布尔变量，主要用作 Tseitin 占位变量。
     * @return 新的布尔 Variable 实例，名称为 "_t" + ID。
     */
    public static Variable freshBooleanVariable() {
        int id = NEXT_ID.getAndIncrement();
        return new Variable(id, FRESH_BOOLEAN_PREFIX + id, VariableType.BOOL);
    }

    @Override
    public int compareTo(Variable other) {
        return Integer.compare(this.id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return id == variable.id;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
