package org.logicpool.formula;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 公式池的配置。
 * <ul>
 *     <li>{@code formula.pool.thread-safe}：是否用可重入锁保护池（默认 true）。</li>
 *     <li>{@code formula.pool.initial-capacity}：查找表的初始容量（默认 10000）。</li>
 *     <li>{@code formula.pool.simplify}：构造原子时是否把恒真/恒假原子折叠为 TRUE/FALSE（默认 true）。</li>
 * </ul>
 * {@link #load()} 先读取类路径上的 {@value #RESOURCE}，再用同名的系统属性覆盖。
 * 此类是不可变的。
 */
@Getter
public final class PoolConfig {

    private static final Logger logger = LoggerFactory.getLogger(PoolConfig.class);

    static final String RESOURCE = "formula-pool.properties";

    public static final String THREAD_SAFE = "formula.pool.thread-safe";
    public static final String INITIAL_CAPACITY = "formula.pool.initial-capacity";
    public static final String SIMPLIFY = "formula.pool.simplify";

    private static final PoolConfig DEFAULTS = new PoolConfig(true, 10000, true);

    private final boolean threadSafe;
    private final int initialCapacity;
    private final boolean simplify;

    private PoolConfig(boolean threadSafe, int initialCapacity, boolean simplify) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("PoolConfig: initialCapacity 不能为负数: " + initialCapacity);
        }
        this.threadSafe = threadSafe;
        this.initialCapacity = initialCapacity;
        this.simplify = simplify;
    }

    public static PoolConfig defaults() {
        return DEFAULTS;
    }

    public static PoolConfig of(boolean threadSafe, int initialCapacity, boolean simplify) {
        return new PoolConfig(threadSafe, initialCapacity, simplify);
    }

    /**
     * 从类路径资源和系统属性加载配置，缺失的项使用默认值。
     */
    public static PoolConfig load() {
        Properties properties = new Properties();
        try (InputStream in = PoolConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.debug("已加载 {}", RESOURCE);
            } else {
                logger.debug("类路径上没有 {}，使用默认配置", RESOURCE);
            }
        } catch (IOException e) {
            logger.error("读取 {} 失败", RESOURCE, e);
            throw new UncheckedIOException("读取 " + RESOURCE + " 失败", e);
        }
        for (String name : new String[]{THREAD_SAFE, INITIAL_CAPACITY, SIMPLIFY}) {
            String override = System.getProperty(name);
            if (override != null) {
                properties.setProperty(name, override);
            }
        }
        return fromProperties(properties);
    }

    static PoolConfig fromProperties(Properties properties) {
        boolean threadSafe = parseBoolean(properties, THREAD_SAFE, DEFAULTS.threadSafe);
        boolean simplify = parseBoolean(properties, SIMPLIFY, DEFAULTS.simplify);
        String capacity = properties.getProperty(INITIAL_CAPACITY);
        int initialCapacity = DEFAULTS.initialCapacity;
        if (capacity != null) {
            try {
                initialCapacity = Integer.parseInt(capacity.trim());
            } catch (NumberFormatException e) {
                logger.error("PoolConfig: {} 的值 '{}' 不是整数", INITIAL_CAPACITY, capacity);
                throw new IllegalArgumentException("PoolConfig: " + INITIAL_CAPACITY + " 的值不是整数: " + capacity, e);
            }
        }
        return new PoolConfig(threadSafe, initialCapacity, simplify);
    }

    private static boolean parseBoolean(Properties properties, String name, boolean defaultValue) {
        String value = properties.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
            logger.error("PoolConfig: {} 的值 '{}' 不是布尔值", name, value);
            throw new IllegalArgumentException("PoolConfig: " + name + " 的值不是布尔值: " + value);
        }
        return Boolean.parseBoolean(trimmed);
    }

    @Override
    public String toString() {
        return "PoolConfig{threadSafe=" + threadSafe + ", initialCapacity=" + initialCapacity + ", simplify=" + simplify + "}";
    }
}
