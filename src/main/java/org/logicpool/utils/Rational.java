package org.logicpool.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，分子分母约分后存储，分母恒为正。
 * 只表示有限值：约束的系数和常数项不需要无穷大。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        for (int i = -16; i <= 16; i++) {
            if (i != 0 && i != 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BigInteger.ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-工厂方法: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-工厂方法: denominator 不能为 null");
        if (denominator.signum() == 0) {
            logger.error("Rational-工厂方法: 分母为 0 ({} / {})", numerator, denominator);
            throw new ArithmeticException("Rational-工厂方法: 分母为 0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BigInteger.ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (numerator.bitLength() + denominator.bitLength() < 32) {
            CACHE.putIfAbsent(key, result);
        }
        return result;
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    public ArithExpr toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
