package com.flagship.wolf_goat_pig.quarters;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;

/**
 * An exact amount of quarters, held as a normalized fraction.
 *
 * All point arithmetic in the engine goes through this type so that the
 * zero-sum invariant is checked with exact equality. The denominator is always
 * positive and the fraction is always reduced, so {@link #equals(Object)} is
 * value equality.
 *
 * Overflow raises {@link ArithmeticException} rather than wrapping.
 */
public final class Quarters implements Comparable<Quarters> {

    public static final Quarters ZERO = new Quarters(0, 1);
    public static final Quarters ONE = new Quarters(1, 1);

    private final long numerator;
    private final long denominator;

    private Quarters(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Quarters of(long whole) {
        return whole == 0 ? ZERO : new Quarters(whole, 1);
    }

    public static Quarters of(long numerator, long denominator) {
        if (denominator == 0) {
            throw new ArithmeticException("Denominator must not be zero");
        }
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        long gcd = gcd(Math.abs(numerator), denominator);
        return new Quarters(numerator / gcd, denominator / gcd);
    }

    public static Quarters sum(Collection<Quarters> values) {
        Quarters total = ZERO;
        for (Quarters value : values) {
            total = total.add(value);
        }
        return total;
    }

    public Quarters add(Quarters other) {
        long lcm = lcm(this.denominator, other.denominator);
        long left = Math.multiplyExact(this.numerator, lcm / this.denominator);
        long right = Math.multiplyExact(other.numerator, lcm / other.denominator);
        return of(Math.addExact(left, right), lcm);
    }

    public Quarters subtract(Quarters other) {
        return add(other.negate());
    }

    public Quarters negate() {
        return new Quarters(Math.negateExact(numerator), denominator);
    }

    public Quarters multiply(long factor) {
        return of(Math.multiplyExact(numerator, factor), denominator);
    }

    public Quarters multiply(Quarters other) {
        // Cross-reduce first to keep intermediates small
        long g1 = gcd(Math.abs(this.numerator), other.denominator);
        long g2 = gcd(Math.abs(other.numerator), this.denominator);
        long num = Math.multiplyExact(this.numerator / g1, other.numerator / g2);
        long den = Math.multiplyExact(this.denominator / g2, other.denominator / g1);
        return of(num, den);
    }

    public Quarters divide(long divisor) {
        if (divisor == 0) {
            throw new ArithmeticException("Cannot divide quarters by zero");
        }
        return of(numerator, Math.multiplyExact(denominator, divisor));
    }

    public Quarters divide(Quarters divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Cannot divide quarters by zero");
        }
        return multiply(of(divisor.denominator, divisor.numerator));
    }

    public boolean isZero() {
        return numerator == 0;
    }

    public int signum() {
        return Long.signum(numerator);
    }

    public boolean isWhole() {
        return denominator == 1;
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    /**
     * Decimal view for display only; never feed this back into arithmetic.
     */
    public BigDecimal toBigDecimal(MathContext mathContext) {
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), mathContext);
    }

    @Override
    public int compareTo(Quarters other) {
        // a/b vs c/d with positive denominators
        return Long.compare(
            Math.multiplyExact(this.numerator, other.denominator),
            Math.multiplyExact(other.numerator, this.denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quarters other)) {
            return false;
        }
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(numerator) + Long.hashCode(denominator);
    }

    @JsonValue
    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }

    private static long lcm(long a, long b) {
        return Math.multiplyExact(a / gcd(a, b), b);
    }
}
