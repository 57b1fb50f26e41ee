package com.phillippitts.hybridfactor.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Two positive factors {@code p <= q} whose product is the factored number.
 *
 * <p>Conventions: {@code (1, 1)} for N = 1 and {@code (1, N)} when N is prime or no factor
 * was found within the time budget.
 */
public record FactorPair(BigInteger p, BigInteger q) {

    public FactorPair {
        Objects.requireNonNull(p, "p");
        Objects.requireNonNull(q, "q");
        if (p.signum() <= 0 || q.signum() <= 0) {
            throw new IllegalArgumentException("factors must be positive: (" + p + ", " + q + ")");
        }
        if (p.compareTo(q) > 0) {
            throw new IllegalArgumentException("p must not exceed q: (" + p + ", " + q + ")");
        }
    }

    /**
     * Builds the ordered pair {@code (min(d, n/d), max(d, n/d))}.
     *
     * @throws IllegalArgumentException if {@code divisor} does not divide {@code n}
     */
    public static FactorPair of(BigInteger divisor, BigInteger n) {
        Objects.requireNonNull(divisor, "divisor");
        Objects.requireNonNull(n, "n");
        if (divisor.signum() <= 0) {
            throw new IllegalArgumentException("divisor must be positive: " + divisor);
        }
        BigInteger[] qr = n.divideAndRemainder(divisor);
        if (qr[1].signum() != 0) {
            throw new IllegalArgumentException(divisor + " does not divide " + n);
        }
        BigInteger cofactor = qr[0];
        return divisor.compareTo(cofactor) <= 0
                ? new FactorPair(divisor, cofactor)
                : new FactorPair(cofactor, divisor);
    }

    /** The pair for N = 1. */
    public static FactorPair unit() {
        return new FactorPair(BigInteger.ONE, BigInteger.ONE);
    }

    /** The "no factor found, treat as probably prime" pair {@code (1, n)}. */
    public static FactorPair unsplit(BigInteger n) {
        return new FactorPair(BigInteger.ONE, n);
    }

    public BigInteger product() {
        return p.multiply(q);
    }

    /** True when both factors exceed one. */
    public boolean isSplit() {
        return p.compareTo(BigInteger.ONE) > 0;
    }
}
