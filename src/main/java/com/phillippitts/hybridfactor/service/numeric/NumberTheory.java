package com.phillippitts.hybridfactor.service.numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Stateless integer primitives used by the pre-filter and the factoring workers.
 *
 * @since 1.0
 */
public final class NumberTheory {

    private NumberTheory() {
    }

    /**
     * Greatest common divisor of two non-negative integers; {@code gcd(0, k) = k}.
     *
     * @throws IllegalArgumentException if either argument is negative
     */
    public static BigInteger gcd(BigInteger a, BigInteger b) {
        requireNonNegative(a, "a");
        requireNonNegative(b, "b");
        return a.gcd(b);
    }

    /**
     * Returns the smallest divisor {@code d} of {@code n} with {@code 2 <= d <= limit}, scanning
     * candidates in ascending order.
     *
     * @param n positive number to divide
     * @param limit largest candidate tried, inclusive
     * @return the first divisor found, or empty when none divides {@code n} within the bound
     */
    public static Optional<BigInteger> trialDivision(BigInteger n, long limit) {
        Objects.requireNonNull(n, "n");
        if (n.signum() <= 0) {
            throw new IllegalArgumentException("n must be positive: " + n);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (n.bitLength() < Long.SIZE) {
            long value = n.longValue();
            for (long d = 2; d <= limit && d > 0; d++) {
                if (value % d == 0) {
                    return Optional.of(BigInteger.valueOf(d));
                }
            }
            return Optional.empty();
        }
        for (long d = 2; d <= limit && d > 0; d++) {
            BigInteger candidate = BigInteger.valueOf(d);
            if (n.mod(candidate).signum() == 0) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Floor of the square root of a non-negative integer. */
    public static BigInteger isqrt(BigInteger n) {
        requireNonNegative(n, "n");
        return n.sqrt();
    }

    /**
     * All primes {@code <= bound} in ascending order (sieve of Eratosthenes).
     */
    public static int[] primesUpTo(int bound) {
        if (bound < 2) {
            return new int[0];
        }
        BitSet composite = new BitSet(bound + 1);
        for (long i = 2; i * i <= bound; i++) {
            if (!composite.get((int) i)) {
                for (long j = i * i; j <= bound; j += i) {
                    composite.set((int) j);
                }
            }
        }
        int[] primes = new int[bound];
        int count = 0;
        for (int i = 2; i <= bound; i++) {
            if (!composite.get(i)) {
                primes[count++] = i;
            }
        }
        return Arrays.copyOf(primes, count);
    }

    /**
     * Largest power {@code p^k <= limit}, or 1 when {@code p > limit}.
     */
    public static long largestPowerAtMost(long p, long limit) {
        if (p < 2) {
            throw new IllegalArgumentException("p must be at least 2: " + p);
        }
        long power = 1;
        while (power <= limit / p) {
            power *= p;
        }
        return power;
    }

    private static void requireNonNegative(BigInteger value, String name) {
        Objects.requireNonNull(value, name);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }
}
