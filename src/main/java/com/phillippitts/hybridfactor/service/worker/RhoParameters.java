package com.phillippitts.hybridfactor.service.worker;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Sequence parameters of one Pollard rho worker: {@code x0 = start},
 * {@code x_{i+1} = x_i^2 + increment mod N}.
 *
 * @param start starting value x0
 * @param increment the constant c
 * @param maxIterations Floyd iterations before the worker gives up
 * @param batchSize iterations whose differences are multiplied together between two gcd checks
 */
public record RhoParameters(BigInteger start, BigInteger increment, long maxIterations, int batchSize) {

    public RhoParameters {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(increment, "increment");
        if (start.signum() < 0) {
            throw new IllegalArgumentException("start must be non-negative: " + start);
        }
        if (increment.signum() <= 0) {
            throw new IllegalArgumentException("increment must be positive: " + increment);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    /**
     * Derives the parameters of the worker with the given seed. Distinct seeds below
     * {@code N - 3} give distinct constants {@code c = 1 + seed mod (N - 3)}, which never
     * hits the degenerate constants 0 and -2.
     *
     * @throws IllegalArgumentException if {@code n < 4}
     */
    public static RhoParameters forSeed(long seed, BigInteger n, BigInteger start, long maxIterations, int batchSize) {
        if (n.compareTo(BigInteger.valueOf(4)) < 0) {
            throw new IllegalArgumentException("rho needs N >= 4: " + n);
        }
        BigInteger range = n.subtract(BigInteger.valueOf(3));
        BigInteger c = BigInteger.valueOf(seed).mod(range).add(BigInteger.ONE);
        return new RhoParameters(start.mod(n), c, maxIterations, batchSize);
    }
}
