package com.phillippitts.hybridfactor.service.worker;

import com.phillippitts.hybridfactor.service.numeric.NumberTheory;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Pollard's p-1: finds a prime factor p of N when p - 1 is smooth over the current bound.
 *
 * <p>The accumulator starts at 2 and is raised, modulo N, to the largest power of every
 * prime that fits under the bound. After each batch of primes the worker beats, checks
 * {@code gcd(a - 1, N)} and polls the stop signal.
 *
 * <p>When a batch overshoots ({@code gcd == N}, every prime factor became smooth at once)
 * the batch is replayed one prime power at a time from the accumulator saved at its start.
 * If a single step still overshoots, the worker gives up: the accumulator is 1 modulo N
 * from then on and cannot reveal anything.
 *
 * <p>The bound escalates through {@link PMinusOneParameters#bounds()}; each stage keeps the
 * accumulator and applies only the prime powers the previous stage did not.
 */
public final class PollardPMinusOneWorker extends AbstractFactorWorker {

    private static final Logger LOG = LogManager.getLogger(PollardPMinusOneWorker.class);

    private static final BigInteger TWO = BigInteger.valueOf(2);

    private final PMinusOneParameters params;

    public PollardPMinusOneWorker(String workerId, RaceContext race, PMinusOneParameters params) {
        super(workerId, race);
        this.params = Objects.requireNonNull(params, "params");
    }

    @Override
    protected BigInteger search() {
        List<Integer> bounds = params.bounds();
        int[] primes = NumberTheory.primesUpTo(params.maxBound());
        BigInteger a = TWO.mod(n);
        long progress = 0;
        int previousBound = 1;

        for (int bound : bounds) {
            int stageEnd = countAtMost(primes, bound);
            for (int start = 0; start < stageEnd; start += params.batchSize()) {
                int end = Math.min(start + params.batchSize(), stageEnd);
                BigInteger saved = a;
                for (int i = start; i < end; i++) {
                    a = raise(a, primes[i], previousBound, bound);
                }
                progress += end - start;

                BigInteger d = NumberTheory.gcd(a.subtract(BigInteger.ONE).mod(n), n);
                if (isNontrivial(d)) {
                    return d;
                }
                if (d.equals(n)) {
                    BigInteger isolated = replay(saved, primes, start, end, previousBound, bound);
                    if (isolated == null) {
                        LOG.debug("{} overshot at bound {}; all factors smooth at one prime", workerId, bound);
                    }
                    return isolated;
                }
                if (!checkpoint(progress)) {
                    return null;
                }
            }
            LOG.debug("{} finished bound {} without a factor", workerId, bound);
            previousBound = bound;
        }
        return null;
    }

    private BigInteger replay(BigInteger a, int[] primes, int start, int end, int previousBound, int bound) {
        for (int i = start; i < end; i++) {
            a = raise(a, primes[i], previousBound, bound);
            BigInteger d = NumberTheory.gcd(a.subtract(BigInteger.ONE).mod(n), n);
            if (isNontrivial(d)) {
                return d;
            }
            if (d.equals(n)) {
                return null;
            }
        }
        return null;
    }

    /** Applies the part of p's largest power under {@code bound} not applied under {@code previousBound}. */
    private BigInteger raise(BigInteger a, int p, int previousBound, int bound) {
        long exponent = NumberTheory.largestPowerAtMost(p, bound) / NumberTheory.largestPowerAtMost(p, previousBound);
        if (exponent == 1) {
            return a;
        }
        return a.modPow(BigInteger.valueOf(exponent), n);
    }

    private static int countAtMost(int[] primes, int bound) {
        int count = 0;
        while (count < primes.length && primes[count] <= bound) {
            count++;
        }
        return count;
    }

    @Override
    public WorkerKind kind() {
        return WorkerKind.P_MINUS_1;
    }

    @Override
    public String parameter() {
        return "B=" + params.bounds();
    }
}
