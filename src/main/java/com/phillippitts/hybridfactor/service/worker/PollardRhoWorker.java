package com.phillippitts.hybridfactor.service.worker;

import com.phillippitts.hybridfactor.service.numeric.NumberTheory;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Pollard's rho with Floyd cycle detection over {@code f(x) = x^2 + c mod N}.
 *
 * <p>Per iteration the tortoise advances once and the hare twice. The differences
 * {@code |hare - tortoise|} are multiplied together modulo N over a batch, then the worker
 * beats, takes one gcd with N and polls the stop signal.
 *
 * <p>A batch gcd of N is replayed step by step from the positions saved at the start of
 * the batch. If a single step still gives N the sequence has closed its cycle modulo N:
 * the worker ends with {@link WorkerOutcome#CYCLE_FAILED} and leaves any retry with a new
 * constant to the coordinator.
 *
 * <p>Workers never share sequence state; only the race context is shared.
 */
public final class PollardRhoWorker extends AbstractFactorWorker {

    private static final Logger LOG = LogManager.getLogger(PollardRhoWorker.class);

    private final RhoParameters params;

    public PollardRhoWorker(String workerId, RaceContext race, RhoParameters params) {
        super(workerId, race);
        this.params = Objects.requireNonNull(params, "params");
    }

    @Override
    protected BigInteger search() {
        BigInteger tortoise = params.start();
        BigInteger hare = params.start();
        long iterations = 0;

        while (iterations < params.maxIterations()) {
            BigInteger savedTortoise = tortoise;
            BigInteger savedHare = hare;
            int steps = (int) Math.min(params.batchSize(), params.maxIterations() - iterations);
            BigInteger product = BigInteger.ONE;
            for (int i = 0; i < steps; i++) {
                tortoise = step(tortoise);
                hare = step(step(hare));
                product = product.multiply(hare.subtract(tortoise).abs()).mod(n);
            }
            iterations += steps;

            BigInteger d = NumberTheory.gcd(product, n);
            if (isNontrivial(d)) {
                return d;
            }
            if (d.equals(n)) {
                BigInteger isolated = replay(savedTortoise, savedHare, steps);
                if (isolated == null) {
                    markCycleFailed();
                    LOG.debug("{} closed its cycle after {} iterations", workerId, iterations);
                }
                return isolated;
            }
            if (!checkpoint(iterations)) {
                return null;
            }
        }
        LOG.debug("{} exhausted {} iterations", workerId, params.maxIterations());
        return null;
    }

    private BigInteger replay(BigInteger tortoise, BigInteger hare, int steps) {
        for (int i = 0; i < steps; i++) {
            tortoise = step(tortoise);
            hare = step(step(hare));
            BigInteger d = NumberTheory.gcd(hare.subtract(tortoise).abs(), n);
            if (isNontrivial(d)) {
                return d;
            }
            if (d.equals(n)) {
                return null;
            }
        }
        return null;
    }

    private BigInteger step(BigInteger x) {
        return x.multiply(x).add(params.increment()).mod(n);
    }

    @Override
    public WorkerKind kind() {
        return WorkerKind.RHO;
    }

    @Override
    public String parameter() {
        return "x0=" + params.start() + ", c=" + params.increment();
    }
}
