package com.phillippitts.hybridfactor.service.worker;

import com.phillippitts.hybridfactor.domain.FactorPair;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Base class for factoring workers providing the shared commit, heartbeat and fault
 * handling around an algorithm-specific {@link #search()}.
 *
 * <p><b>Template Method:</b> {@link #run()} seeds the heartbeat, calls {@link #search()},
 * and on a factor offers {@code (min(d, N/d), max(d, N/d))} to the result slot. Only the
 * worker whose offer is accepted raises the stop signal.
 *
 * <p><b>Error Handling:</b> any {@link RuntimeException} escaping {@link #search()} is
 * caught here and ends the worker with {@link WorkerOutcome#FAULTED}; it never reaches the
 * coordinator or the other workers.
 *
 * <p><b>Cancellation:</b> cooperative. Subclasses call {@link #checkpoint(long)} once per
 * batch; a subclass that never does cannot be stopped.
 */
public abstract class AbstractFactorWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(AbstractFactorWorker.class);

    protected final String workerId;
    protected final RaceContext race;
    protected final BigInteger n;

    private volatile WorkerOutcome outcome;
    private volatile Throwable fault;
    private volatile boolean cycleFailed;

    protected AbstractFactorWorker(String workerId, RaceContext race) {
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.race = Objects.requireNonNull(race, "race");
        this.n = race.n();
    }

    @Override
    public final void run() {
        race.heartbeats().beat(workerId, 0);
        try {
            BigInteger d = search();
            if (d == null) {
                outcome = exitWithoutFactor();
            } else if (race.resultSlot().offer(FactorPair.of(d, n))) {
                race.stopSignal().raise();
                outcome = WorkerOutcome.WON;
                LOG.info("{} committed factor {}", workerId, d);
            } else {
                outcome = WorkerOutcome.LOST_RACE;
                LOG.debug("{} found factor {} after the slot was filled; discarding", workerId, d);
            }
        } catch (RuntimeException e) {
            fault = e;
            outcome = WorkerOutcome.FAULTED;
            LOG.error("{} failed unexpectedly; stopping without a result", workerId, e);
        } finally {
            race.heartbeats().markFinished(workerId);
        }
    }

    /**
     * Runs the algorithm until it finds a nontrivial divisor, gives up, or observes the
     * stop signal.
     *
     * @return a divisor {@code d} with {@code 1 < d < N}, or null when none was found
     */
    protected abstract BigInteger search();

    public abstract WorkerKind kind();

    /** Human-readable algorithm parameter, e.g. the bound schedule or the rho constant. */
    public abstract String parameter();

    /**
     * Records {@code progress} in the heartbeat registry, then polls the stop signal.
     *
     * @return true if the worker should keep going
     */
    protected final boolean checkpoint(long progress) {
        race.heartbeats().beat(workerId, progress);
        return !race.stopSignal().isRaised();
    }

    /** Marks the current search as ended by a closed rho cycle rather than exhaustion. */
    protected final void markCycleFailed() {
        cycleFailed = true;
    }

    /** Classifies a gcd: true for a nontrivial divisor {@code 1 < d < N}. */
    protected final boolean isNontrivial(BigInteger d) {
        return d.compareTo(BigInteger.ONE) > 0 && d.compareTo(n) < 0;
    }

    private WorkerOutcome exitWithoutFactor() {
        if (race.stopSignal().isRaised()) {
            return WorkerOutcome.CANCELLED;
        }
        return cycleFailed ? WorkerOutcome.CYCLE_FAILED : WorkerOutcome.EXHAUSTED;
    }

    public String workerId() {
        return workerId;
    }

    /** Outcome of the finished loop, or null while it is still running. */
    public WorkerOutcome outcome() {
        return outcome;
    }

    /** The exception that ended the loop, or null unless the outcome is FAULTED. */
    public Throwable fault() {
        return fault;
    }
}
