package com.phillippitts.hybridfactor.service.orchestration;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import com.phillippitts.hybridfactor.domain.FactorPair;
import com.phillippitts.hybridfactor.domain.FactorizationReport;
import com.phillippitts.hybridfactor.domain.FactorizationRequest;
import com.phillippitts.hybridfactor.domain.Resolution;
import com.phillippitts.hybridfactor.exception.InvalidFactorizationRequestException;
import com.phillippitts.hybridfactor.service.metrics.FactorizationMetrics;
import com.phillippitts.hybridfactor.service.numeric.NumberTheory;
import com.phillippitts.hybridfactor.service.orchestration.event.FactorizationCompletedEvent;
import com.phillippitts.hybridfactor.service.orchestration.event.WorkerFaultEvent;
import com.phillippitts.hybridfactor.service.race.Heartbeat;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import com.phillippitts.hybridfactor.service.worker.AbstractFactorWorker;
import com.phillippitts.hybridfactor.service.worker.FactorWorkerFactory;
import com.phillippitts.hybridfactor.service.worker.WorkerHandle;
import com.phillippitts.hybridfactor.service.worker.WorkerKind;
import com.phillippitts.hybridfactor.service.worker.WorkerOutcome;
import com.phillippitts.hybridfactor.util.Deadline;
import com.phillippitts.hybridfactor.util.LogFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Splits a positive integer into two factors by racing Pollard p-1 against several
 * Pollard rho workers.
 *
 * <p>Each call goes through these stages, stopping at the first that answers:
 * <ul>
 *   <li><b>Trivial:</b> N = 1 gives (1, 1)</li>
 *   <li><b>Even:</b> N &gt; 2 and even gives (2, N/2), independent of the trial limit</li>
 *   <li><b>Pre-filter:</b> sequential trial division up to {@code min(trialLimit, isqrt(N))};
 *       when it covers isqrt(N) and finds nothing, N is prime</li>
 *   <li><b>Race:</b> one p-1 worker and {@code workerCount} rho workers on their own
 *       threads, sharing a fresh {@link RaceContext}</li>
 * </ul>
 *
 * <p><b>Arbitration:</b> the coordinator blocks on "result committed or any worker exited",
 * bounded by the timeout and chunked by the monitor interval. Between waits it replaces rho
 * workers whose cycle closed and logs workers whose heartbeat went silent.
 *
 * <p><b>Wind-down:</b> the stop signal is always raised, then workers get the grace period
 * (in total) to exit. Workers still running after that are abandoned; their daemon threads
 * end on their next stop-signal poll.
 *
 * <p>Thread-safe: calls share no state besides the injected collaborators.
 *
 * @since 1.0
 */
@Service
public class HybridFactorizer {

    private static final Logger LOG = LogManager.getLogger(HybridFactorizer.class);

    static final String MDC_RACE_ID = "raceId";
    static final String MDC_N = "n";
    private static final int LOGGED_DIGITS = 40;

    private final FactorizationProperties props;
    private final Executor executor;
    private final FactorWorkerFactory workers;
    private final FactorizationMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final AtomicLong raceIds = new AtomicLong();

    public HybridFactorizer(FactorizationProperties props,
                            @Qualifier("factorWorkerExecutor") Executor executor,
                            FactorWorkerFactory workers,
                            FactorizationMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /** Factors {@code n} with the configured trial limit, worker count and timeout. */
    public FactorPair factorize(BigInteger n) {
        return factorize(n, props.getTrialLimit(), props.getWorkerCount(), props.getTimeout());
    }

    public FactorPair factorize(BigInteger n, long trialLimit, int workerCount, Duration timeout) {
        return factorize(new FactorizationRequest(n, trialLimit, workerCount, timeout));
    }

    /**
     * Returns {@code (p, q)} with {@code p * q == N} and {@code p <= q}; {@code (1, N)} when N
     * is prime or no factor was found in time.
     *
     * @throws InvalidFactorizationRequestException if the worker count exceeds the configured maximum
     */
    public FactorPair factorize(FactorizationRequest request) {
        return factorizeWithReport(request).pair();
    }

    /**
     * Same as {@link #factorize(FactorizationRequest)} but also reports the resolution path,
     * the winning algorithm, the number of workers started and their last heartbeats.
     */
    public FactorizationReport factorizeWithReport(FactorizationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.workerCount() > props.getMaxWorkerCount()) {
            throw new InvalidFactorizationRequestException("workerCount",
                    "must not exceed " + props.getMaxWorkerCount() + " (was " + request.workerCount() + ")");
        }

        long t0 = System.nanoTime();
        String raceId = "race-" + raceIds.incrementAndGet();
        ThreadContext.put(MDC_RACE_ID, raceId);
        ThreadContext.put(MDC_N, LogFormat.abbreviate(request.n(), LOGGED_DIGITS));
        try {
            FactorizationReport report = resolve(request, t0);
            metrics.recordLatency(report.resolution(), System.nanoTime() - t0);
            metrics.incrementResolution(report.resolution());
            LOG.info("Factored as ({}, {}) via {} in {} ms ({} workers)",
                    LogFormat.abbreviate(report.pair().p(), LOGGED_DIGITS),
                    LogFormat.abbreviate(report.pair().q(), LOGGED_DIGITS),
                    report.resolution(), report.elapsed().toMillis(), report.workersStarted());
            publisher.publishEvent(new FactorizationCompletedEvent(raceId, report));
            return report;
        } finally {
            ThreadContext.remove(MDC_RACE_ID);
            ThreadContext.remove(MDC_N);
        }
    }

    private FactorizationReport resolve(FactorizationRequest request, long t0) {
        BigInteger n = request.n();
        if (n.equals(BigInteger.ONE)) {
            return report(n, FactorPair.unit(), Resolution.TRIVIAL, null, 0, t0, List.of());
        }
        // Even N is split here whatever the trial limit; rho cannot split 4.
        if (!n.testBit(0) && n.compareTo(BigInteger.TWO) > 0) {
            return report(n, FactorPair.of(BigInteger.TWO, n), Resolution.TRIAL_DIVISION, null, 0, t0, List.of());
        }

        BigInteger root = NumberTheory.isqrt(n);
        BigInteger requested = BigInteger.valueOf(request.trialLimit());
        boolean exhaustive = root.compareTo(requested) <= 0;
        long limit = exhaustive ? root.longValueExact() : request.trialLimit();
        Optional<BigInteger> small = limit < 2 ? Optional.empty() : NumberTheory.trialDivision(n, limit);
        if (small.isPresent()) {
            LOG.debug("Pre-filter found {}", small.get());
            return report(n, FactorPair.of(small.get(), n), Resolution.TRIAL_DIVISION, null, 0, t0, List.of());
        }
        if (exhaustive) {
            LOG.debug("Pre-filter covered isqrt(N) = {}; N is prime", root);
            return report(n, FactorPair.unsplit(n), Resolution.DETERMINISTIC_PRIME, null, 0, t0, List.of());
        }
        return race(request, t0);
    }

    private FactorizationReport race(FactorizationRequest request, long t0) {
        BigInteger n = request.n();
        RaceContext race = RaceContext.open(n);
        List<WorkerHandle> handles = new ArrayList<>();

        try {
            start(handles, race, workers.pMinusOne(workerId(WorkerKind.P_MINUS_1, 0), race));
            for (int seed = 0; seed < request.workerCount(); seed++) {
                start(handles, race, workers.rho(workerId(WorkerKind.RHO, seed), race, seed));
            }
            LOG.debug("Race started with {} workers, timeout {}", handles.size(), request.timeout());
            arbitrate(request, race, handles);
        } finally {
            windDown(race, handles);
        }

        WorkerKind winner = conclude(handles);
        Optional<FactorPair> committed = race.resultSlot().get();
        List<Heartbeat> heartbeats = race.heartbeats().snapshot();
        if (committed.isPresent()) {
            return report(n, committed.get(), Resolution.RACE, winner, handles.size(), t0, heartbeats);
        }
        return report(n, FactorPair.unsplit(n), Resolution.PROBABLE_PRIME, null, handles.size(), t0, heartbeats);
    }

    private void arbitrate(FactorizationRequest request, RaceContext race, List<WorkerHandle> handles) {
        Deadline deadline = Deadline.after(request.timeout());
        Set<WorkerHandle> harvested = new HashSet<>();
        Set<String> reportedStalls = new HashSet<>();
        long nextSeed = request.workerCount();
        int restarts = 0;

        while (!race.resultSlot().isFilled()) {
            for (WorkerHandle h : List.copyOf(handles)) {
                if (!h.isFinished() || !harvested.add(h)) {
                    continue;
                }
                LOG.debug("{} exited: {}", h.workerId(), h.outcome());
                if (h.outcome() != WorkerOutcome.CYCLE_FAILED || race.stopSignal().isRaised()) {
                    continue;
                }
                if (restarts < props.getMaxRhoRestarts() && !deadline.isExpired()) {
                    restarts++;
                    long seed = nextSeed++;
                    AbstractFactorWorker replacement = workers.rho(workerId(WorkerKind.RHO, seed), race, seed);
                    LOG.info("{} closed its cycle; starting {} ({})", h.workerId(),
                            replacement.workerId(), replacement.parameter());
                    start(handles, race, replacement);
                    metrics.incrementRhoRestart();
                } else {
                    LOG.debug("Rho restart budget used ({}); not replacing {}", restarts, h.workerId());
                }
            }

            if (race.resultSlot().isFilled()) {
                break;
            }
            if (handles.stream().allMatch(WorkerHandle::isFinished)) {
                LOG.debug("Every worker exited without a factor");
                break;
            }
            if (deadline.isExpired()) {
                LOG.info("No factor within {}; stopping the race", request.timeout());
                break;
            }

            long waitNanos = Math.min(deadline.remainingNanos(), props.getMonitorInterval().toNanos());
            if (!awaitAny(race, handles, waitNanos)) {
                break;
            }
            logStalls(race, reportedStalls);
        }
    }

    /**
     * Blocks until the slot fills, any running worker exits, or {@code waitNanos} elapse.
     *
     * @return false if the coordinator was interrupted
     */
    private boolean awaitAny(RaceContext race, List<WorkerHandle> handles, long waitNanos) {
        List<CompletableFuture<?>> signals = new ArrayList<>();
        signals.add(race.resultSlot().completion());
        for (WorkerHandle h : handles) {
            if (!h.isFinished()) {
                signals.add(h.completion());
            }
        }
        try {
            CompletableFuture.anyOf(signals.toArray(CompletableFuture[]::new))
                    .get(waitNanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            LOG.trace("Monitor tick after {} ms", waitNanos / Deadline.NANOS_PER_MILLI);
            return true;
        } catch (ExecutionException e) {
            LOG.debug("A worker future completed exceptionally: {}", e.getCause().toString());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for workers; stopping the race");
            return false;
        }
    }

    private void logStalls(RaceContext race, Set<String> reported) {
        for (Heartbeat hb : race.heartbeats().stalled(props.getStallThreshold())) {
            if (reported.add(hb.workerId())) {
                LOG.warn("{} has not reported progress since {} (progress {})",
                        hb.workerId(), hb.lastBeat(), hb.progress());
            }
        }
    }

    private void windDown(RaceContext race, List<WorkerHandle> handles) {
        race.stopSignal().raise();
        Deadline grace = Deadline.after(props.getGracePeriod());
        for (WorkerHandle h : handles) {
            if (!h.join(Duration.ofNanos(grace.remainingNanos()))) {
                LOG.warn("{} did not exit within the grace period; abandoning it", h.workerId());
            }
        }
    }

    private WorkerKind conclude(List<WorkerHandle> handles) {
        WorkerKind winner = null;
        for (WorkerHandle h : handles) {
            WorkerOutcome outcome = h.outcome();
            if (outcome == null) {
                metrics.incrementAbandoned(h.kind());
                continue;
            }
            metrics.recordWorkerOutcome(h.kind(), outcome);
            if (outcome == WorkerOutcome.WON) {
                winner = h.kind();
            } else if (outcome == WorkerOutcome.FAULTED) {
                Throwable cause = h.fault();
                String message = cause == null ? "terminated abnormally" : cause.toString();
                publisher.publishEvent(new WorkerFaultEvent(h.workerId(), h.kind(), Instant.now(), message, cause));
            }
        }
        return winner;
    }

    private void start(List<WorkerHandle> handles, RaceContext race, AbstractFactorWorker worker) {
        race.heartbeats().register(worker.workerId());
        WorkerHandle handle = new WorkerHandle(worker);
        handle.start(executor);
        handles.add(handle);
    }

    private static String workerId(WorkerKind kind, long index) {
        return kind.label() + "#" + index;
    }

    private static FactorizationReport report(BigInteger n, FactorPair pair, Resolution resolution,
                                              WorkerKind winner, int workersStarted, long t0,
                                              List<Heartbeat> heartbeats) {
        return new FactorizationReport(n, pair, resolution, winner, workersStarted,
                Deadline.elapsedSince(t0), heartbeats);
    }
}
