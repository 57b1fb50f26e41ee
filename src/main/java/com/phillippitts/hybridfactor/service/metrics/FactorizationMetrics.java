package com.phillippitts.hybridfactor.service.metrics;

import com.phillippitts.hybridfactor.domain.Resolution;
import com.phillippitts.hybridfactor.service.worker.WorkerKind;
import com.phillippitts.hybridfactor.service.worker.WorkerOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for factorization calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Call latency per resolution (trial division, race, probable prime, ...)</li>
 *   <li>Resolution counts</li>
 *   <li>Worker outcomes per algorithm</li>
 *   <li>Rho workers replaced after a closed cycle, and workers abandoned after wind-down</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class FactorizationMetrics {

    private static final String METRIC_PREFIX = "hybridfactor";

    private final MeterRegistry registry;

    public FactorizationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall-clock time of one factorization call.
     *
     * @param resolution path that produced the answer
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(Resolution resolution, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to factor a number")
                .tag("resolution", tag(resolution))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementResolution(Resolution resolution) {
        Counter.builder(METRIC_PREFIX + ".resolution")
                .description("Number of factorization calls by resolution")
                .tag("resolution", tag(resolution))
                .register(registry)
                .increment();
    }

    /**
     * Counts how a worker's loop exited.
     *
     * @param kind algorithm of the worker
     * @param outcome exit reason
     */
    public void recordWorkerOutcome(WorkerKind kind, WorkerOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".worker.outcome")
                .description("Number of finished workers by algorithm and outcome")
                .tag("kind", kind.label())
                .tag("outcome", tag(outcome))
                .register(registry)
                .increment();
    }

    public void incrementRhoRestart() {
        Counter.builder(METRIC_PREFIX + ".rho.restart")
                .description("Number of rho workers started to replace a closed cycle")
                .register(registry)
                .increment();
    }

    /** Counts a worker still running when the grace period ran out. */
    public void incrementAbandoned(WorkerKind kind) {
        Counter.builder(METRIC_PREFIX + ".worker.abandoned")
                .description("Number of workers that did not exit within the grace period")
                .tag("kind", kind.label())
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
