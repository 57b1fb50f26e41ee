package com.phillippitts.hybridfactor.domain;

import com.phillippitts.hybridfactor.service.race.Heartbeat;
import com.phillippitts.hybridfactor.service.worker.WorkerKind;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Answer of one factorization call together with how it was reached.
 *
 * @param n the factored number
 * @param pair the factor pair returned to the caller
 * @param resolution path that produced {@code pair}
 * @param winner algorithm of the worker whose factor was committed, or null when no worker won
 * @param workersStarted number of worker threads started, replacements included
 * @param elapsed wall-clock time of the call
 * @param heartbeats last heartbeat of every worker at the end of the race (empty without a race)
 */
public record FactorizationReport(
        BigInteger n,
        FactorPair pair,
        Resolution resolution,
        WorkerKind winner,
        int workersStarted,
        Duration elapsed,
        List<Heartbeat> heartbeats
) {
    public FactorizationReport {
        Objects.requireNonNull(n, "n");
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(elapsed, "elapsed");
        heartbeats = heartbeats == null ? List.of() : List.copyOf(heartbeats);
    }
}
