package com.phillippitts.hybridfactor.service.race;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The state shared by every worker of one race: the number being split, the stop signal,
 * the result slot and the heartbeat registry. A fresh context is opened per factorization
 * call and dropped when the call returns.
 */
public record RaceContext(
        BigInteger n,
        StopSignal stopSignal,
        ResultSlot resultSlot,
        HeartbeatRegistry heartbeats
) {
    public RaceContext {
        Objects.requireNonNull(n, "n");
        Objects.requireNonNull(stopSignal, "stopSignal");
        Objects.requireNonNull(resultSlot, "resultSlot");
        Objects.requireNonNull(heartbeats, "heartbeats");
        if (!resultSlot.n().equals(n)) {
            throw new IllegalArgumentException("result slot belongs to " + resultSlot.n() + ", not " + n);
        }
    }

    public static RaceContext open(BigInteger n) {
        return new RaceContext(n, new StopSignal(), new ResultSlot(n), new HeartbeatRegistry());
    }
}
