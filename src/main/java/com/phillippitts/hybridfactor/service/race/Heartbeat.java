package com.phillippitts.hybridfactor.service.race;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of one worker's liveness entry.
 *
 * @param workerId worker identity
 * @param progress work units completed so far (never decreases)
 * @param lastBeat when the worker last reported progress
 * @param finished whether the worker's loop has exited
 */
public record Heartbeat(String workerId, long progress, Instant lastBeat, boolean finished) {
    public Heartbeat {
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(lastBeat, "lastBeat");
    }
}
