package com.phillippitts.hybridfactor.service.orchestration.event;

import com.phillippitts.hybridfactor.service.worker.WorkerKind;

import java.time.Instant;

/**
 * Published when a racing worker stopped on an unexpected exception.
 *
 * <p>The race itself is unaffected; the caller still receives a valid pair.
 */
public record WorkerFaultEvent(
        String workerId,
        WorkerKind kind,
        Instant at,
        String message,
        Throwable cause
) {
    public WorkerFaultEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
