package com.phillippitts.hybridfactor.service.orchestration.event;

import com.phillippitts.hybridfactor.domain.FactorizationReport;

import java.util.Objects;

/**
 * Published after every factorization call, whatever its resolution.
 *
 * @param raceId correlation id also present in the call's log lines
 * @param report the answer and how it was reached
 */
public record FactorizationCompletedEvent(String raceId, FactorizationReport report) {

    public FactorizationCompletedEvent {
        Objects.requireNonNull(raceId, "raceId");
        Objects.requireNonNull(report, "report");
    }
}
