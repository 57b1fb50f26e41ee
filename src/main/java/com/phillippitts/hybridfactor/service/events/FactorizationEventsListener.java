package com.phillippitts.hybridfactor.service.events;

import com.phillippitts.hybridfactor.domain.Resolution;
import com.phillippitts.hybridfactor.service.orchestration.event.FactorizationCompletedEvent;
import com.phillippitts.hybridfactor.service.orchestration.event.WorkerFaultEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for race events. Throttled per key to avoid log spam when the same
 * worker fault repeats across calls.
 */
@Component
class FactorizationEventsListener {
    private static final Logger LOG = LogManager.getLogger(FactorizationEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onWorkerFault(WorkerFaultEvent e) {
        String key = "fault-" + e.kind().label() + '-' + faultType(e);
        if (shouldLog(key)) {
            LOG.warn("Worker {} ({}) faulted: {}. The race continued without it.",
                    e.workerId(), e.kind().label(), e.message(), e.cause());
        }
    }

    @EventListener
    void onFactorizationCompleted(FactorizationCompletedEvent e) {
        if (e.report().resolution() == Resolution.PROBABLE_PRIME && shouldLog("probable-prime")) {
            LOG.info("Race {} ended without a factor after {} ms; consider a longer timeout "
                    + "if composites are expected", e.raceId(), e.report().elapsed().toMillis());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    private static String faultType(WorkerFaultEvent e) {
        return e.cause() == null ? "unknown" : e.cause().getClass().getSimpleName();
    }
}
