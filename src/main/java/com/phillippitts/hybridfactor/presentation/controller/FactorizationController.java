package com.phillippitts.hybridfactor.presentation.controller;

import com.phillippitts.hybridfactor.config.properties.FactorizationProperties;
import com.phillippitts.hybridfactor.domain.FactorizationReport;
import com.phillippitts.hybridfactor.domain.FactorizationRequest;
import com.phillippitts.hybridfactor.exception.InvalidFactorizationRequestException;
import com.phillippitts.hybridfactor.service.orchestration.HybridFactorizer;
import com.phillippitts.hybridfactor.service.race.Heartbeat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * HTTP entry point: {@code GET /api/factor?n=...}.
 *
 * <p>Numbers travel as decimal strings so values beyond 2^53 survive JSON clients.
 */
@RestController
@RequestMapping("/api")
class FactorizationController {

    private final HybridFactorizer factorizer;
    private final FactorizationProperties props;

    FactorizationController(HybridFactorizer factorizer, FactorizationProperties props) {
        this.factorizer = factorizer;
        this.props = props;
    }

    @GetMapping("/factor")
    ResponseEntity<FactorizationResponse> factor(@RequestParam("n") String n,
                                                 @RequestParam(value = "trialLimit", required = false) Long trialLimit,
                                                 @RequestParam(value = "workerCount", required = false) Integer workerCount,
                                                 @RequestParam(value = "timeoutMs", required = false) Long timeoutMs) {
        FactorizationRequest request = new FactorizationRequest(
                parse(n),
                trialLimit != null ? trialLimit : props.getTrialLimit(),
                workerCount != null ? workerCount : props.getWorkerCount(),
                timeoutMs != null ? Duration.ofMillis(timeoutMs) : props.getTimeout());
        return ResponseEntity.ok(FactorizationResponse.from(factorizer.factorizeWithReport(request)));
    }

    private static BigInteger parse(String n) {
        try {
            return new BigInteger(n.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFactorizationRequestException("n", "must be a decimal integer", e);
        }
    }

    record FactorizationResponse(
            String n,
            String p,
            String q,
            String resolution,
            String winner,
            int workersStarted,
            long elapsedMs,
            List<WorkerStatus> workers
    ) {
        static FactorizationResponse from(FactorizationReport report) {
            return new FactorizationResponse(
                    report.n().toString(),
                    report.pair().p().toString(),
                    report.pair().q().toString(),
                    report.resolution().name(),
                    report.winner() == null ? null : report.winner().label(),
                    report.workersStarted(),
                    report.elapsed().toMillis(),
                    report.heartbeats().stream().map(WorkerStatus::from).toList());
        }
    }

    record WorkerStatus(String workerId, long progress, String lastBeat, boolean finished) {
        static WorkerStatus from(Heartbeat hb) {
            return new WorkerStatus(hb.workerId(), hb.progress(), hb.lastBeat().toString(), hb.finished());
        }
    }
}
