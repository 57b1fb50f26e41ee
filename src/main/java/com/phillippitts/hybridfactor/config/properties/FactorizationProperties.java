package com.phillippitts.hybridfactor.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Defaults and tuning knobs for the factorization race ({@code factor.*}).
 *
 * <p>{@code trialLimit}, {@code workerCount} and {@code timeout} are the values used when a
 * caller omits them; the rest tune the workers and the coordinator.
 */
@ConfigurationProperties(prefix = "factor")
@Validated
public class FactorizationProperties {

    /** Largest divisor tried by the sequential pre-filter. */
    @Positive(message = "Trial limit must be positive")
    private long trialLimit = 1000;

    /** Number of rho workers raced next to the p-1 worker. */
    @Positive(message = "Worker count must be positive")
    private int workerCount = 4;

    /** Upper bound accepted for a caller-supplied worker count. */
    @Positive(message = "Max worker count must be positive")
    private int maxWorkerCount = 64;

    /** How long the coordinator waits for a committed factor. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    /** Total time granted to workers to exit after the stop signal. */
    @NotNull
    private Duration gracePeriod = Duration.ofMillis(100);

    /** Upper bound on one coordinator wait between liveness checks. */
    @NotNull
    private Duration monitorInterval = Duration.ofSeconds(1);

    /** Heartbeat age after which a running worker is logged as stalled. */
    @NotNull
    private Duration stallThreshold = Duration.ofSeconds(2);

    /** Replacement rho workers a single race may start after closed cycles. */
    @PositiveOrZero(message = "Max rho restarts must not be negative")
    private int maxRhoRestarts = 8;

    @Valid
    private PMinusOne pMinusOne = new PMinusOne();

    @Valid
    private Rho rho = new Rho();

    @AssertTrue(message = "timeout, monitor-interval and stall-threshold must be positive; grace-period must not be negative")
    public boolean isDurationsValid() {
        return isPositive(timeout) && isPositive(monitorInterval) && isPositive(stallThreshold)
                && gracePeriod != null && !gracePeriod.isNegative();
    }

    @AssertTrue(message = "worker-count must not exceed max-worker-count")
    public boolean isWorkerCountWithinMax() {
        return workerCount <= maxWorkerCount;
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    public long getTrialLimit() {
        return trialLimit;
    }

    public void setTrialLimit(long trialLimit) {
        this.trialLimit = trialLimit;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getMaxWorkerCount() {
        return maxWorkerCount;
    }

    public void setMaxWorkerCount(int maxWorkerCount) {
        this.maxWorkerCount = maxWorkerCount;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
    }

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public void setMonitorInterval(Duration monitorInterval) {
        this.monitorInterval = monitorInterval;
    }

    public Duration getStallThreshold() {
        return stallThreshold;
    }

    public void setStallThreshold(Duration stallThreshold) {
        this.stallThreshold = stallThreshold;
    }

    public int getMaxRhoRestarts() {
        return maxRhoRestarts;
    }

    public void setMaxRhoRestarts(int maxRhoRestarts) {
        this.maxRhoRestarts = maxRhoRestarts;
    }

    public PMinusOne getPMinusOne() {
        return pMinusOne;
    }

    public void setPMinusOne(PMinusOne pMinusOne) {
        this.pMinusOne = pMinusOne;
    }

    public Rho getRho() {
        return rho;
    }

    public void setRho(Rho rho) {
        this.rho = rho;
    }

    /**
     * Pollard p-1 bound schedule ({@code factor.p-minus-one.*}).
     */
    public static class PMinusOne {

        @Min(value = 2, message = "Baseline bound must be at least 2")
        private int baselineBound = 1000;

        @Min(value = 2, message = "Max bound must be at least 2")
        private int maxBound = 100_000;

        @Positive(message = "Escalation factor must be positive")
        private int escalationFactor = 10;

        @Positive(message = "Batch size must be positive")
        private int batchSize = 32;

        public int getBaselineBound() {
            return baselineBound;
        }

        public void setBaselineBound(int baselineBound) {
            this.baselineBound = baselineBound;
        }

        public int getMaxBound() {
            return maxBound;
        }

        public void setMaxBound(int maxBound) {
            this.maxBound = maxBound;
        }

        public int getEscalationFactor() {
            return escalationFactor;
        }

        public void setEscalationFactor(int escalationFactor) {
            this.escalationFactor = escalationFactor;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * Pollard rho sequence settings ({@code factor.rho.*}).
     */
    public static class Rho {

        @PositiveOrZero(message = "Start value must not be negative")
        private long startValue = 2;

        @Positive(message = "Max iterations must be positive")
        private long maxIterations = 2_000_000;

        @Positive(message = "Batch size must be positive")
        private int batchSize = 64;

        public long getStartValue() {
            return startValue;
        }

        public void setStartValue(long startValue) {
            this.startValue = startValue;
        }

        public long getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(long maxIterations) {
            this.maxIterations = maxIterations;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
