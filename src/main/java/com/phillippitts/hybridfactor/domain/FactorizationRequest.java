package com.phillippitts.hybridfactor.domain;

import com.phillippitts.hybridfactor.exception.InvalidFactorizationRequestException;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Immutable parameters of one factorization call.
 *
 * @param n number to split (must be positive)
 * @param trialLimit largest divisor the sequential pre-filter tries
 * @param workerCount number of Pollard rho workers raced next to the p-1 worker
 * @param timeout how long the coordinator waits for a racing worker to commit a factor
 * @throws InvalidFactorizationRequestException if any value is outside its valid domain
 */
public record FactorizationRequest(BigInteger n, long trialLimit, int workerCount, Duration timeout) {

    public FactorizationRequest {
        if (n == null || n.signum() <= 0) {
            throw new InvalidFactorizationRequestException("n", "must be a positive integer (was " + n + ")");
        }
        if (trialLimit < 1) {
            throw new InvalidFactorizationRequestException("trialLimit", "must be positive (was " + trialLimit + ")");
        }
        if (workerCount < 1) {
            throw new InvalidFactorizationRequestException("workerCount", "must be at least 1 (was " + workerCount + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new InvalidFactorizationRequestException("timeout", "must be a positive duration (was " + timeout + ")");
        }
    }

    public static FactorizationRequest of(long n, long trialLimit, int workerCount, Duration timeout) {
        return new FactorizationRequest(BigInteger.valueOf(n), trialLimit, workerCount, timeout);
    }
}
