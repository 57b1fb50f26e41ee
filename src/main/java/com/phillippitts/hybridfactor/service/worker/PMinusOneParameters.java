package com.phillippitts.hybridfactor.service.worker;

import java.util.ArrayList;
import java.util.List;

/**
 * Bound schedule of the Pollard p-1 worker.
 *
 * @param baselineBound first smoothness bound B
 * @param maxBound largest bound the schedule escalates to
 * @param escalationFactor multiplier between consecutive bounds (1 runs the baseline only)
 * @param batchSize prime powers applied between two gcd checks
 */
public record PMinusOneParameters(int baselineBound, int maxBound, int escalationFactor, int batchSize) {

    public PMinusOneParameters {
        if (baselineBound < 2) {
            throw new IllegalArgumentException("baselineBound must be at least 2: " + baselineBound);
        }
        if (maxBound < baselineBound) {
            throw new IllegalArgumentException("maxBound must be >= baselineBound: " + maxBound);
        }
        if (escalationFactor < 1) {
            throw new IllegalArgumentException("escalationFactor must be positive: " + escalationFactor);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
    }

    /** A single-stage schedule with bound {@code b}. */
    public static PMinusOneParameters singleBound(int b, int batchSize) {
        return new PMinusOneParameters(b, b, 1, batchSize);
    }

    /**
     * Ascending bounds: baseline, baseline * factor, ... capped by and always ending at
     * {@code maxBound}.
     */
    public List<Integer> bounds() {
        List<Integer> bounds = new ArrayList<>();
        long b = baselineBound;
        while (b < maxBound && escalationFactor > 1) {
            bounds.add((int) b);
            b *= escalationFactor;
        }
        bounds.add(maxBound);
        return bounds;
    }
}
