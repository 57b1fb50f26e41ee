package com.phillippitts.hybridfactor.domain;

/**
 * How a factorization call reached its answer.
 */
public enum Resolution {
    /** N = 1. */
    TRIVIAL,
    /** The sequential pre-filter found a divisor. */
    TRIAL_DIVISION,
    /** The pre-filter covered every candidate up to sqrt(N): N is prime. */
    DETERMINISTIC_PRIME,
    /** A racing worker committed a factor. */
    RACE,
    /** The race ended without a factor; N is treated as probably prime. */
    PROBABLE_PRIME
}
