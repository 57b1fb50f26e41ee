package com.phillippitts.hybridfactor.service.worker;

/**
 * Why a worker's loop exited.
 */
public enum WorkerOutcome {
    /** Found a factor and filled the result slot. */
    WON,
    /** Found a valid factor but another worker had already filled the slot. */
    LOST_RACE,
    /** Used up its bound or iteration budget without a factor. */
    EXHAUSTED,
    /** Rho sequence closed its cycle modulo N (gcd == N); a new constant may succeed. */
    CYCLE_FAILED,
    /** Observed the stop signal. */
    CANCELLED,
    /** Stopped on an unexpected exception. */
    FAULTED
}
