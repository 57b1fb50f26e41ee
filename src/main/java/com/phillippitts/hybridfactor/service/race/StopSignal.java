package com.phillippitts.hybridfactor.service.race;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monotonic cancellation flag shared by the coordinator and every worker of one race.
 *
 * <p>Starts lowered, can be raised by any party, and is never lowered again.
 */
public final class StopSignal {

    private final AtomicBoolean raised = new AtomicBoolean(false);

    /**
     * Raises the signal.
     *
     * @return true if this call performed the transition, false if it was already raised
     */
    public boolean raise() {
        return raised.compareAndSet(false, true);
    }

    public boolean isRaised() {
        return raised.get();
    }

    @Override
    public String toString() {
        return "StopSignal[raised=" + raised.get() + "]";
    }
}
