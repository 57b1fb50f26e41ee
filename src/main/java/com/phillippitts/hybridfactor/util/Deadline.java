package com.phillippitts.hybridfactor.util;

import java.time.Duration;

/**
 * Monotonic deadline built on {@link System#nanoTime()}.
 *
 * <p>Typical usage:
 * <pre>
 * Deadline deadline = Deadline.after(Duration.ofSeconds(5));
 * while (!deadline.isExpired()) {
 *     future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class Deadline {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private final long deadlineNanos;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a deadline {@code budget} from now. Budgets too large for a nanosecond
     * offset saturate instead of overflowing.
     */
    public static Deadline after(Duration budget) {
        long now = System.nanoTime();
        long offset;
        try {
            offset = budget.toNanos();
        } catch (ArithmeticException e) {
            offset = Long.MAX_VALUE;
        }
        long target = now + offset;
        if (offset > 0 && target < now) {
            target = Long.MAX_VALUE;
        }
        return new Deadline(target);
    }

    /** Nanoseconds left, never negative. */
    public long remainingNanos() {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    /** Elapsed time since a {@link System#nanoTime()} timestamp. */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
