package com.phillippitts.hybridfactor.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DeadlineTest {

    @Test
    void shouldExpireAfterBudget() {
        Deadline deadline = Deadline.after(Duration.ofMillis(50));

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remainingNanos()).isPositive();

        await().atMost(Duration.ofSeconds(2)).until(deadline::isExpired);
        assertThat(deadline.remainingNanos()).isZero();
    }

    @Test
    void shouldBeExpiredForZeroBudget() {
        assertThat(Deadline.after(Duration.ZERO).isExpired()).isTrue();
    }

    @Test
    void shouldSaturateHugeBudgets() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remainingNanos()).isGreaterThan(Duration.ofDays(365).toNanos());
    }

    @Test
    void shouldMeasureElapsedTime() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(20);

        assertThat(Deadline.elapsedSince(start)).isGreaterThanOrEqualTo(Duration.ofMillis(20));
    }
}
