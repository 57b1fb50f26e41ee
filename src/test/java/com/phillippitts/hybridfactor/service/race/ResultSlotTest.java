package com.phillippitts.hybridfactor.service.race;

import com.phillippitts.hybridfactor.domain.FactorPair;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultSlotTest {

    private static final BigInteger N = BigInteger.valueOf(10403);
    private static final FactorPair PAIR = new FactorPair(BigInteger.valueOf(101), BigInteger.valueOf(103));

    @Test
    void shouldAcceptFirstOfferAndRejectLaterOnes() {
        ResultSlot slot = new ResultSlot(N);
        assertThat(slot.isFilled()).isFalse();

        assertThat(slot.offer(PAIR)).isTrue();
        assertThat(slot.offer(PAIR)).isFalse();
        assertThat(slot.get()).contains(PAIR);
    }

    @Test
    void shouldKeepExactlyOnePairWhenWritersCollide() throws InterruptedException {
        ResultSlot slot = new ResultSlot(N);
        int writers = 16;
        CountDownLatch startGate = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        AtomicInteger accepted = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < writers; i++) {
            new Thread(() -> {
                try {
                    startGate.await();
                    if (slot.offer(PAIR)) {
                        accepted.incrementAndGet();
                    }
                } catch (Throwable t) {
                    errors.add(t);
                } finally {
                    done.countDown();
                }
            }).start();
        }
        startGate.countDown();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(errors).isEmpty();
        assertThat(accepted.get()).isEqualTo(1);
        assertThat(slot.get()).contains(PAIR);
    }

    @Test
    void shouldRejectPairsThatDoNotSplitN() {
        ResultSlot slot = new ResultSlot(N);

        assertThatThrownBy(() -> slot.offer(FactorPair.unsplit(N)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> slot.offer(new FactorPair(BigInteger.valueOf(3), BigInteger.valueOf(5))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(slot.isFilled()).isFalse();
    }

    @Test
    void shouldCompleteWaitersWhenFilled() throws Exception {
        ResultSlot slot = new ResultSlot(N);
        CompletableFuture<FactorPair> completion = slot.completion();
        assertThat(completion).isNotDone();

        slot.offer(PAIR);

        assertThat(completion.get(1, TimeUnit.SECONDS)).isEqualTo(PAIR);
    }

    @Test
    void shouldNotLetCallersCompleteTheSlot() {
        ResultSlot slot = new ResultSlot(N);
        slot.completion().cancel(true);

        assertThat(slot.completion()).isNotDone();
        assertThat(slot.offer(PAIR)).isTrue();
    }
}
