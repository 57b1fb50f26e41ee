package com.phillippitts.hybridfactor.service.worker;

import com.phillippitts.hybridfactor.domain.FactorPair;
import com.phillippitts.hybridfactor.service.race.RaceContext;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PollardPMinusOneWorkerTest {

    private static final FactorPair P13_Q17 = new FactorPair(BigInteger.valueOf(13), BigInteger.valueOf(17));

    @Test
    void shouldSplitWhenOneFactorMinusOneIsSmooth() {
        RaceContext race = RaceContext.open(BigInteger.valueOf(13 * 17));
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                PMinusOneParameters.singleBound(50, 1));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.WON);
        assertThat(race.resultSlot().get()).contains(P13_Q17);
        assertThat(race.stopSignal().isRaised()).isTrue();
    }

    @Test
    void shouldReplayBatchThatMadeEveryFactorSmooth() {
        // 12 and 16 both divide the exponent of a single 32-prime batch, so the batch gcd is N
        RaceContext race = RaceContext.open(BigInteger.valueOf(13 * 17));
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                PMinusOneParameters.singleBound(50, 32));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.WON);
        assertThat(race.resultSlot().get()).contains(P13_Q17);
    }

    @Test
    void shouldEscalateBoundUntilFactorIsSmooth() {
        // 101 - 1 = 2^2 * 5^2 needs B >= 25; 1999 - 1 = 2 * 3^3 * 37 needs B >= 37
        RaceContext race = RaceContext.open(BigInteger.valueOf(101L * 1999));
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                new PMinusOneParameters(3, 30, 10, 1));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.WON);
        assertThat(race.resultSlot().get().orElseThrow().p()).isEqualTo(BigInteger.valueOf(101));
    }

    @Test
    void shouldExhaustWhenNoFactorIsSmooth() {
        // 23 - 1 = 2 * 11 and 47 - 1 = 2 * 23
        RaceContext race = RaceContext.open(BigInteger.valueOf(23 * 47));
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                PMinusOneParameters.singleBound(5, 1));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.EXHAUSTED);
        assertThat(race.resultSlot().isFilled()).isFalse();
        assertThat(race.stopSignal().isRaised()).isFalse();
        assertThat(race.heartbeats().progress("p-1#0")).isEqualTo(3);
    }

    @Test
    void shouldStopAtFirstCheckpointOnceSignalRaised() {
        RaceContext race = RaceContext.open(BigInteger.valueOf(23 * 47));
        race.stopSignal().raise();
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                PMinusOneParameters.singleBound(1000, 1));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.CANCELLED);
        assertThat(race.heartbeats().progress("p-1#0")).isEqualTo(1);
        assertThat(race.heartbeats().snapshot()).singleElement()
                .satisfies(hb -> assertThat(hb.finished()).isTrue());
    }

    @Test
    void shouldReportLostRaceWhenSlotAlreadyFilled() {
        RaceContext race = RaceContext.open(BigInteger.valueOf(13 * 17));
        race.resultSlot().offer(P13_Q17);
        PollardPMinusOneWorker worker = new PollardPMinusOneWorker("p-1#0", race,
                PMinusOneParameters.singleBound(50, 1));

        worker.run();

        assertThat(worker.outcome()).isEqualTo(WorkerOutcome.LOST_RACE);
        assertThat(race.stopSignal().isRaised()).isFalse();
    }
}
