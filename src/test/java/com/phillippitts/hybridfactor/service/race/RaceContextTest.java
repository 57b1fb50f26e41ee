package com.phillippitts.hybridfactor.service.race;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaceContextTest {

    @Test
    void shouldOpenFreshStatePerRace() {
        RaceContext first = RaceContext.open(BigInteger.valueOf(15));
        RaceContext second = RaceContext.open(BigInteger.valueOf(15));

        first.stopSignal().raise();

        assertThat(second.stopSignal().isRaised()).isFalse();
        assertThat(first.resultSlot()).isNotSameAs(second.resultSlot());
        assertThat(first.heartbeats()).isNotSameAs(second.heartbeats());
    }

    @Test
    void shouldRejectSlotForAnotherNumber() {
        assertThatThrownBy(() -> new RaceContext(BigInteger.valueOf(15), new StopSignal(),
                new ResultSlot(BigInteger.valueOf(21)), new HeartbeatRegistry()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
