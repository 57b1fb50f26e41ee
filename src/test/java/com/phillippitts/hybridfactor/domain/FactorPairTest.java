package com.phillippitts.hybridfactor.domain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactorPairTest {

    @Test
    void shouldOrderPairFromEitherDivisor() {
        FactorPair fromSmall = FactorPair.of(BigInteger.valueOf(3), BigInteger.valueOf(15));
        FactorPair fromLarge = FactorPair.of(BigInteger.valueOf(5), BigInteger.valueOf(15));

        assertThat(fromSmall).isEqualTo(pair(3, 5));
        assertThat(fromLarge).isEqualTo(pair(3, 5));
        assertThat(fromSmall.product()).isEqualTo(BigInteger.valueOf(15));
        assertThat(fromSmall.isSplit()).isTrue();
    }

    @Test
    void shouldRejectNonDivisor() {
        assertThatThrownBy(() -> FactorPair.of(BigInteger.valueOf(4), BigInteger.valueOf(15)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not divide");
    }

    @Test
    void shouldRejectUnorderedOrNonPositiveFactors() {
        assertThatThrownBy(() -> pair(5, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pair(0, 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pair(-1, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBuildConventionalUnsplitPairs() {
        assertThat(FactorPair.unit()).isEqualTo(pair(1, 1));
        assertThat(FactorPair.unsplit(BigInteger.valueOf(97))).isEqualTo(pair(1, 97));
        assertThat(FactorPair.unsplit(BigInteger.valueOf(97)).isSplit()).isFalse();
    }

    private static FactorPair pair(long p, long q) {
        return new FactorPair(BigInteger.valueOf(p), BigInteger.valueOf(q));
    }
}
