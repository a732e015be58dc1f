package com.payment.wire.scalar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NonNegIntTest {

    @Test
    void acceptsZero() {
        assertThat(NonNegInt.of(0)).isSameAs(NonNegInt.ZERO);
        assertThat(NonNegInt.check(0)).isEmpty();
    }

    @Test
    void acceptsPositive() {
        assertThat(NonNegInt.of(2000).getValue()).isEqualTo(2000);
    }

    @Test
    void rejectsMinusOne() {
        assertThatThrownBy(() -> NonNegInt.of(-1))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("must be >= 0");
    }
}
