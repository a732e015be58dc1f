package com.payment.wire.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecodeResultTest {

    @Test
    void successMapsValue() {
        DecodeResult<Integer> result = DecodeResult.success("4242").map(String::length);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).contains(4);
        assertThat(result.getError()).isEmpty();
    }

    @Test
    void failureKeepsErrorThroughMap() {
        DecodeException error = DecodeException.missingField("card.last4");
        DecodeResult<Integer> result = DecodeResult.<String>failure(error).map(String::length);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).containsSame(error);
        assertThatThrownBy(result::orElseThrow).isSameAs(error);
    }

    @Test
    void messageNamesKindAndPath() {
        DecodeException error = DecodeException.typeMismatch("customer.sources.data[2].exp_year", "integer", "string");

        assertThat(error.getKind()).isEqualTo(DecodeErrorKind.TYPE_MISMATCH);
        assertThat(error.getMessage()).startsWith("TYPE_MISMATCH at customer.sources.data[2].exp_year: ");
    }
}
