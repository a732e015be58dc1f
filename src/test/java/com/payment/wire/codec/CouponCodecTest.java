package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Coupon;
import com.payment.wire.domain.CouponDuration;
import com.payment.wire.error.DecodeErrorKind;
import com.payment.wire.error.DecodeException;
import com.payment.wire.error.DecodeResult;
import org.junit.jupiter.api.Test;

import static com.payment.wire.WireFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CouponCodecTest {

    private static final DecodeOptions STRICT = DecodeOptions.builder().strictExclusivity(true).build();

    private static JsonNode coupon(String discountFields) {
        return json("""
                {"id": "SPRING", "object": "coupon", "created": 1700000000, "duration": "once",
                 %s "times_redeemed": 0, "valid": true}
                """.formatted(discountFields));
    }

    @Test
    void decodesPercentOffCoupon() {
        Coupon coupon = Codecs.coupon().decode(coupon("\"percent_off\": 25,"));

        assertThat(coupon.getDuration()).isEqualTo(CouponDuration.ONCE);
        assertThat(coupon.getPercentOff().getValue()).isEqualTo(25);
        assertThat(coupon.getAmountOff()).isNull();
        assertThat(coupon.isValid()).isTrue();
    }

    @Test
    void bothDiscountsAcceptedByDefault() {
        Coupon coupon = Codecs.coupon().decode(coupon("\"percent_off\": 25, \"amount_off\": 500, \"currency\": \"usd\","));

        assertThat(coupon.getPercentOff()).isNotNull();
        assertThat(coupon.getAmountOff()).isNotNull();
    }

    @Test
    void bothDiscountsRejectedInStrictMode() {
        JsonNode both = coupon("\"percent_off\": 25, \"amount_off\": 500, \"currency\": \"usd\",");

        assertThatThrownBy(() -> Codecs.coupon().decode(both, STRICT))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.VALIDATION_FAILED);
                    assertThat(e.getPath()).isEqualTo("coupon.percent_off");
                });
        assertThat(Codecs.coupon().decode(coupon("\"amount_off\": 500,"), STRICT).getAmountOff().getValue())
                .isEqualTo(500);
    }

    @Test
    void zeroPercentOffFailsValidation() {
        DecodeResult<Coupon> result = Codecs.coupon().tryDecode(coupon("\"percent_off\": 0,"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).get()
                .extracting(DecodeException::getKind)
                .isEqualTo(DecodeErrorKind.VALIDATION_FAILED);
    }

    @Test
    void unknownDurationIsUnknownEnumTag() {
        JsonNode node = json("""
                {"id": "X", "object": "coupon", "created": 1700000000, "duration": "biweekly"}
                """);

        assertThat(Codecs.coupon().tryDecode(node).getError()).get()
                .extracting(DecodeException::getPath)
                .isEqualTo("coupon.duration");
    }
}
