package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A discount definition. The API sets at most one of {@code amountOff} and {@code percentOff};
 * that is only checked when strict exclusivity is switched on.
 */
@Value
@Builder(toBuilder = true)
public class Coupon {

    public static final String OBJECT = "coupon";

    @NonNull String id;
    @NonNull Instant created;
    @NonNull CouponDuration duration;
    PosInt amountOff;
    /** Currency of {@code amountOff}. */
    String currency;
    PosInt percentOff;
    PosInt durationInMonths;
    PosInt maxRedemptions;
    @NonNull @Builder.Default NonNegInt timesRedeemed = NonNegInt.ZERO;
    Instant redeemBy;
    @Builder.Default boolean valid = true;
    @Builder.Default boolean livemode = false;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
