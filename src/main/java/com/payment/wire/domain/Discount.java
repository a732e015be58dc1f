package com.payment.wire.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A coupon applied to a customer or subscription.
 */
@Value
@Builder(toBuilder = true)
public class Discount {

    public static final String OBJECT = "discount";

    @NonNull Coupon coupon;
    @NonNull String customer;
    @NonNull Instant start;
    /** Wire name {@code end}; null for coupons that last forever. */
    Instant endsAt;
    String subscription;
}
