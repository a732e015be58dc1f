package com.payment.wire.domain;

/**
 * How long a coupon's discount applies once redeemed.
 */
public enum CouponDuration implements WireEnum {
    FOREVER("forever"),
    ONCE("once"),
    /** Applies for {@code duration_in_months} months. */
    REPEATING("repeating");

    private final String wireValue;

    CouponDuration(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
