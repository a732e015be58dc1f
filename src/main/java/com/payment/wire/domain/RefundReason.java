package com.payment.wire.domain;

/**
 * Why a refund was issued, when the merchant gave a reason.
 */
public enum RefundReason implements WireEnum {
    DUPLICATE("duplicate"),
    FRAUDULENT("fraudulent"),
    REQUESTED_BY_CUSTOMER("requested_by_customer");

    private final String wireValue;

    RefundReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
