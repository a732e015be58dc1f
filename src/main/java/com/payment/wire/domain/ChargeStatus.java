package com.payment.wire.domain;

/**
 * Outcome of a charge attempt.
 */
public enum ChargeStatus implements WireEnum {
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String wireValue;

    ChargeStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
