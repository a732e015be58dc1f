package com.payment.wire.domain;

/**
 * Billing frequency unit of a plan.
 */
public enum PlanInterval implements WireEnum {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String wireValue;

    PlanInterval(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
