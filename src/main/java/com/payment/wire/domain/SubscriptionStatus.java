package com.payment.wire.domain;

/**
 * Lifecycle states of a subscription.
 */
public enum SubscriptionStatus implements WireEnum {
    /** In the trial period; no charge yet. */
    TRIALING("trialing"),
    ACTIVE("active"),
    /** Latest invoice payment failed; retries pending. */
    PAST_DUE("past_due"),
    CANCELED("canceled"),
    /** Retries exhausted, subscription kept but not charged. */
    UNPAID("unpaid");

    private final String wireValue;

    SubscriptionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
