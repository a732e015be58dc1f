package com.payment.wire.codec;

/**
 * How expandable references are written.
 */
public enum EncodeStyle {
    /** Write references as held: embedded objects stay embedded. Mirrors API responses. */
    RESPONSE,
    /** Write every reference as its id; the API rejects embedded objects in request bodies. */
    REQUEST
}
