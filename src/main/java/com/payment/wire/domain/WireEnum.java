package com.payment.wire.domain;

/**
 * A closed enumeration whose constants map one-to-one onto API string tags.
 * Tag spellings are part of the wire contract and must not change.
 */
public interface WireEnum {

    String getWireValue();
}
