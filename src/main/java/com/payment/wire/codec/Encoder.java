package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Writes a Java value as its wire JSON.
 */
@FunctionalInterface
public interface Encoder<T> {

    JsonNode encode(T value, EncodeStyle style);
}
