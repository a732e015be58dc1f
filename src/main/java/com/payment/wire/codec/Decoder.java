package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.error.DecodeException;

/**
 * Turns one JSON value into a validated Java value.
 */
@FunctionalInterface
public interface Decoder<T> {

    /**
     * @param node the JSON value; never Java {@code null}, may be a JSON null node
     * @param ctx  path of {@code node} from the entity root
     * @throws DecodeException naming {@code ctx}'s path (or a child path) when the value is not acceptable
     */
    T decode(JsonNode node, DecodeContext ctx);
}
