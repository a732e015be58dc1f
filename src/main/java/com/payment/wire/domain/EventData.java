package com.payment.wire.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * {@code data} member of an event. {@code object} is the payload itself; {@code previousAttributes}
 * is the raw JSON of changed fields on {@code *.updated} events.
 */
@Value
@Builder(toBuilder = true)
public class EventData<T> {
    @NonNull T object;
    JsonNode previousAttributes;
}
