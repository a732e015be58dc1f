package com.payment.wire.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of the type-only pre-decode of an event: enough to pick the payload codec
 * without decoding the payload.
 */
@Value
@Builder
public class EventProbe {
    @NonNull String id;
    @NonNull String eventType;
    /** {@code object} tag of the payload, when the payload sends one. */
    String payloadObject;
}
