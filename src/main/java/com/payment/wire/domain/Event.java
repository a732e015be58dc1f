package com.payment.wire.domain;

import com.payment.wire.scalar.NonNegInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Webhook / events API envelope. {@code eventType} (wire name {@code type}) is a plain string so that
 * event types this model does not know still decode; it tells the caller which payload codec to use.
 *
 * @param <T> payload entity
 */
@Value
@Builder(toBuilder = true)
public class Event<T> {

    public static final String OBJECT = "event";

    @NonNull String id;
    @NonNull Instant created;
    @NonNull String eventType;
    @NonNull EventData<T> data;
    @Builder.Default boolean livemode = false;
    @NonNull @Builder.Default NonNegInt pendingWebhooks = NonNegInt.ZERO;
    String apiVersion;
    String request;
}
