package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Event;
import com.payment.wire.domain.EventProbe;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps event types to the codec of their payload, by type prefix. Longer prefixes are listed
 * first so {@code customer.subscription.created} resolves to subscriptions, not customers.
 * Types this model does not know resolve to empty rather than failing.
 */
public final class EventPayloads {

    private static final Map<String, Codec<?>> BY_PREFIX = new LinkedHashMap<>();

    static {
        // disputes are not modelled
        BY_PREFIX.put("charge.dispute.", null);
        BY_PREFIX.put("charge.", Codecs.charge());
        BY_PREFIX.put("customer.subscription.", Codecs.subscription());
        BY_PREFIX.put("customer.discount.", Codecs.discount());
        BY_PREFIX.put("customer.source.", Codecs.card());
        BY_PREFIX.put("customer.card.", Codecs.card());
        BY_PREFIX.put("customer.", Codecs.customer());
        BY_PREFIX.put("invoiceitem.", Codecs.invoiceItem());
        BY_PREFIX.put("invoice.", Codecs.invoice());
        BY_PREFIX.put("plan.", Codecs.plan());
        BY_PREFIX.put("coupon.", Codecs.coupon());
    }

    private EventPayloads() {}

    public static Optional<Codec<?>> forType(String eventType) {
        for (Map.Entry<String, Codec<?>> entry : BY_PREFIX.entrySet()) {
            if (eventType.startsWith(entry.getKey())) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Probes {@code json} for its type and, when the type is modelled, decodes the full event with
     * the matching payload codec. Empty means the type is not modelled; a malformed event of a
     * modelled type still throws.
     */
    public static Optional<Event<?>> decode(JsonNode json) {
        return decode(json, DecodeOptions.DEFAULT);
    }

    public static Optional<Event<?>> decode(JsonNode json, DecodeOptions options) {
        EventProbe probe = Codecs.eventProbe().decode(json, options);
        Optional<Codec<?>> payload = forType(probe.getEventType());
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(decodeWith(payload.get(), json, options));
    }

    private static <T> Event<T> decodeWith(Codec<T> payload, JsonNode json, DecodeOptions options) {
        return Codecs.event(payload).decode(json, options);
    }
}
