package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Event;
import com.payment.wire.domain.EventProbe;

/**
 * Reads only what is needed to route an event: its id, its {@code type} and the payload's
 * {@code object} tag. The payload itself is not decoded, so any event type is accepted.
 */
public final class EventProbeCodec implements Decoder<EventProbe>, Encoder<EventProbe> {

    public static final EventProbeCodec INSTANCE = new EventProbeCodec();

    private EventProbeCodec() {}

    @Override
    public EventProbe decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Event.OBJECT);
        JsonNode payloadTag = node.path("data").path("object").path("object");
        return EventProbe.builder()
                .id(r.string("id"))
                .eventType(r.string("type"))
                .payloadObject(payloadTag.isTextual() ? payloadTag.textValue() : null)
                .build();
    }

    /** Skeleton event carrying the probed fields; used for logging and tests. */
    @Override
    public JsonNode encode(EventProbe probe, EncodeStyle style) {
        WireObject event = WireObject.tagged(Event.OBJECT, style)
                .put("id", probe.getId())
                .put("type", probe.getEventType());
        if (probe.getPayloadObject() != null) {
            JsonNode payload = WireObject.create(style).put("object", probe.getPayloadObject()).build();
            event.put("data", WireObject.create(style).put("object", payload).build());
        }
        return event.build();
    }
}
