package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Event;
import com.payment.wire.domain.EventData;
import com.payment.wire.error.DecodeException;
import com.payment.wire.scalar.NonNegInt;

/**
 * Event envelope over a payload codec the caller chose from the event's {@code type}
 * (see {@link EventProbeCodec} and {@link EventPayloads}). A payload of the wrong kind fails on its
 * {@code object} tag with TYPE_MISMATCH.
 */
public final class EventCodec<T> implements Decoder<Event<T>>, Encoder<Event<T>> {

    private final Decoder<T> payloadDecoder;
    private final Encoder<T> payloadEncoder;

    public EventCodec(Decoder<T> payloadDecoder, Encoder<T> payloadEncoder) {
        this.payloadDecoder = payloadDecoder;
        this.payloadEncoder = payloadEncoder;
    }

    @Override
    public Event<T> decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Event.OBJECT);
        return Event.<T>builder()
                .id(r.string("id"))
                .created(r.timestamp("created"))
                .eventType(r.string("type"))
                .data(r.required("data", this::decodeData))
                .livemode(r.bool("livemode", false))
                .pendingWebhooks(r.nonNegInt("pending_webhooks", NonNegInt.ZERO))
                .apiVersion(r.optString("api_version"))
                .request(r.optional("request", EventCodec::decodeRequest))
                .build();
    }

    private EventData<T> decodeData(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.of(node, ctx);
        return EventData.<T>builder()
                .object(r.required("object", payloadDecoder))
                .previousAttributes(r.raw("previous_attributes"))
                .build();
    }

    // Newer API versions send {"id": ..., "idempotency_key": ...} instead of the bare request id.
    private static String decodeRequest(JsonNode node, DecodeContext ctx) {
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isObject()) {
            return FieldReader.of(node, ctx).optString("id");
        }
        throw DecodeException.typeMismatch(ctx.getPath(), "string or object", ScalarCodecs.describe(node));
    }

    @Override
    public JsonNode encode(Event<T> event, EncodeStyle style) {
        JsonNode data = WireObject.create(style)
                .put("object", event.getData().getObject(), payloadEncoder)
                .put("previous_attributes", event.getData().getPreviousAttributes())
                .build();
        return WireObject.tagged(Event.OBJECT, style)
                .put("id", event.getId())
                .put("created", event.getCreated())
                .put("type", event.getEventType())
                .put("data", data)
                .put("livemode", event.isLivemode())
                .put("pending_webhooks", event.getPendingWebhooks())
                .put("api_version", event.getApiVersion())
                .put("request", event.getRequest())
                .build();
    }
}
