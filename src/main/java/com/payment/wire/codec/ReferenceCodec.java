package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.payment.wire.domain.Reference;
import com.payment.wire.error.DecodeException;
import com.payment.wire.scalar.InvalidValueException;

import java.util.function.Function;

/**
 * Codec for expandable references. The variant is chosen from the JSON shape: an object is the
 * embedded entity, a string is the id. Nothing in the payload or the call says which to expect.
 */
public final class ReferenceCodec<T> implements Decoder<Reference<T>>, Encoder<Reference<T>> {

    private final Decoder<T> embeddedDecoder;
    private final Encoder<T> embeddedEncoder;
    private final Function<T, String> idOf;

    private ReferenceCodec(Decoder<T> embeddedDecoder, Encoder<T> embeddedEncoder, Function<T, String> idOf) {
        this.embeddedDecoder = embeddedDecoder;
        this.embeddedEncoder = embeddedEncoder;
        this.idOf = idOf;
    }

    /** Accepts either the id or the embedded object. */
    public static <T> ReferenceCodec<T> expandable(Decoder<T> decoder, Encoder<T> encoder, Function<T, String> idOf) {
        return new ReferenceCodec<>(decoder, encoder, idOf);
    }

    /**
     * Accepts only the id. Used for back references inside an embedded object, where the API never
     * expands a second level. Request-form encoding still collapses an embedded value to its id.
     */
    public static <T> ReferenceCodec<T> idOnly() {
        return new ReferenceCodec<>(null, null, null);
    }

    @Override
    public Reference<T> decode(JsonNode node, DecodeContext ctx) {
        if (node.isObject() && embeddedDecoder != null) {
            T value = embeddedDecoder.decode(node, ctx);
            return Reference.embedded(idOf.apply(value), value);
        }
        if (node.isTextual()) {
            return Reference.id(node.textValue());
        }
        String expected = embeddedDecoder != null ? "id string or embedded object" : "id string";
        throw DecodeException.typeMismatch(ctx.getPath(), expected, ScalarCodecs.describe(node));
    }

    /**
     * Response form writes an embedded value as the object, request form always writes the id.
     *
     * @throws InvalidValueException if an embedded reference's id differs from its value's id, or if an
     *                               embedded value reaches an id-only position in the response form
     */
    @Override
    public JsonNode encode(Reference<T> value, EncodeStyle style) {
        if (value instanceof Reference.Embedded) {
            T embedded = ((Reference.Embedded<T>) value).getValue();
            if (embeddedEncoder == null) {
                if (style == EncodeStyle.RESPONSE) {
                    throw new InvalidValueException("reference " + value.getId()
                            + " can only be an id here but holds an embedded object");
                }
            } else {
                String embeddedId = idOf.apply(embedded);
                if (!value.getId().equals(embeddedId)) {
                    throw new InvalidValueException("reference id " + value.getId()
                            + " does not match embedded object id " + embeddedId);
                }
                if (style == EncodeStyle.RESPONSE) {
                    return embeddedEncoder.encode(embedded, style);
                }
            }
        }
        return JsonNodeFactory.instance.textNode(value.getId());
    }
}
