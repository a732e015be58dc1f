package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payment.wire.domain.NullableField;
import com.payment.wire.domain.WireEnum;
import com.payment.wire.scalar.InvalidValueException;
import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;

import java.time.Instant;
import java.util.List;

/**
 * Builds the wire JSON of one entity. {@code null} values are skipped, so optional fields that
 * were absent or null on decode are simply not written.
 */
public final class WireObject {

    private final ObjectNode node = JsonNodeFactory.instance.objectNode();
    private final EncodeStyle style;

    private WireObject(EncodeStyle style) {
        this.style = style;
    }

    public static WireObject create(EncodeStyle style) {
        return new WireObject(style);
    }

    /** Starts with the entity's {@code object} tag. */
    public static WireObject tagged(String objectTag, EncodeStyle style) {
        return create(style).put("object", objectTag);
    }

    public WireObject put(String name, String value) {
        if (value != null) {
            node.put(name, value);
        }
        return this;
    }

    public WireObject put(String name, long value) {
        node.put(name, value);
        return this;
    }

    public WireObject put(String name, Long value) {
        if (value != null) {
            node.put(name, value.longValue());
        }
        return this;
    }

    public WireObject put(String name, boolean value) {
        node.put(name, value);
        return this;
    }

    /**
     * Written as whole epoch seconds.
     *
     * @throws InvalidValueException if {@code value} has a sub-second part, which the wire cannot carry
     */
    public WireObject put(String name, Instant value) {
        if (value != null) {
            if (value.getNano() != 0) {
                throw new InvalidValueException(name + " must be whole seconds but was " + value);
            }
            node.put(name, value.getEpochSecond());
        }
        return this;
    }

    public WireObject put(String name, PosInt value) {
        if (value != null) {
            node.put(name, value.getValue());
        }
        return this;
    }

    public WireObject put(String name, NonNegInt value) {
        if (value != null) {
            node.put(name, value.getValue());
        }
        return this;
    }

    public WireObject put(String name, WireEnum value) {
        if (value != null) {
            node.put(name, value.getWireValue());
        }
        return this;
    }

    public WireObject put(String name, JsonNode value) {
        if (value != null) {
            node.set(name, value);
        }
        return this;
    }

    public <T> WireObject put(String name, T value, Encoder<T> encoder) {
        if (value != null) {
            node.set(name, encoder.encode(value, style));
        }
        return this;
    }

    /** Absent is skipped, null is written as JSON null. */
    public <T> WireObject put(String name, NullableField<T> value, Encoder<T> encoder) {
        if (value.isNull()) {
            node.putNull(name);
        } else if (value.isPresent()) {
            node.set(name, encoder.encode(value.toOptional().orElseThrow(), style));
        }
        return this;
    }

    public <T> WireObject putList(String name, List<T> values, Encoder<T> encoder) {
        ArrayNode array = node.putArray(name);
        for (T value : values) {
            array.add(encoder.encode(value, style));
        }
        return this;
    }

    public WireObject putMetadata(Metadata metadata) {
        return put("metadata", metadata, ScalarCodecs.METADATA_ENCODER);
    }

    public ObjectNode build() {
        return node;
    }
}
