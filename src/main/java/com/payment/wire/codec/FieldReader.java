package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.NullableField;
import com.payment.wire.domain.WireEnum;
import com.payment.wire.error.DecodeException;
import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the fields of one JSON object, reporting failures against the object's path.
 * <p>
 * Required accessors fail with MISSING_FIELD when the field is absent or JSON null.
 * Optional accessors ({@code opt*}) return Java {@code null} for both. Defaulted accessors return the
 * default for both. Fields the entity does not read are ignored.
 */
public final class FieldReader {

    private static final String OBJECT_TAG = "object";

    private final JsonNode node;
    private final DecodeContext ctx;

    private FieldReader(JsonNode node, DecodeContext ctx) {
        this.node = node;
        this.ctx = ctx;
    }

    /** Reader for an object without an {@code object} tag. */
    public static FieldReader of(JsonNode node, DecodeContext ctx) {
        if (!node.isObject()) {
            throw DecodeException.typeMismatch(ctx.getPath(), "object", ScalarCodecs.describe(node));
        }
        return new FieldReader(node, ctx);
    }

    /**
     * Reader for a tagged entity. A present {@code object} tag must equal {@code expectedTag};
     * an absent tag is tolerated.
     */
    public static FieldReader tagged(JsonNode node, DecodeContext ctx, String expectedTag) {
        FieldReader reader = of(node, ctx);
        String tag = reader.optString(OBJECT_TAG);
        if (tag != null && !tag.equals(expectedTag)) {
            throw DecodeException.typeMismatch(ctx.field(OBJECT_TAG).getPath(),
                    "object '" + expectedTag + "'", "object '" + tag + "'");
        }
        return reader;
    }

    public DecodeContext context() {
        return ctx;
    }

    public boolean has(String name) {
        return node.has(name);
    }

    public boolean isPresent(String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    public <T> T required(String name, Decoder<T> decoder) {
        JsonNode value = node.get(name);
        DecodeContext child = ctx.field(name);
        if (value == null || value.isNull()) {
            throw DecodeException.missingField(child.getPath());
        }
        return decoder.decode(value, child);
    }

    public <T> T optional(String name, Decoder<T> decoder) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return decoder.decode(value, ctx.field(name));
    }

    public <T> T withDefault(String name, Decoder<T> decoder, T defaultValue) {
        T value = optional(name, decoder);
        return value != null ? value : defaultValue;
    }

    /** Keeps the absent / null / present distinction. */
    public <T> NullableField<T> nullable(String name, Decoder<T> decoder) {
        JsonNode value = node.get(name);
        if (value == null) {
            return NullableField.absent();
        }
        if (value.isNull()) {
            return NullableField.ofNull();
        }
        return NullableField.of(decoder.decode(value, ctx.field(name)));
    }

    /** JSON array decoded element-wise; one bad element fails the whole array. */
    public <T> List<T> list(String name, Decoder<T> elementDecoder, List<T> defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return decodeArray(value, ctx.field(name), elementDecoder);
    }

    /** Raw JSON of a field, for members this model does not interpret. */
    public JsonNode raw(String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value.deepCopy();
    }

    public String string(String name) {
        return required(name, ScalarCodecs.STRING);
    }

    public String optString(String name) {
        return optional(name, ScalarCodecs.STRING);
    }

    public long longValue(String name) {
        return required(name, ScalarCodecs.LONG);
    }

    public long longValue(String name, long defaultValue) {
        return withDefault(name, ScalarCodecs.LONG, defaultValue);
    }

    public Long optLong(String name) {
        return optional(name, ScalarCodecs.LONG);
    }

    public boolean bool(String name) {
        return required(name, ScalarCodecs.BOOLEAN);
    }

    public boolean bool(String name, boolean defaultValue) {
        return withDefault(name, ScalarCodecs.BOOLEAN, defaultValue);
    }

    public Instant timestamp(String name) {
        return required(name, ScalarCodecs.TIMESTAMP);
    }

    public Instant optTimestamp(String name) {
        return optional(name, ScalarCodecs.TIMESTAMP);
    }

    public PosInt posInt(String name) {
        return required(name, ScalarCodecs.POS_INT);
    }

    public PosInt optPosInt(String name) {
        return optional(name, ScalarCodecs.POS_INT);
    }

    public NonNegInt nonNegInt(String name) {
        return required(name, ScalarCodecs.NON_NEG_INT);
    }

    public NonNegInt nonNegInt(String name, NonNegInt defaultValue) {
        return withDefault(name, ScalarCodecs.NON_NEG_INT, defaultValue);
    }

    public NonNegInt optNonNegInt(String name) {
        return optional(name, ScalarCodecs.NON_NEG_INT);
    }

    public <E extends Enum<E> & WireEnum> E enumTag(String name, Class<E> type) {
        return required(name, ScalarCodecs.enumOf(type));
    }

    public <E extends Enum<E> & WireEnum> E optEnumTag(String name, Class<E> type) {
        return optional(name, ScalarCodecs.enumOf(type));
    }

    /** The entity's {@code metadata}; absent or null means empty. */
    public Metadata metadata() {
        return withDefault("metadata", ScalarCodecs.METADATA, Metadata.empty());
    }

    static <T> List<T> decodeArray(JsonNode value, DecodeContext arrayCtx, Decoder<T> elementDecoder) {
        if (!value.isArray()) {
            throw DecodeException.typeMismatch(arrayCtx.getPath(), "array", ScalarCodecs.describe(value));
        }
        List<T> out = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            DecodeContext elementCtx = arrayCtx.index(i);
            JsonNode element = value.get(i);
            if (element.isNull()) {
                throw DecodeException.missingField(elementCtx.getPath());
            }
            out.add(elementDecoder.decode(element, elementCtx));
        }
        return Collections.unmodifiableList(out);
    }
}
