package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payment.wire.domain.WireEnum;
import com.payment.wire.error.DecodeException;
import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;

import java.time.Instant;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decoders and encoders for leaf values: JSON primitives, validated integers, timestamps,
 * metadata maps and closed enumerations. The integer and metadata decoders run the same
 * predicates as {@link PosInt#of}, {@link NonNegInt#of} and {@link Metadata#of}.
 */
public final class ScalarCodecs {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final Decoder<String> STRING = (node, ctx) -> {
        if (!node.isTextual()) {
            throw DecodeException.typeMismatch(ctx.getPath(), "string", describe(node));
        }
        return node.textValue();
    };

    public static final Decoder<Boolean> BOOLEAN = (node, ctx) -> {
        if (!node.isBoolean()) {
            throw DecodeException.typeMismatch(ctx.getPath(), "boolean", describe(node));
        }
        return node.booleanValue();
    };

    public static final Decoder<Long> LONG = (node, ctx) -> {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw DecodeException.typeMismatch(ctx.getPath(), "integer", describe(node));
        }
        return node.longValue();
    };

    /** Unix epoch seconds. */
    public static final Decoder<Instant> TIMESTAMP = (node, ctx) -> {
        long seconds = LONG.decode(node, ctx);
        if (seconds < Instant.MIN.getEpochSecond() || seconds > Instant.MAX.getEpochSecond()) {
            throw DecodeException.validationFailed(ctx.getPath(), "timestamp " + seconds + " is out of range");
        }
        return Instant.ofEpochSecond(seconds);
    };

    public static final Decoder<PosInt> POS_INT = (node, ctx) -> {
        long value = LONG.decode(node, ctx);
        Optional<String> violation = PosInt.check(value);
        if (violation.isPresent()) {
            throw DecodeException.validationFailed(ctx.getPath(), violation.get());
        }
        return PosInt.of(value);
    };

    public static final Decoder<NonNegInt> NON_NEG_INT = (node, ctx) -> {
        long value = LONG.decode(node, ctx);
        Optional<String> violation = NonNegInt.check(value);
        if (violation.isPresent()) {
            throw DecodeException.validationFailed(ctx.getPath(), violation.get());
        }
        return NonNegInt.of(value);
    };

    /** Flat string-to-string object. JSON null decodes to the empty map. */
    public static final Decoder<Metadata> METADATA = (node, ctx) -> {
        if (node.isNull() || node.isMissingNode()) {
            return Metadata.empty();
        }
        if (!node.isObject()) {
            throw DecodeException.typeMismatch(ctx.getPath(), "object", describe(node));
        }
        if (node.size() > Metadata.MAX_PAIRS) {
            throw DecodeException.validationFailed(ctx.getPath(),
                    "at most " + Metadata.MAX_PAIRS + " pairs allowed but got " + node.size());
        }
        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            DecodeContext pairCtx = ctx.field(field.getKey());
            String value = STRING.decode(field.getValue(), pairCtx);
            Optional<String> violation = Metadata.checkPair(field.getKey(), value);
            if (violation.isPresent()) {
                throw DecodeException.validationFailed(pairCtx.getPath(), violation.get());
            }
            entries.put(field.getKey(), value);
        }
        return Metadata.of(entries);
    };

    public static final Encoder<String> STRING_ENCODER = (value, style) -> NODES.textNode(value);
    public static final Encoder<PosInt> POS_INT_ENCODER = (value, style) -> NODES.numberNode(value.getValue());
    public static final Encoder<NonNegInt> NON_NEG_INT_ENCODER = (value, style) -> NODES.numberNode(value.getValue());
    public static final Encoder<Metadata> METADATA_ENCODER = (value, style) -> {
        ObjectNode node = NODES.objectNode();
        value.asMap().forEach(node::put);
        return node;
    };

    private ScalarCodecs() {}

    /** Decoder for a strict enumeration: any tag outside {@code type}'s constants is UNKNOWN_ENUM_TAG. */
    public static <E extends Enum<E> & WireEnum> Decoder<E> enumOf(Class<E> type) {
        E[] constants = type.getEnumConstants();
        List<String> known = Arrays.stream(constants).map(WireEnum::getWireValue).collect(Collectors.toList());
        return (node, ctx) -> {
            String tag = STRING.decode(node, ctx);
            for (E constant : constants) {
                if (constant.getWireValue().equals(tag)) {
                    return constant;
                }
            }
            throw DecodeException.unknownEnumTag(ctx.getPath(), tag, known);
        };
    }

    /** Short JSON type name for error messages. */
    static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) return "absent";
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isBoolean()) return "boolean";
        if (node.isIntegralNumber()) return "integer";
        if (node.isNumber()) return "number";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }
}
