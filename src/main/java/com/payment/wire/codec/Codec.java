package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.error.DecodeException;
import com.payment.wire.error.DecodeResult;
import com.payment.wire.error.UpstreamErrorException;

import java.util.Objects;

/**
 * Public decode/encode entry point for one entity type. Stateless and safe to share between threads.
 * <p>
 * Top-level {@link #decode(JsonNode)} first checks whether the payload is an API error body and, if so,
 * throws {@link UpstreamErrorException} instead of reporting missing fields.
 */
public final class Codec<T> implements Decoder<T>, Encoder<T> {

    private final String rootName;
    private final Decoder<T> decoder;
    private final Encoder<T> encoder;
    private final boolean detectUpstreamErrors;

    private Codec(String rootName, Decoder<T> decoder, Encoder<T> encoder, boolean detectUpstreamErrors) {
        this.rootName = Objects.requireNonNull(rootName, "rootName");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.detectUpstreamErrors = detectUpstreamErrors;
    }

    public static <T> Codec<T> of(String rootName, Decoder<T> decoder, Encoder<T> encoder) {
        return new Codec<>(rootName, decoder, encoder, true);
    }

    /**
     * Codec without the error-body check: for the error envelope itself, which decodes as a value, and
     * for scalars, where an object of any shape is simply the wrong type.
     */
    static <T> Codec<T> withoutUpstreamDetection(String rootName, Decoder<T> decoder, Encoder<T> encoder) {
        return new Codec<>(rootName, decoder, encoder, false);
    }

    /** Name error paths start with, e.g. {@code customer}. */
    public String getRootName() {
        return rootName;
    }

    public T decode(JsonNode json) {
        return decode(json, DecodeOptions.DEFAULT);
    }

    /**
     * @throws UpstreamErrorException if {@code json} is an API error body
     * @throws DecodeException        if {@code json} is not a valid value of this type
     */
    public T decode(JsonNode json, DecodeOptions options) {
        Objects.requireNonNull(json, "json");
        DecodeContext ctx = DecodeContext.root(rootName, options);
        if (detectUpstreamErrors && ApiErrorCodec.isErrorBody(json)) {
            throw new UpstreamErrorException(ctx.getPath(), ApiErrorCodec.INSTANCE.decode(json, ctx));
        }
        return decoder.decode(json, ctx);
    }

    public DecodeResult<T> tryDecode(JsonNode json) {
        return tryDecode(json, DecodeOptions.DEFAULT);
    }

    public DecodeResult<T> tryDecode(JsonNode json, DecodeOptions options) {
        try {
            return DecodeResult.success(decode(json, options));
        } catch (DecodeException e) {
            return DecodeResult.failure(e);
        }
    }

    /** Nested use: decodes without the error-body check, under the caller's path. */
    @Override
    public T decode(JsonNode node, DecodeContext ctx) {
        return decoder.decode(node, ctx);
    }

    /** Response form: embedded references stay embedded, so {@code decode(encode(v)).equals(v)}. */
    public JsonNode encode(T value) {
        return encode(value, EncodeStyle.RESPONSE);
    }

    /** Request-body form: every expandable reference collapses to its id. */
    public JsonNode encodeRequest(T value) {
        return encode(value, EncodeStyle.REQUEST);
    }

    @Override
    public JsonNode encode(T value, EncodeStyle style) {
        return encoder.encode(Objects.requireNonNull(value, "value"), style);
    }
}
