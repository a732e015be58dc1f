package com.payment.wire.core;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.wire.codec.Codec;
import com.payment.wire.codec.Codecs;
import com.payment.wire.codec.DecodeOptions;
import com.payment.wire.codec.EventPayloads;
import com.payment.wire.config.WireCodecProperties;
import com.payment.wire.domain.Event;
import com.payment.wire.domain.EventProbe;
import com.payment.wire.error.DecodeException;
import com.payment.wire.error.DecodeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Spring-facing wrapper over {@link Codecs}: applies the configured decode options and parses or
 * writes raw JSON text with Jackson. Decode failures are rethrown unchanged; retry and error
 * policy stay with the caller.
 */
@Slf4j
public class PaymentWireService {

    private final ObjectMapper mapper;
    private final DecodeOptions options;

    public PaymentWireService(WireCodecProperties properties) {
        JsonFactory factory = new JsonFactoryBuilder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(properties.getMaxNestingDepth())
                        .build())
                .build();
        this.mapper = new ObjectMapper(factory)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.options = properties.toDecodeOptions();
    }

    public DecodeOptions getOptions() {
        return options;
    }

    public <T> T decode(Codec<T> codec, JsonNode json) {
        T value = codec.decode(json, options);
        log.debug("Decoded {}", codec.getRootName());
        return value;
    }

    /**
     * Parses {@code body} and decodes it.
     *
     * @throws IllegalArgumentException if {@code body} is not well-formed JSON
     * @throws DecodeException          if it is JSON but not a valid value of the codec's type
     */
    public <T> T decode(Codec<T> codec, String body) {
        return decode(codec, parse(body));
    }

    public <T> DecodeResult<T> tryDecode(Codec<T> codec, JsonNode json) {
        return codec.tryDecode(json, options);
    }

    public EventProbe probeEvent(String body) {
        return decode(Codecs.eventProbe(), body);
    }

    /**
     * Decodes a webhook body with the payload codec matching its type.
     * Empty for event types this model does not cover.
     */
    public Optional<Event<?>> decodeEvent(String body) {
        JsonNode json = parse(body);
        Optional<Event<?>> event = EventPayloads.decode(json, options);
        if (event.isEmpty()) {
            log.debug("No payload codec for event type {}", json.path("type").asText());
        }
        return event;
    }

    /** Response-form JSON text of {@code value}. */
    public <T> String write(Codec<T> codec, T value) {
        return writeString(codec.encode(value));
    }

    /** Request-body JSON text of {@code value}, references reduced to ids. */
    public <T> String writeRequestBody(Codec<T> codec, T value) {
        return writeString(codec.encodeRequest(value));
    }

    public JsonNode parse(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Body is not well-formed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String writeString(JsonNode json) {
        try {
            return mapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSON tree", e);
        }
    }
}
