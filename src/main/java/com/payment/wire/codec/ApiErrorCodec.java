package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.ApiError;

/**
 * The error envelope {@code {"error": {"type", "message", "code"?, "param"?}}}.
 */
public final class ApiErrorCodec implements Decoder<ApiError>, Encoder<ApiError> {

    public static final ApiErrorCodec INSTANCE = new ApiErrorCodec();

    private ApiErrorCodec() {}

    /**
     * True for an error envelope. Entities never carry a top-level {@code error} object, and an
     * {@code id} or {@code object} member means the payload is an entity.
     */
    public static boolean isErrorBody(JsonNode json) {
        return json.isObject()
                && json.path("error").isObject()
                && !json.has("id")
                && !json.has("object");
    }

    @Override
    public ApiError decode(JsonNode node, DecodeContext ctx) {
        return FieldReader.of(node, ctx).required("error", ApiErrorCodec::decodeBody);
    }

    private static ApiError decodeBody(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.of(node, ctx);
        return ApiError.builder()
                .errorType(r.string("type"))
                .message(r.string("message"))
                .code(r.optString("code"))
                .param(r.optString("param"))
                .declineCode(r.optString("decline_code"))
                .charge(r.optString("charge"))
                .build();
    }

    @Override
    public JsonNode encode(ApiError error, EncodeStyle style) {
        JsonNode body = WireObject.create(style)
                .put("type", error.getErrorType())
                .put("message", error.getMessage())
                .put("code", error.getCode())
                .put("param", error.getParam())
                .put("decline_code", error.getDeclineCode())
                .put("charge", error.getCharge())
                .build();
        return WireObject.create(style).put("error", body).build();
    }
}
