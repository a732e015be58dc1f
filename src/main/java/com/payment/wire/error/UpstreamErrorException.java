package com.payment.wire.error;

import com.payment.wire.domain.ApiError;

/**
 * Thrown when the API answered with an error body ({@code {"error": {...}}}) where an entity was expected.
 * Callers use this to tell "object decoded" apart from "request failed upstream".
 */
public class UpstreamErrorException extends DecodeException {

    private final ApiError apiError;

    public UpstreamErrorException(String path, ApiError apiError) {
        super(DecodeErrorKind.UPSTREAM_ERROR, path,
                apiError.getErrorType() + ": " + apiError.getMessage());
        this.apiError = apiError;
    }

    public ApiError getApiError() {
        return apiError;
    }
}
