package com.payment.wire.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Body of a failed API request, {@code {"error": {...}}}.
 */
@Value
@Builder(toBuilder = true)
public class ApiError {

    /** Wire name {@code type}, e.g. {@code card_error}. Kept as a string so new categories still decode. */
    @NonNull String errorType;
    @NonNull String message;
    String code;
    String param;
    String declineCode;
    /** Id of the failed charge for card errors. */
    String charge;
}
