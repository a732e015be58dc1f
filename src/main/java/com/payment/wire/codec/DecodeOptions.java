package com.payment.wire.codec;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call decode switches. The defaults accept everything the API currently returns.
 */
@Value
@Builder
public class DecodeOptions {

    public static final DecodeOptions DEFAULT = DecodeOptions.builder().build();

    /**
     * Reject coupons carrying both {@code amount_off} and {@code percent_off}, and customers carrying
     * both {@code sources} and {@code cards}. The API documents these as exclusive but does not
     * guarantee it in its schema, so this is off unless asked for.
     */
    @Builder.Default boolean strictExclusivity = false;
}
