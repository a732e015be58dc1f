package com.payment.wire.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/** Billing period of an invoice line. {@code endsAt} is {@code end} on the wire. */
@Value
@Builder(toBuilder = true)
public class Period {
    @NonNull Instant start;
    @NonNull Instant endsAt;
}
