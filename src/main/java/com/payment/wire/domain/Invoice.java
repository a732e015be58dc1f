package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * An invoice. Totals are taken as sent: {@code total} already reflects discounts and is never
 * recomputed from the lines.
 */
@Value
@Builder(toBuilder = true)
public class Invoice {

    public static final String OBJECT = "invoice";

    @NonNull String id;
    @NonNull Instant date;
    @NonNull String customer;
    String charge;
    String subscription;
    @NonNull PaginatedList<InvoiceLineItem> lines;
    long subtotal;
    long total;
    long amountDue;
    @Builder.Default long startingBalance = 0;
    Long endingBalance;
    @Builder.Default boolean attempted = false;
    @NonNull @Builder.Default NonNegInt attemptCount = NonNegInt.ZERO;
    @Builder.Default boolean closed = false;
    @Builder.Default boolean paid = false;
    @Builder.Default boolean livemode = false;
    @NonNull Instant periodStart;
    @NonNull Instant periodEnd;
    Instant nextPaymentAttempt;
    Discount discount;
    @NonNull String currency;
    String description;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
