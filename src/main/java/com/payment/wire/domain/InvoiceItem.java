package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A one-off amount added to a customer's next invoice. Negative amounts are credits.
 */
@Value
@Builder(toBuilder = true)
public class InvoiceItem {

    public static final String OBJECT = "invoiceitem";

    @NonNull String id;
    long amount;
    @NonNull String currency;
    @NonNull String customer;
    @NonNull Instant date;
    @NonNull Period period;
    Plan plan;
    @Builder.Default boolean proration = false;
    PosInt quantity;
    String invoice;
    String subscription;
    String description;
    @Builder.Default boolean discountable = true;
    @Builder.Default boolean livemode = false;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
