package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Refund {

    public static final String OBJECT = "refund";

    @NonNull String id;
    @NonNull PosInt amount;
    @NonNull String currency;
    @NonNull Instant created;
    /** Id of the refunded charge. */
    @NonNull String charge;
    RefundReason reason;
    String balanceTransaction;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
