package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A charge against a card. {@code amountRefunded <= amount} is guaranteed by the API and not
 * re-checked here.
 */
@Value
@Builder(toBuilder = true)
public class Charge {

    public static final String OBJECT = "charge";

    @NonNull String id;
    @NonNull Instant created;
    @Builder.Default boolean livemode = false;
    @NonNull NonNegInt amount;
    @NonNull @Builder.Default NonNegInt amountRefunded = NonNegInt.ZERO;
    @NonNull String currency;
    @Builder.Default boolean paid = false;
    @Builder.Default boolean refunded = false;
    @Builder.Default boolean captured = true;
    @NonNull ChargeStatus status;
    @NonNull Card source;
    String customer;
    String invoice;
    String description;
    String failureCode;
    String failureMessage;
    String receiptEmail;
    String statementDescriptor;
    String balanceTransaction;
    @NonNull @Builder.Default List<Refund> refunds = List.of();
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
