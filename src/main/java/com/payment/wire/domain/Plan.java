package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A recurring price: {@code amount} every {@code intervalCount} {@code interval}s.
 */
@Value
@Builder(toBuilder = true)
public class Plan {

    public static final String OBJECT = "plan";

    @NonNull String id;
    @NonNull String name;
    @NonNull NonNegInt amount;
    @NonNull String currency;
    @NonNull PlanInterval interval;
    @NonNull @Builder.Default NonNegInt intervalCount = NonNegInt.of(1);
    @NonNull Instant created;
    @Builder.Default boolean livemode = false;
    PosInt trialPeriodDays;
    String statementDescriptor;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
