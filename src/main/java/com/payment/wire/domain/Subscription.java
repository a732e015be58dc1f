package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Subscription {

    public static final String OBJECT = "subscription";

    @NonNull String id;
    @NonNull Plan plan;
    @NonNull String customer;
    @NonNull SubscriptionStatus status;
    @NonNull PosInt quantity;
    @NonNull Instant start;
    @NonNull Instant currentPeriodStart;
    @NonNull Instant currentPeriodEnd;
    @Builder.Default boolean cancelAtPeriodEnd = false;
    Instant canceledAt;
    Instant endedAt;
    Instant trialStart;
    Instant trialEnd;
    Discount discount;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
