package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * A customer record. {@code defaultSource} is expandable; the cards listed in {@code sources}
 * (or {@code cards} on older API versions) always reference this customer by id only.
 */
@Value
@Builder(toBuilder = true)
public class Customer {

    public static final String OBJECT = "customer";

    @NonNull String id;
    @NonNull Instant created;
    @Builder.Default boolean livemode = false;
    /** Wire name {@code account_balance}; in minor units, negative means credit. */
    @Builder.Default long balance = 0;
    /** Null until the customer is first charged; not sent at all by some API versions. */
    @NonNull @Builder.Default NullableField<String> currency = NullableField.absent();
    Reference<Card> defaultSource;
    @Builder.Default boolean delinquent = false;
    String description;
    String email;
    Discount discount;
    PaginatedList<Card> sources;
    /** Legacy name of {@code sources}; at most one of the two is populated. */
    PaginatedList<Card> cards;
    PaginatedList<Subscription> subscriptions;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
