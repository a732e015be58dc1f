package com.payment.wire.domain;

import com.payment.wire.compliance.CardDataMasker;
import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A payment card as returned by the API. Never holds the full PAN; {@link #toString()} masks
 * last4 and fingerprint so cards can be logged.
 * <p>
 * {@code customer} is expandable. A card embedded inside a customer only ever carries the
 * customer's id, which keeps the object graph finite.
 */
@Value
@Builder(toBuilder = true)
public class Card {

    public static final String OBJECT = "card";

    @NonNull String id;
    /** Loose string: the API adds brands over time. */
    @NonNull String brand;
    @NonNull String last4;
    @NonNull PosInt expMonth;
    @NonNull PosInt expYear;
    String fingerprint;
    String funding;
    String country;
    String name;
    String addressLine1;
    String addressLine2;
    String addressCity;
    String addressState;
    String addressZip;
    String addressCountry;
    String cvcCheck;
    String addressLine1Check;
    String addressZipCheck;
    /** Owner of the card; null for cards not attached to a customer. */
    Reference<Customer> customer;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();

    @Override
    public String toString() {
        return "Card(id=" + id
                + ", brand=" + brand
                + ", last4=" + CardDataMasker.maskLast4(last4)
                + ", exp=" + expMonth.getValue() + "/" + expYear.getValue()
                + ", fingerprint=" + CardDataMasker.maskFingerprint(fingerprint)
                + ", customer=" + (customer != null ? customer.getId() : null) + ")";
    }
}
