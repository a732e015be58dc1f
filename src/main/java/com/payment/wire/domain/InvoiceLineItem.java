package com.payment.wire.domain;

import com.payment.wire.scalar.Metadata;
import com.payment.wire.scalar.PosInt;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One line of an invoice. {@code subscription} is only sent for lines of type
 * {@link LineItemType#INVOICE_ITEM}; that pairing is not checked.
 */
@Value
@Builder(toBuilder = true)
public class InvoiceLineItem {

    public static final String OBJECT = "line_item";

    @NonNull String id;
    /** Wire name {@code type}. */
    @NonNull LineItemType lineType;
    long amount;
    @NonNull String currency;
    @NonNull Period period;
    Plan plan;
    PosInt quantity;
    @Builder.Default boolean proration = false;
    @Builder.Default boolean discountable = true;
    @Builder.Default boolean livemode = false;
    String description;
    String subscription;
    @NonNull @Builder.Default Metadata metadata = Metadata.empty();
}
