package com.payment.wire.domain;

/**
 * Source of an invoice line.
 */
public enum LineItemType implements WireEnum {
    /** One-off invoice item added to the invoice. */
    INVOICE_ITEM("invoiceitem"),
    /** Recurring charge generated by a subscription. */
    SUBSCRIPTION("subscription");

    private final String wireValue;

    LineItemType(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
