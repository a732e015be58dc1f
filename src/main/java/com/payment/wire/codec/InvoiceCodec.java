package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Invoice;
import com.payment.wire.domain.InvoiceLineItem;
import com.payment.wire.scalar.NonNegInt;

public final class InvoiceCodec implements Decoder<Invoice>, Encoder<Invoice> {

    public static final InvoiceCodec INSTANCE = new InvoiceCodec();

    private static final ListCodec<InvoiceLineItem> LINES =
            new ListCodec<>(InvoiceLineItemCodec.INSTANCE, InvoiceLineItemCodec.INSTANCE);

    private InvoiceCodec() {}

    @Override
    public Invoice decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Invoice.OBJECT);
        return Invoice.builder()
                .id(r.string("id"))
                .date(r.timestamp("date"))
                .customer(r.string("customer"))
                .charge(r.optString("charge"))
                .subscription(r.optString("subscription"))
                .lines(r.required("lines", LINES))
                .subtotal(r.longValue("subtotal"))
                .total(r.longValue("total"))
                .amountDue(r.longValue("amount_due"))
                .startingBalance(r.longValue("starting_balance", 0))
                .endingBalance(r.optLong("ending_balance"))
                .attempted(r.bool("attempted", false))
                .attemptCount(r.nonNegInt("attempt_count", NonNegInt.ZERO))
                .closed(r.bool("closed", false))
                .paid(r.bool("paid", false))
                .livemode(r.bool("livemode", false))
                .periodStart(r.timestamp("period_start"))
                .periodEnd(r.timestamp("period_end"))
                .nextPaymentAttempt(r.optTimestamp("next_payment_attempt"))
                .discount(r.optional("discount", DiscountCodec.INSTANCE))
                .currency(r.string("currency"))
                .description(r.optString("description"))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Invoice invoice, EncodeStyle style) {
        return WireObject.tagged(Invoice.OBJECT, style)
                .put("id", invoice.getId())
                .put("date", invoice.getDate())
                .put("customer", invoice.getCustomer())
                .put("charge", invoice.getCharge())
                .put("subscription", invoice.getSubscription())
                .put("lines", invoice.getLines(), LINES)
                .put("subtotal", invoice.getSubtotal())
                .put("total", invoice.getTotal())
                .put("amount_due", invoice.getAmountDue())
                .put("starting_balance", invoice.getStartingBalance())
                .put("ending_balance", invoice.getEndingBalance())
                .put("attempted", invoice.isAttempted())
                .put("attempt_count", invoice.getAttemptCount())
                .put("closed", invoice.isClosed())
                .put("paid", invoice.isPaid())
                .put("livemode", invoice.isLivemode())
                .put("period_start", invoice.getPeriodStart())
                .put("period_end", invoice.getPeriodEnd())
                .put("next_payment_attempt", invoice.getNextPaymentAttempt())
                .put("discount", invoice.getDiscount(), DiscountCodec.INSTANCE)
                .put("currency", invoice.getCurrency())
                .put("description", invoice.getDescription())
                .putMetadata(invoice.getMetadata())
                .build();
    }
}
