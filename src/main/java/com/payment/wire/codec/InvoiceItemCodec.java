package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.InvoiceItem;

public final class InvoiceItemCodec implements Decoder<InvoiceItem>, Encoder<InvoiceItem> {

    public static final InvoiceItemCodec INSTANCE = new InvoiceItemCodec();

    private InvoiceItemCodec() {}

    @Override
    public InvoiceItem decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, InvoiceItem.OBJECT);
        return InvoiceItem.builder()
                .id(r.string("id"))
                .amount(r.longValue("amount"))
                .currency(r.string("currency"))
                .customer(r.string("customer"))
                .date(r.timestamp("date"))
                .period(r.required("period", PeriodCodec.INSTANCE))
                .plan(r.optional("plan", PlanCodec.INSTANCE))
                .proration(r.bool("proration", false))
                .quantity(r.optPosInt("quantity"))
                .invoice(r.optString("invoice"))
                .subscription(r.optString("subscription"))
                .description(r.optString("description"))
                .discountable(r.bool("discountable", true))
                .livemode(r.bool("livemode", false))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(InvoiceItem item, EncodeStyle style) {
        return WireObject.tagged(InvoiceItem.OBJECT, style)
                .put("id", item.getId())
                .put("amount", item.getAmount())
                .put("currency", item.getCurrency())
                .put("customer", item.getCustomer())
                .put("date", item.getDate())
                .put("period", item.getPeriod(), PeriodCodec.INSTANCE)
                .put("plan", item.getPlan(), PlanCodec.INSTANCE)
                .put("proration", item.isProration())
                .put("quantity", item.getQuantity())
                .put("invoice", item.getInvoice())
                .put("subscription", item.getSubscription())
                .put("description", item.getDescription())
                .put("discountable", item.isDiscountable())
                .put("livemode", item.isLivemode())
                .putMetadata(item.getMetadata())
                .build();
    }
}
