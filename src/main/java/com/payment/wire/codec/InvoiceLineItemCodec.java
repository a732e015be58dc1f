package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.InvoiceLineItem;
import com.payment.wire.domain.LineItemType;

public final class InvoiceLineItemCodec implements Decoder<InvoiceLineItem>, Encoder<InvoiceLineItem> {

    public static final InvoiceLineItemCodec INSTANCE = new InvoiceLineItemCodec();

    private InvoiceLineItemCodec() {}

    @Override
    public InvoiceLineItem decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, InvoiceLineItem.OBJECT);
        return InvoiceLineItem.builder()
                .id(r.string("id"))
                .lineType(r.enumTag("type", LineItemType.class))
                .amount(r.longValue("amount"))
                .currency(r.string("currency"))
                .period(r.required("period", PeriodCodec.INSTANCE))
                .plan(r.optional("plan", PlanCodec.INSTANCE))
                .quantity(r.optPosInt("quantity"))
                .proration(r.bool("proration", false))
                .discountable(r.bool("discountable", true))
                .livemode(r.bool("livemode", false))
                .description(r.optString("description"))
                .subscription(r.optString("subscription"))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(InvoiceLineItem line, EncodeStyle style) {
        return WireObject.tagged(InvoiceLineItem.OBJECT, style)
                .put("id", line.getId())
                .put("type", line.getLineType())
                .put("amount", line.getAmount())
                .put("currency", line.getCurrency())
                .put("period", line.getPeriod(), PeriodCodec.INSTANCE)
                .put("plan", line.getPlan(), PlanCodec.INSTANCE)
                .put("quantity", line.getQuantity())
                .put("proration", line.isProration())
                .put("discountable", line.isDiscountable())
                .put("livemode", line.isLivemode())
                .put("description", line.getDescription())
                .put("subscription", line.getSubscription())
                .putMetadata(line.getMetadata())
                .build();
    }
}
