package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Discount;

public final class DiscountCodec implements Decoder<Discount>, Encoder<Discount> {

    public static final DiscountCodec INSTANCE = new DiscountCodec();

    private DiscountCodec() {}

    @Override
    public Discount decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Discount.OBJECT);
        return Discount.builder()
                .coupon(r.required("coupon", CouponCodec.INSTANCE))
                .customer(r.string("customer"))
                .start(r.timestamp("start"))
                .endsAt(r.optTimestamp("end"))
                .subscription(r.optString("subscription"))
                .build();
    }

    @Override
    public JsonNode encode(Discount discount, EncodeStyle style) {
        return WireObject.tagged(Discount.OBJECT, style)
                .put("coupon", discount.getCoupon(), CouponCodec.INSTANCE)
                .put("customer", discount.getCustomer())
                .put("start", discount.getStart())
                .put("end", discount.getEndsAt())
                .put("subscription", discount.getSubscription())
                .build();
    }
}
