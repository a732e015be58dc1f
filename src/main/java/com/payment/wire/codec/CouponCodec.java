package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Coupon;
import com.payment.wire.domain.CouponDuration;
import com.payment.wire.error.DecodeException;
import com.payment.wire.scalar.NonNegInt;
import com.payment.wire.scalar.PosInt;

public final class CouponCodec implements Decoder<Coupon>, Encoder<Coupon> {

    public static final CouponCodec INSTANCE = new CouponCodec();

    private CouponCodec() {}

    @Override
    public Coupon decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Coupon.OBJECT);
        PosInt amountOff = r.optPosInt("amount_off");
        PosInt percentOff = r.optPosInt("percent_off");
        if (ctx.getOptions().isStrictExclusivity() && amountOff != null && percentOff != null) {
            throw DecodeException.validationFailed(ctx.field("percent_off").getPath(),
                    "amount_off and percent_off must not both be set");
        }
        return Coupon.builder()
                .id(r.string("id"))
                .created(r.timestamp("created"))
                .duration(r.enumTag("duration", CouponDuration.class))
                .amountOff(amountOff)
                .currency(r.optString("currency"))
                .percentOff(percentOff)
                .durationInMonths(r.optPosInt("duration_in_months"))
                .maxRedemptions(r.optPosInt("max_redemptions"))
                .timesRedeemed(r.nonNegInt("times_redeemed", NonNegInt.ZERO))
                .redeemBy(r.optTimestamp("redeem_by"))
                .valid(r.bool("valid", true))
                .livemode(r.bool("livemode", false))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Coupon coupon, EncodeStyle style) {
        return WireObject.tagged(Coupon.OBJECT, style)
                .put("id", coupon.getId())
                .put("created", coupon.getCreated())
                .put("duration", coupon.getDuration())
                .put("amount_off", coupon.getAmountOff())
                .put("currency", coupon.getCurrency())
                .put("percent_off", coupon.getPercentOff())
                .put("duration_in_months", coupon.getDurationInMonths())
                .put("max_redemptions", coupon.getMaxRedemptions())
                .put("times_redeemed", coupon.getTimesRedeemed())
                .put("redeem_by", coupon.getRedeemBy())
                .put("valid", coupon.isValid())
                .put("livemode", coupon.isLivemode())
                .putMetadata(coupon.getMetadata())
                .build();
    }
}
