package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Subscription;
import com.payment.wire.domain.SubscriptionStatus;

public final class SubscriptionCodec implements Decoder<Subscription>, Encoder<Subscription> {

    public static final SubscriptionCodec INSTANCE = new SubscriptionCodec();
    static final ListCodec<Subscription> LIST = new ListCodec<>(INSTANCE, INSTANCE);

    private SubscriptionCodec() {}

    @Override
    public Subscription decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Subscription.OBJECT);
        return Subscription.builder()
                .id(r.string("id"))
                .plan(r.required("plan", PlanCodec.INSTANCE))
                .customer(r.string("customer"))
                .status(r.enumTag("status", SubscriptionStatus.class))
                .quantity(r.posInt("quantity"))
                .start(r.timestamp("start"))
                .currentPeriodStart(r.timestamp("current_period_start"))
                .currentPeriodEnd(r.timestamp("current_period_end"))
                .cancelAtPeriodEnd(r.bool("cancel_at_period_end", false))
                .canceledAt(r.optTimestamp("canceled_at"))
                .endedAt(r.optTimestamp("ended_at"))
                .trialStart(r.optTimestamp("trial_start"))
                .trialEnd(r.optTimestamp("trial_end"))
                .discount(r.optional("discount", DiscountCodec.INSTANCE))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Subscription subscription, EncodeStyle style) {
        return WireObject.tagged(Subscription.OBJECT, style)
                .put("id", subscription.getId())
                .put("plan", subscription.getPlan(), PlanCodec.INSTANCE)
                .put("customer", subscription.getCustomer())
                .put("status", subscription.getStatus())
                .put("quantity", subscription.getQuantity())
                .put("start", subscription.getStart())
                .put("current_period_start", subscription.getCurrentPeriodStart())
                .put("current_period_end", subscription.getCurrentPeriodEnd())
                .put("cancel_at_period_end", subscription.isCancelAtPeriodEnd())
                .put("canceled_at", subscription.getCanceledAt())
                .put("ended_at", subscription.getEndedAt())
                .put("trial_start", subscription.getTrialStart())
                .put("trial_end", subscription.getTrialEnd())
                .put("discount", subscription.getDiscount(), DiscountCodec.INSTANCE)
                .putMetadata(subscription.getMetadata())
                .build();
    }
}
