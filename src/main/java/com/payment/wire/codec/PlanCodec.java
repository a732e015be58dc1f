package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Plan;
import com.payment.wire.domain.PlanInterval;
import com.payment.wire.scalar.NonNegInt;

public final class PlanCodec implements Decoder<Plan>, Encoder<Plan> {

    public static final PlanCodec INSTANCE = new PlanCodec();

    private static final NonNegInt DEFAULT_INTERVAL_COUNT = NonNegInt.of(1);

    private PlanCodec() {}

    @Override
    public Plan decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Plan.OBJECT);
        return Plan.builder()
                .id(r.string("id"))
                .name(r.string("name"))
                .amount(r.nonNegInt("amount"))
                .currency(r.string("currency"))
                .interval(r.enumTag("interval", PlanInterval.class))
                .intervalCount(r.nonNegInt("interval_count", DEFAULT_INTERVAL_COUNT))
                .created(r.timestamp("created"))
                .livemode(r.bool("livemode", false))
                .trialPeriodDays(r.optPosInt("trial_period_days"))
                .statementDescriptor(r.optString("statement_descriptor"))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Plan plan, EncodeStyle style) {
        return WireObject.tagged(Plan.OBJECT, style)
                .put("id", plan.getId())
                .put("name", plan.getName())
                .put("amount", plan.getAmount())
                .put("currency", plan.getCurrency())
                .put("interval", plan.getInterval())
                .put("interval_count", plan.getIntervalCount())
                .put("created", plan.getCreated())
                .put("livemode", plan.isLivemode())
                .put("trial_period_days", plan.getTrialPeriodDays())
                .put("statement_descriptor", plan.getStatementDescriptor())
                .putMetadata(plan.getMetadata())
                .build();
    }
}
