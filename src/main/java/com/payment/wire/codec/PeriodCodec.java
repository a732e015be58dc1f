package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Period;

public final class PeriodCodec implements Decoder<Period>, Encoder<Period> {

    public static final PeriodCodec INSTANCE = new PeriodCodec();

    private PeriodCodec() {}

    @Override
    public Period decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.of(node, ctx);
        return Period.builder()
                .start(r.timestamp("start"))
                .endsAt(r.timestamp("end"))
                .build();
    }

    @Override
    public JsonNode encode(Period period, EncodeStyle style) {
        return WireObject.create(style)
                .put("start", period.getStart())
                .put("end", period.getEndsAt())
                .build();
    }
}
