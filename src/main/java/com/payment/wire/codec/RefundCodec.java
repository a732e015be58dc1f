package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Refund;
import com.payment.wire.domain.RefundReason;

public final class RefundCodec implements Decoder<Refund>, Encoder<Refund> {

    public static final RefundCodec INSTANCE = new RefundCodec();

    private RefundCodec() {}

    @Override
    public Refund decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Refund.OBJECT);
        return Refund.builder()
                .id(r.string("id"))
                .amount(r.posInt("amount"))
                .currency(r.string("currency"))
                .created(r.timestamp("created"))
                .charge(r.string("charge"))
                .reason(r.optEnumTag("reason", RefundReason.class))
                .balanceTransaction(r.optString("balance_transaction"))
                .metadata(r.metadata())
                .build();
    }

    @Override
    public JsonNode encode(Refund refund, EncodeStyle style) {
        return WireObject.tagged(Refund.OBJECT, style)
                .put("id", refund.getId())
                .put("amount", refund.getAmount())
                .put("currency", refund.getCurrency())
                .put("created", refund.getCreated())
                .put("charge", refund.getCharge())
                .put("reason", refund.getReason())
                .put("balance_transaction", refund.getBalanceTransaction())
                .putMetadata(refund.getMetadata())
                .build();
    }
}
