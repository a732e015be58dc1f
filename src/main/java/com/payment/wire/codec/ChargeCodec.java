package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Card;
import com.payment.wire.domain.Charge;
import com.payment.wire.domain.ChargeStatus;
import com.payment.wire.scalar.NonNegInt;

import java.util.List;

public final class ChargeCodec implements Decoder<Charge>, Encoder<Charge> {

    public static final ChargeCodec INSTANCE = new ChargeCodec();

    private ChargeCodec() {}

    @Override
    public Charge decode(JsonNode node, DecodeContext ctx) {
        FieldReader r = FieldReader.tagged(node, ctx, Charge.OBJECT);
        return Charge.builder()
                .id(r.string("id"))
                .created(r.timestamp("created"))
                .livemode(r.bool("livemode", false))
                .amount(r.nonNegInt("amount"))
                .amountRefunded(r.nonNegInt("amount_refunded", NonNegInt.ZERO))
                .currency(r.string("currency"))
                .paid(r.bool("paid", false))
                .refunded(r.bool("refunded", false))
                .captured(r.bool("captured", true))
                .status(r.enumTag("status", ChargeStatus.class))
                .source(source(r))
                .customer(r.optString("customer"))
                .invoice(r.optString("invoice"))
                .description(r.optString("description"))
                .failureCode(r.optString("failure_code"))
                .failureMessage(r.optString("failure_message"))
                .receiptEmail(r.optString("receipt_email"))
                .statementDescriptor(r.optString("statement_descriptor"))
                .balanceTransaction(r.optString("balance_transaction"))
                .refunds(r.list("refunds", RefundCodec.INSTANCE, List.of()))
                .metadata(r.metadata())
                .build();
    }

    // API versions before sources sent the charged card as "card".
    private static Card source(FieldReader r) {
        if (!r.isPresent("source") && r.isPresent("card")) {
            return r.required("card", CardCodec.OWNER_ID);
        }
        return r.required("source", CardCodec.OWNER_ID);
    }

    @Override
    public JsonNode encode(Charge charge, EncodeStyle style) {
        return WireObject.tagged(Charge.OBJECT, style)
                .put("id", charge.getId())
                .put("created", charge.getCreated())
                .put("livemode", charge.isLivemode())
                .put("amount", charge.getAmount())
                .put("amount_refunded", charge.getAmountRefunded())
                .put("currency", charge.getCurrency())
                .put("paid", charge.isPaid())
                .put("refunded", charge.isRefunded())
                .put("captured", charge.isCaptured())
                .put("status", charge.getStatus())
                .put("source", charge.getSource(), CardCodec.OWNER_ID)
                .put("customer", charge.getCustomer())
                .put("invoice", charge.getInvoice())
                .put("description", charge.getDescription())
                .put("failure_code", charge.getFailureCode())
                .put("failure_message", charge.getFailureMessage())
                .put("receipt_email", charge.getReceiptEmail())
                .put("statement_descriptor", charge.getStatementDescriptor())
                .put("balance_transaction", charge.getBalanceTransaction())
                .putList("refunds", charge.getRefunds(), RefundCodec.INSTANCE)
                .putMetadata(charge.getMetadata())
                .build();
    }
}
