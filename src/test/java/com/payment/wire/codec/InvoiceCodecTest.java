package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Invoice;
import com.payment.wire.domain.InvoiceLineItem;
import com.payment.wire.domain.LineItemType;
import com.payment.wire.error.DecodeErrorKind;
import com.payment.wire.error.DecodeException;
import org.junit.jupiter.api.Test;

import static com.payment.wire.WireFixtures.PERIOD_END;
import static com.payment.wire.WireFixtures.PLAN_JSON;
import static com.payment.wire.WireFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvoiceCodecTest {

    private static final String INVOICE_JSON = """
            {
              "id": "in_1",
              "object": "invoice",
              "date": 1700000000,
              "customer": "cus_123",
              "charge": "ch_1",
              "subscription": "sub_1",
              "subtotal": 3000,
              "total": 2250,
              "amount_due": 2250,
              "attempt_count": 1,
              "attempted": true,
              "paid": true,
              "period_start": 1700000000,
              "period_end": 1702592000,
              "next_payment_attempt": null,
              "currency": "usd",
              "lines": {
                "object": "list",
                "has_more": false,
                "url": "/v1/invoices/in_1/lines",
                "data": [
                  {
                    "id": "sub_1",
                    "object": "line_item",
                    "type": "subscription",
                    "amount": 2000,
                    "currency": "usd",
                    "period": {"start": 1700000000, "end": 1702592000},
                    "plan": %s,
                    "quantity": 1,
                    "proration": false
                  },
                  {
                    "id": "ii_1",
                    "object": "line_item",
                    "type": "invoiceitem",
                    "amount": 1000,
                    "currency": "usd",
                    "period": {"start": 1700000000, "end": 1700000000},
                    "plan": null,
                    "subscription": "sub_1",
                    "description": "Setup fee"
                  }
                ]
              }
            }
            """.formatted(PLAN_JSON);

    @Test
    void decodesInvoiceWithTypedLines() {
        Invoice invoice = Codecs.invoice().decode(json(INVOICE_JSON));

        assertThat(invoice.getTotal()).isEqualTo(2250);
        assertThat(invoice.getSubtotal()).isEqualTo(3000);
        assertThat(invoice.getAttemptCount().getValue()).isEqualTo(1);
        assertThat(invoice.getNextPaymentAttempt()).isNull();
        assertThat(invoice.getLines().getData()).extracting(InvoiceLineItem::getLineType)
                .containsExactly(LineItemType.SUBSCRIPTION, LineItemType.INVOICE_ITEM);

        InvoiceLineItem subscriptionLine = invoice.getLines().getData().get(0);
        assertThat(subscriptionLine.getPlan().getId()).isEqualTo("gold");
        assertThat(subscriptionLine.getPeriod().getEndsAt()).isEqualTo(PERIOD_END);
        assertThat(subscriptionLine.isDiscountable()).isTrue();

        InvoiceLineItem itemLine = invoice.getLines().getData().get(1);
        assertThat(itemLine.getPlan()).isNull();
        assertThat(itemLine.getQuantity()).isNull();
        assertThat(itemLine.getSubscription()).isEqualTo("sub_1");
    }

    @Test
    void reservedWireNamesAreWrittenBack() {
        JsonNode encoded = Codecs.invoice().encode(Codecs.invoice().decode(json(INVOICE_JSON)));
        JsonNode firstLine = encoded.get("lines").get("data").get(0);

        assertThat(firstLine.get("type").textValue()).isEqualTo("subscription");
        assertThat(firstLine.get("period").get("end").longValue()).isEqualTo(1702592000L);
        assertThat(firstLine.has("lineType")).isFalse();
        assertThat(firstLine.get("period").has("endsAt")).isFalse();
    }

    @Test
    void unknownLineTypeIsRejectedWithLinePath() {
        String unknown = INVOICE_JSON.replace("\"type\": \"invoiceitem\"", "\"type\": \"usage\"");

        assertThatThrownBy(() -> Codecs.invoice().decode(json(unknown)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.UNKNOWN_ENUM_TAG);
                    assertThat(e.getPath()).isEqualTo("invoice.lines.data[1].type");
                });
    }

    @Test
    void totalIsNotRecomputed() {
        String odd = INVOICE_JSON.replace("\"total\": 2250", "\"total\": 1");

        assertThat(Codecs.invoice().decode(json(odd)).getTotal()).isEqualTo(1);
    }
}
