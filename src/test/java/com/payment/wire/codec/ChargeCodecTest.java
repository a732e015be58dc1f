package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.payment.wire.domain.Charge;
import com.payment.wire.domain.ChargeStatus;
import com.payment.wire.domain.RefundReason;
import com.payment.wire.error.DecodeErrorKind;
import com.payment.wire.error.DecodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.payment.wire.WireFixtures.CHARGE_JSON;
import static com.payment.wire.WireFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChargeCodecTest {

    @Test
    void decodesChargeWithRefunds() {
        Charge charge = Codecs.charge().decode(json(CHARGE_JSON));

        assertThat(charge.getStatus()).isEqualTo(ChargeStatus.SUCCEEDED);
        assertThat(charge.getAmount().getValue()).isEqualTo(2000);
        assertThat(charge.getAmountRefunded().getValue()).isEqualTo(500);
        assertThat(charge.getSource().getId()).isEqualTo("card_ABC123");
        assertThat(charge.getInvoice()).isNull();
        assertThat(charge.getRefunds()).hasSize(1);
        assertThat(charge.getRefunds().get(0).getReason()).isEqualTo(RefundReason.REQUESTED_BY_CUSTOMER);
        assertThat(charge.getMetadata().get("order_id")).contains("6735");
    }

    @Test
    void unknownStatusIsUnknownEnumTag() {
        String pending = CHARGE_JSON.replace("\"status\": \"succeeded\"", "\"status\": \"pending\"");

        assertThatThrownBy(() -> Codecs.charge().decode(json(pending)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.UNKNOWN_ENUM_TAG);
                    assertThat(e.getPath()).isEqualTo("charge.status");
                });
    }

    @Test
    void negativeAmountFailsValidation() {
        String negative = CHARGE_JSON.replace("\"amount\": 2000", "\"amount\": -1");

        assertThatThrownBy(() -> Codecs.charge().decode(json(negative)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.VALIDATION_FAILED);
                    assertThat(e.getPath()).isEqualTo("charge.amount");
                });
    }

    @Test
    void amountAsStringIsTypeMismatch() {
        String text = CHARGE_JSON.replace("\"amount\": 2000", "\"amount\": \"2000\"");

        assertThatThrownBy(() -> Codecs.charge().decode(json(text)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.TYPE_MISMATCH);
                    assertThat(e.getPath()).isEqualTo("charge.amount");
                });
    }

    @Test
    void badRefundFailsWholeChargeWithIndexedPath() {
        String badRefund = CHARGE_JSON.replace("\"reason\": \"requested_by_customer\"", "\"reason\": \"changed_mind\"");

        assertThatThrownBy(() -> Codecs.charge().decode(json(badRefund)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.UNKNOWN_ENUM_TAG);
                    assertThat(e.getPath()).isEqualTo("charge.refunds[0].reason");
                });
    }

    @Test
    void acceptsLegacyCardFieldForSource() {
        String legacy = CHARGE_JSON.replace("\"source\":", "\"card\":");

        Charge charge = Codecs.charge().decode(json(legacy));

        assertThat(charge.getSource().getLast4()).isEqualTo("4242");
        assertThat(Codecs.charge().encode(charge).has("source")).isTrue();
    }

    @Test
    void missingSourceNamesSource() {
        JsonNode node = json(CHARGE_JSON);
        ((ObjectNode) node).remove("source");

        assertThatThrownBy(() -> Codecs.charge().decode(node))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.MISSING_FIELD);
                    assertThat(e.getPath()).isEqualTo("charge.source");
                });
    }

    @Test
    void defaultsApplyForAbsentFlags() {
        JsonNode node = json(CHARGE_JSON);
        ((ObjectNode) node).remove(List.of("captured", "amount_refunded", "refunds"));

        Charge charge = Codecs.charge().decode(node);

        assertThat(charge.isCaptured()).isTrue();
        assertThat(charge.getAmountRefunded().getValue()).isZero();
        assertThat(charge.getRefunds()).isEmpty();
    }
}
