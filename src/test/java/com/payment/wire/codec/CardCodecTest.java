package com.payment.wire.codec;

import com.payment.wire.domain.Card;
import com.payment.wire.domain.Customer;
import com.payment.wire.error.DecodeErrorKind;
import com.payment.wire.error.DecodeException;
import org.junit.jupiter.api.Test;

import static com.payment.wire.WireFixtures.CARD_JSON;
import static com.payment.wire.WireFixtures.cardJson;
import static com.payment.wire.WireFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardCodecTest {

    @Test
    void decodesCardWithOwnerId() {
        Card card = Codecs.card().decode(json(CARD_JSON));

        assertThat(card.getId()).isEqualTo("card_ABC123");
        assertThat(card.getExpMonth().getValue()).isEqualTo(8);
        assertThat(card.getCustomer().isEmbedded()).isFalse();
        assertThat(card.getCustomer().getId()).isEqualTo("cus_123");
        assertThat(card.getCvcCheck()).isEqualTo("pass");
    }

    @Test
    void decodesCardWithEmbeddedOwner() {
        String owner = """
                {"id": "cus_123", "object": "customer", "created": 1700000000,
                 "default_source": "card_X", "email": "jenny@example.com"}
                """;

        Card card = Codecs.card().decode(json(cardJson("card_X", owner)));

        assertThat(card.getCustomer().isEmbedded()).isTrue();
        Customer customer = card.getCustomer().getEmbedded().orElseThrow();
        assertThat(customer.getEmail()).isEqualTo("jenny@example.com");
        assertThat(customer.getDefaultSource().isEmbedded()).isFalse();
    }

    @Test
    void embeddedOwnerMayNotEmbedItsDefaultSource() {
        String owner = """
                {"id": "cus_123", "object": "customer", "created": 1700000000,
                 "default_source": %s}
                """.formatted(CARD_JSON);

        assertThatThrownBy(() -> Codecs.card().decode(json(cardJson("card_X", owner))))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.TYPE_MISMATCH);
                    assertThat(e.getPath()).isEqualTo("card.customer.default_source");
                });
    }

    @Test
    void zeroExpiryMonthFailsValidation() {
        String invalid = CARD_JSON.replace("\"exp_month\": 8", "\"exp_month\": 0");

        assertThatThrownBy(() -> Codecs.card().decode(json(invalid)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.VALIDATION_FAILED);
                    assertThat(e.getPath()).isEqualTo("card.exp_month");
                });
    }

    @Test
    void toStringMasksCardIdentity() {
        Card card = Codecs.card().decode(json(CARD_JSON));

        assertThat(card.toString())
                .doesNotContain("4242")
                .doesNotContain("Xt5EWLLDS7FJjR1c")
                .contains("card_ABC123");
    }

    @Test
    void unknownFieldsAreIgnored() {
        String withExtras = CARD_JSON.replace("\"funding\": \"credit\",",
                "\"funding\": \"credit\", \"wallet\": {\"type\": \"apple_pay\"}, \"networks\": [\"visa\"],");

        assertThat(Codecs.card().decode(json(withExtras))).isEqualTo(Codecs.card().decode(json(CARD_JSON)));
    }
}
