package com.payment.wire.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.wire.domain.Charge;
import com.payment.wire.domain.PaginatedList;
import com.payment.wire.error.DecodeErrorKind;
import com.payment.wire.error.DecodeException;
import org.junit.jupiter.api.Test;

import static com.payment.wire.WireFixtures.CHARGE_JSON;
import static com.payment.wire.WireFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListCodecTest {

    private static final Codec<PaginatedList<Charge>> CHARGES = Codecs.list(Codecs.charge());

    private static String page(String first, String second) {
        return """
                {"object": "list", "data": [%s, %s], "has_more": false, "url": "/v1/charges"}
                """.formatted(first, second);
    }

    private static String chargeWithId(String id) {
        return CHARGE_JSON.replace("\"id\": \"ch_1\"", "\"id\": \"" + id + "\"");
    }

    @Test
    void keepsServerOrderOnDecodeAndEncode() {
        PaginatedList<Charge> list = CHARGES.decode(json(page(chargeWithId("ch_b"), chargeWithId("ch_a"))));

        assertThat(list.getData()).extracting(Charge::getId).containsExactly("ch_b", "ch_a");
        assertThat(list.isHasMore()).isFalse();
        assertThat(list.getUrl()).isEqualTo("/v1/charges");
        assertThat(list.getTotalCount()).isNull();

        JsonNode encoded = CHARGES.encode(list);
        assertThat(encoded.get("object").textValue()).isEqualTo("list");
        assertThat(encoded.get("data").get(0).get("id").textValue()).isEqualTo("ch_b");
        assertThat(encoded.get("data").get(1).get("id").textValue()).isEqualTo("ch_a");
        assertThat(CHARGES.decode(encoded)).isEqualTo(list);
    }

    @Test
    void oneMalformedElementFailsWholeList() {
        String broken = chargeWithId("ch_b").replace("\"currency\": \"usd\",", "");

        assertThatThrownBy(() -> CHARGES.decode(json(page(chargeWithId("ch_a"), broken))))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.MISSING_FIELD);
                    assertThat(e.getPath()).isEqualTo("list.data[1].currency");
                });
    }

    @Test
    void readsTotalCountWhenSent() {
        PaginatedList<Charge> list = CHARGES.decode(json("""
                {"object": "list", "data": [], "has_more": true, "url": "/v1/charges", "total_count": 42}
                """));

        assertThat(list.getData()).isEmpty();
        assertThat(list.isHasMore()).isTrue();
        assertThat(list.getTotalCount().getValue()).isEqualTo(42);
    }

    @Test
    void dataMustBeAnArray() {
        assertThatThrownBy(() -> CHARGES.decode(json("""
                {"object": "list", "data": {}, "has_more": false, "url": "/v1/charges"}
                """)))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(DecodeErrorKind.TYPE_MISMATCH);
                    assertThat(e.getPath()).isEqualTo("list.data");
                });
    }

    @Test
    void decodedDataIsImmutable() {
        PaginatedList<Charge> list = CHARGES.decode(json(page(chargeWithId("ch_1"), chargeWithId("ch_2"))));

        assertThatThrownBy(() -> list.getData().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
