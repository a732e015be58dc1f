package com.payment.wire.scalar;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataTest {

    static Map<String, String> pairs(int count) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            map.put("key" + i, "value" + i);
        }
        return map;
    }

    @Test
    void acceptsTenPairs() {
        assertThat(Metadata.of(pairs(10)).size()).isEqualTo(10);
    }

    @Test
    void rejectsElevenPairs() {
        assertThatThrownBy(() -> Metadata.of(pairs(11)))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("at most 10 pairs");
    }

    @Test
    void keyLengthBoundary() {
        assertThat(Metadata.of(Map.of("k".repeat(40), "v")).get("k".repeat(40))).contains("v");
        assertThatThrownBy(() -> Metadata.of(Map.of("k".repeat(41), "v")))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("longer than 40");
    }

    @Test
    void valueLengthBoundary() {
        assertThat(Metadata.of(Map.of("note", "x".repeat(500))).isEmpty()).isFalse();
        assertThatThrownBy(() -> Metadata.of(Map.of("note", "x".repeat(501))))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("longer than 500");
    }

    @Test
    void keepsInsertionOrderAndIsUnmodifiable() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("b", "2");
        source.put("a", "1");
        Metadata metadata = Metadata.of(source);
        source.put("c", "3");

        assertThat(List.copyOf(metadata.asMap().keySet())).containsExactly("b", "a");
        assertThatThrownBy(() -> metadata.asMap().put("z", "9")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyMapIsTheSharedEmptyValue() {
        assertThat(Metadata.of(Map.of())).isSameAs(Metadata.empty());
        assertThat(Metadata.empty()).isEqualTo(Metadata.of(new LinkedHashMap<>()));
    }

    @Test
    void keyLengthCountsCharactersNotUtf16Units() {
        String emoji = new String(Character.toChars(0x1F600));

        assertThat(Metadata.of(Map.of(emoji.repeat(40), "v")).size()).isEqualTo(1);
        assertThatThrownBy(() -> Metadata.of(Map.of(emoji.repeat(41), "v")))
                .isInstanceOf(InvalidValueException.class);
        assertThat(Metadata.checkPair("k", emoji.repeat(500))).isEmpty();
    }
}
