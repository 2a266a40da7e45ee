package com.schemaidentity.model.config;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashLimitTest {

    @Test
    void testParseInteger() {
        assertThat(HashLimit.parse("12")).isEqualTo(HashLimit.of(12));
        assertThat(HashLimit.parse(" 0 ").getLength()).hasValue(0);
    }

    @Test
    void testParseUnbounded() {
        assertThat(HashLimit.parse("Unbounded")).isSameAs(HashLimit.UNBOUNDED);
        assertThat(HashLimit.UNBOUNDED.isUnbounded()).isTrue();
        assertThat(HashLimit.UNBOUNDED.getLength()).isEmpty();
    }

    @Test
    void testParseRejectsGarbage() {
        assertThatThrownBy(() -> HashLimit.parse("twelve")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HashLimit.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HashLimit.parse("-3")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNegativeLengthRejected() {
        assertThatThrownBy(() -> HashLimit.of(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void testApply() {
        String digest = "0123456789abcdef";

        assertThat(HashLimit.of(4).apply(digest)).isEqualTo("0123");
        assertThat(HashLimit.of(16).apply(digest)).isEqualTo(digest);
        assertThat(HashLimit.of(64).apply(digest)).isEqualTo(digest);
        assertThat(HashLimit.of(0).apply(digest)).isEmpty();
        assertThat(HashLimit.UNBOUNDED.apply(digest)).isEqualTo(digest);
    }

    @Test
    void testToString() {
        assertThat(HashLimit.of(12)).hasToString("12");
        assertThat(HashLimit.UNBOUNDED).hasToString("unbounded");
    }
}
