package com.alpaca.flowdesk.config;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class RawPropertyTest {

    @Test
    void inlineCommentsAreStripped() {
        assertThat(RawProperty.parseInt("20   # seconds", 5)).isEqualTo(20);
        assertThat(RawProperty.parseDouble("0.05;spread", 1)).isEqualTo(0.05);
        assertThat(RawProperty.parseTime(" 09:35 # NY ", LocalTime.NOON)).isEqualTo(LocalTime.of(9, 35));
    }

    @Test
    void badValuesFallBackToDefault() {
        assertThat(RawProperty.parseInt("twenty", 5)).isEqualTo(5);
        assertThat(RawProperty.parseLong(null, 7L)).isEqualTo(7L);
        assertThat(RawProperty.parseDouble("", 2.0)).isEqualTo(2.0);
        assertThat(RawProperty.parseTime("9h35", LocalTime.NOON)).isEqualTo(LocalTime.NOON);
        assertThat(RawProperty.parseBool("maybe", true)).isTrue();
    }

    @Test
    void booleanSpellings() {
        assertThat(RawProperty.parseBool("OFF", true)).isFalse();
        assertThat(RawProperty.parseBool("yes", false)).isTrue();
        assertThat(RawProperty.parseBool("0", true)).isFalse();
    }

    @Test
    void symbolsAreNormalised() {
        assertThat(RawProperty.parseSymbols(" tsla, NVDA,,aapl ,TSLA"))
                .containsExactly("TSLA", "NVDA", "AAPL");
        assertThat(RawProperty.parseSymbols(null)).isEmpty();
    }
}
