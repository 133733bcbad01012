package com.fintech.marketdata.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SeriesKey and PartitionKey Tests")
class SeriesKeyTest {

    @Test
    @DisplayName("String key round trip")
    void testStringKey() {
        SeriesKey key = new SeriesKey(" nifty50 ", "RELIANCE", Timeframe.D1);

        assertThat(key.category()).isEqualTo("nifty50");
        assertThat(key.toStringKey()).isEqualTo("nifty50|RELIANCE|1D");
        assertThat(SeriesKey.fromStringKey("nifty50|RELIANCE|1D")).isEqualTo(key);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a/b", "a\\b", "a|b", "..", ".", " "})
    @DisplayName("Path-unsafe components are rejected")
    void testRejectsUnsafeSegments(String symbol) {
        assertThatThrownBy(() -> new SeriesKey("nifty50", symbol, Timeframe.M5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Symbols with dots and dashes are allowed")
    void testAllowsExchangeSymbols() {
        assertThat(new SeriesKey("fo", "M&M-EQ.NS", Timeframe.M5).symbol()).isEqualTo("M&M-EQ.NS");
    }

    @Test
    @DisplayName("Malformed string keys are rejected")
    void testMalformedStringKey() {
        assertThatThrownBy(() -> SeriesKey.fromStringKey("nifty50|RELIANCE"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Partition covers one UTC calendar month")
    void testPartitionBounds() {
        SeriesKey key = new SeriesKey("nifty50", "TCS", Timeframe.M1);
        // 2023-02-28T23:59:00Z
        PartitionKey partition = PartitionKey.of(key, 1_677_628_740L);

        assertThat(partition.month()).isEqualTo(YearMonth.of(2023, 2));
        assertThat(partition.startEpochSecond()).isEqualTo(1_675_209_600L);
        assertThat(partition.endEpochSecond()).isEqualTo(1_677_628_799L);
        assertThat(PartitionKey.monthOf(1_677_628_800L)).isEqualTo(YearMonth.of(2023, 3));
    }
}
