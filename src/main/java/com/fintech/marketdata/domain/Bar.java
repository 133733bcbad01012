package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Immutable OHLCV observation for one instrument at one bar-open time.
 * Unlike an aggregated candle, a bar arrives from an external source and may
 * be inconsistent, so the constructor accepts any values and {@link #isValid()}
 * reports whether the OHLC invariant holds.
 *
 * @param timestamp Bar open time (epoch seconds, UTC)
 * @param open First traded price
 * @param high Highest traded price
 * @param low Lowest traded price
 * @param close Last traded price
 * @param volume Traded quantity
 */
@JsonPropertyOrder({"timestamp", "open", "high", "low", "close", "volume"})
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    long volume
) {

    /**
     * Returns true if {@code low <= min(open, close) <= max(open, close) <= high},
     * all prices are finite, volume is non-negative and the timestamp is not before the epoch.
     */
    @JsonIgnore
    public boolean isValid() {
        if (!Double.isFinite(open) || !Double.isFinite(high)
                || !Double.isFinite(low) || !Double.isFinite(close)) {
            return false;
        }
        return timestamp >= 0
            && volume >= 0
            && low <= Math.min(open, close)
            && Math.max(open, close) <= high;
    }

    /** Returns the bar open time as an instant. */
    public Instant instant() {
        return Instant.ofEpochSecond(timestamp);
    }

    /** Returns the calendar date of the bar in the given zone. */
    public LocalDate date(ZoneId zone) {
        return LocalDate.ofInstant(instant(), zone);
    }
}
