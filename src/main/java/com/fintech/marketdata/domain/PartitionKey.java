package com.fintech.marketdata.domain;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Address of one monthly partition of a series.
 */
public record PartitionKey(SeriesKey series, YearMonth month) implements Comparable<PartitionKey> {

    public PartitionKey {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(month, "Month cannot be null");
    }

    /** Returns the partition holding the given timestamp (UTC month). */
    public static PartitionKey of(SeriesKey series, long epochSeconds) {
        return new PartitionKey(series, monthOf(epochSeconds));
    }

    public static YearMonth monthOf(long epochSeconds) {
        return YearMonth.from(Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC));
    }

    /** Returns the first second covered by this partition. */
    public long startEpochSecond() {
        return month.atDay(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }

    /** Returns the last second covered by this partition. */
    public long endEpochSecond() {
        return month.plusMonths(1).atDay(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1;
    }

    @Override
    public int compareTo(PartitionKey other) {
        int bySeries = series.compareTo(other.series);
        return bySeries != 0 ? bySeries : month.compareTo(other.month);
    }
}
