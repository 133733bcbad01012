package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.SeriesKey;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Logical history request for one series over an inclusive date range.
 *
 * @param key Series to fetch
 * @param from First date (inclusive, market zone)
 * @param to Last date (inclusive, market zone)
 * @param includePartialBar When false the still-forming bar is excluded
 */
public record FetchRequest(SeriesKey key, LocalDate from, LocalDate to, boolean includePartialBar) {

    public FetchRequest {
        Objects.requireNonNull(key, "Series key cannot be null");
        Objects.requireNonNull(from, "From date cannot be null");
        Objects.requireNonNull(to, "To date cannot be null");
    }

    public static FetchRequest closedBars(SeriesKey key, LocalDate from, LocalDate to) {
        return new FetchRequest(key, from, to, false);
    }
}
