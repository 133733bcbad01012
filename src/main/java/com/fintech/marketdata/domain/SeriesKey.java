package com.fintech.marketdata.domain;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identity of one stored series and of one ingestion task.
 * Components end up as directory names, so path separators are rejected.
 *
 * @param category Logical symbol group (e.g. nifty50)
 * @param symbol Instrument symbol
 * @param timeframe Bar granularity
 */
public record SeriesKey(String category, String symbol, Timeframe timeframe) implements Comparable<SeriesKey> {

    private static final String SEPARATOR = "|";
    private static final Pattern FORBIDDEN = Pattern.compile("[|/\\\\]|^\\.\\.?$");
    private static final Comparator<SeriesKey> ORDER = Comparator
        .comparing(SeriesKey::category)
        .thenComparing(SeriesKey::symbol)
        .thenComparing(SeriesKey::timeframe);

    public SeriesKey {
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
        category = requireSegment(category, "Category");
        symbol = requireSegment(symbol, "Symbol");
    }

    /**
     * Checks one key component and returns it trimmed.
     *
     * @throws IllegalArgumentException if blank or containing a path separator
     */
    public static String requireSegment(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        String trimmed = value.trim();
        if (FORBIDDEN.matcher(trimmed).find()) {
            throw new IllegalArgumentException(name + " contains an illegal character: " + value);
        }
        return trimmed;
    }

    /** Returns {@code category|symbol|timeframe}, the registry key. */
    public String toStringKey() {
        return category + SEPARATOR + symbol + SEPARATOR + timeframe.code();
    }

    public static SeriesKey fromStringKey(String key) {
        String[] parts = key.split(Pattern.quote(SEPARATOR), -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed series key: " + key);
        }
        return new SeriesKey(parts[0], parts[1], Timeframe.fromCode(parts[2]));
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toStringKey();
    }
}
