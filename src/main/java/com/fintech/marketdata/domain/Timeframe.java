package com.fintech.marketdata.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Supported bar granularities.
 *
 * Each timeframe has an operator-facing code (used in paths and the REST API),
 * the resolution code the history provider expects and its length in seconds.
 */
public enum Timeframe {
    M1("1m", "1", 60L),
    M5("5m", "5", 300L),
    M15("15m", "15", 900L),
    M30("30m", "30", 1_800L),
    H1("60m", "60", 3_600L),
    D1("1D", "D", 86_400L);

    private final String code;
    private final String resolution;
    private final long seconds;

    Timeframe(String code, String resolution, long seconds) {
        this.code = code;
        this.resolution = resolution;
        this.seconds = seconds;
    }

    /** Returns the operator-facing code, e.g. {@code 15m} or {@code 1D}. */
    @JsonValue
    public String code() {
        return code;
    }

    /** Returns the provider resolution code, e.g. {@code 15} or {@code D}. */
    public String resolution() {
        return resolution;
    }

    /** Returns the bar length in seconds. */
    public long seconds() {
        return seconds;
    }

    public boolean isIntraday() {
        return this != D1;
    }

    /**
     * Parses an operator code. Accepts {@code 1h} for {@code 60m} and
     * {@code D} or {@code 1d} for {@code 1D}.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    @JsonCreator
    public static Timeframe fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Timeframe code cannot be blank");
        }
        String trimmed = code.trim();
        switch (trimmed) {
            case "1h":
                return H1;
            case "D":
            case "1d":
                return D1;
            default:
                break;
        }
        return Arrays.stream(values())
            .filter(tf -> tf.code.equals(trimmed))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                String.format("Unsupported timeframe '%s'. Allowed: %s", code, codes())));
    }

    /** Returns all operator codes in declaration order. */
    public static List<String> codes() {
        return Arrays.stream(values()).map(Timeframe::code).toList();
    }
}
