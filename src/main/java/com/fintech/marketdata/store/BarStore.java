package com.fintech.marketdata.store;

import com.fintech.marketdata.domain.Bar;
import com.fintech.marketdata.domain.PartitionKey;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.Timeframe;
import com.fintech.marketdata.domain.WriteMode;

import java.util.List;
import java.util.OptionalLong;

/**
 * Storage abstraction for bar series partitioned by calendar month.
 *
 * Implementations must:
 * - Keep every partition sorted by timestamp with unique timestamps
 * - Serialize read-merge-write cycles per series so concurrent writers never lose updates
 * - Never block writers of different series on each other
 *
 * Reads must not depend on how a range happens to be split across partitions.
 */
public interface BarStore {

    /**
     * Writes bars into the partitions their timestamps fall in.
     *
     * {@link WriteMode#APPEND} merges with existing content, the new bar winning
     * on a timestamp conflict. {@link WriteMode#OVERWRITE} replaces the content
     * of every partition the batch touches.
     *
     * @param key Series
     * @param bars Bars in any order; duplicates within the batch resolve to the last one
     * @param mode Merge behaviour
     * @return Number of distinct bars written
     * @throws IllegalArgumentException if any bar breaks the OHLC invariant (nothing is written)
     * @throws StoreException on I/O failure
     */
    int write(SeriesKey key, List<Bar> bars, WriteMode mode);

    /**
     * Reads a series within inclusive bounds.
     *
     * @param key Series
     * @param from Lower bound (epoch seconds), null for unbounded
     * @param to Upper bound (epoch seconds), null for unbounded
     * @return Bars sorted by timestamp without duplicates; empty if the series does not exist
     */
    List<Bar> readRange(SeriesKey key, Long from, Long to);

    /**
     * Returns the latest stored timestamp across all partitions of a series,
     * used to fetch only what is newer on the next run.
     */
    OptionalLong lastTimestamp(SeriesKey key);

    /**
     * Checks schema, nulls, duplicates and OHLC consistency of a series without modifying it.
     */
    ValidationReport validate(SeriesKey key);

    /**
     * Finds stretches of missing bars within trading sessions.
     */
    List<Gap> findGaps(SeriesKey key, Long from, Long to);

    /** Returns true if at least one partition exists for the series. */
    boolean exists(SeriesKey key);

    /** Returns the stored partitions of a series in chronological order. */
    List<PartitionKey> partitions(SeriesKey key);

    List<String> categories();

    List<String> symbols(String category);

    List<Timeframe> timeframes(String category, String symbol);
}
