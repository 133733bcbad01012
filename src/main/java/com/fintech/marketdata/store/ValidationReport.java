package com.fintech.marketdata.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Read-only health check of a stored series.
 *
 * @param valid True when no column is missing, no required value is null,
 *              no timestamp repeats and every bar satisfies the OHLC invariant
 * @param recordCount Rows read across all partitions
 * @param partitionCount Partition files read
 * @param missingColumns Required columns absent from at least one partition header
 * @param nullCounts Empty or unparseable values per column
 * @param duplicateCount Rows whose timestamp was already seen
 * @param invalidOhlcCount Parseable rows breaking the OHLC invariant
 * @param firstTimestamp Earliest timestamp, null when no rows
 * @param lastTimestamp Latest timestamp, null when no rows
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationReport(
    boolean valid,
    long recordCount,
    int partitionCount,
    List<String> missingColumns,
    Map<String, Long> nullCounts,
    long duplicateCount,
    long invalidOhlcCount,
    Long firstTimestamp,
    Long lastTimestamp
) {
}
