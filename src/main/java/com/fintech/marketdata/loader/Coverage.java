package com.fintech.marketdata.loader;

/**
 * Stored extent of one series.
 *
 * @param firstTimestamp Earliest bar (epoch seconds)
 * @param lastTimestamp Latest bar (epoch seconds)
 * @param barCount Stored bars
 * @param partitionCount Monthly partitions
 */
public record Coverage(long firstTimestamp, long lastTimestamp, long barCount, int partitionCount) {
}
