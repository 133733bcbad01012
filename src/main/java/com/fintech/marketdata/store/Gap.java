package com.fintech.marketdata.store;

/**
 * Missing stretch between two consecutive stored bars.
 *
 * @param afterTimestamp Last bar before the gap
 * @param beforeTimestamp First bar after the gap
 * @param missingBars Bars expected in between at the series interval
 */
public record Gap(long afterTimestamp, long beforeTimestamp, long missingBars) {
}
