package com.fintech.marketdata.fetch;

import com.fintech.marketdata.domain.DateWindow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits an inclusive date range into provider-sized windows.
 *
 * Window {@code i} starts at {@code from + i * maxDays} and ends
 * {@code maxDays - 1} days later or at {@code to}, whichever comes first, so
 * windows are contiguous, never overlap and jointly cover the range.
 */
public final class RangeSplitter {

    private RangeSplitter() {
    }

    /**
     * @param from First date (inclusive)
     * @param to Last date (inclusive)
     * @param maxDays Maximum calendar days per window
     * @return Ordered windows; empty when {@code from} is after {@code to}
     */
    public static List<DateWindow> split(LocalDate from, LocalDate to, int maxDays) {
        if (maxDays <= 0) {
            throw new IllegalArgumentException("Max window days must be positive: " + maxDays);
        }
        if (from.isAfter(to)) {
            return Collections.emptyList();
        }
        List<DateWindow> windows = new ArrayList<>();
        LocalDate start = from;
        while (!start.isAfter(to)) {
            LocalDate end = start.plusDays(maxDays - 1L);
            if (end.isAfter(to)) {
                end = to;
            }
            windows.add(new DateWindow(start, end));
            start = end.plusDays(1);
        }
        return windows;
    }
}
