package com.fintech.marketdata.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of ingestion work: fetch and store the history of one series.
 * Records are immutable; every lifecycle transition returns a new instance
 * which the registry persists.
 *
 * @param category Symbol group
 * @param symbol Instrument symbol
 * @param timeframe Bar granularity
 * @param status Current lifecycle state
 * @param attemptCount Number of failed attempts so far
 * @param lastError Message of the most recent failure, if any
 * @param errorCategory Category of the most recent failure, if any
 * @param fromDate Optional first date to fetch (run default applies when null)
 * @param toDate Optional last date to fetch (run default applies when null)
 * @param createdAt When the task was generated
 * @param updatedAt When the task last changed state
 * @param recordsWritten Bars persisted by the last successful run
 */
public record Task(
    String category,
    String symbol,
    Timeframe timeframe,
    TaskStatus status,
    int attemptCount,
    String lastError,
    ErrorCategory errorCategory,
    LocalDate fromDate,
    LocalDate toDate,
    Instant createdAt,
    Instant updatedAt,
    long recordsWritten
) {

    public Task {
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(createdAt, "Created-at cannot be null");
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        SeriesKey key = new SeriesKey(category, symbol, timeframe);
        category = key.category();
        symbol = key.symbol();
    }

    /** Creates a pending task for a series, optionally bounded by a date window. */
    public static Task pending(SeriesKey key, DateWindow window, Instant now) {
        return new Task(key.category(), key.symbol(), key.timeframe(), TaskStatus.PENDING, 0, null, null,
            window != null ? window.from() : null,
            window != null ? window.to() : null,
            now, now, 0L);
    }

    public SeriesKey key() {
        return new SeriesKey(category, symbol, timeframe);
    }

    /** Returns the task's own date window when both bounds are set. */
    public Optional<DateWindow> window() {
        if (fromDate == null || toDate == null) {
            return Optional.empty();
        }
        return Optional.of(new DateWindow(fromDate, toDate));
    }

    public Task claimed(Instant now) {
        return withStatus(TaskStatus.IN_PROGRESS, attemptCount, lastError, errorCategory, recordsWritten, now);
    }

    public Task completed(long records, Instant now) {
        return withStatus(TaskStatus.COMPLETED, attemptCount, null, null, records, now);
    }

    public Task failed(String error, ErrorCategory category, Instant now) {
        return withStatus(TaskStatus.FAILED, attemptCount + 1, error, category, recordsWritten, now);
    }

    /** Back to pending; attempt count and last error are kept for the record. */
    public Task requeued(Instant now) {
        return withStatus(TaskStatus.PENDING, attemptCount, lastError, errorCategory, recordsWritten, now);
    }

    private Task withStatus(TaskStatus newStatus, int attempts, String error, ErrorCategory category,
                            long records, Instant now) {
        return new Task(this.category, symbol, timeframe, newStatus, attempts, error, category,
            fromDate, toDate, createdAt, now, records);
    }
}
