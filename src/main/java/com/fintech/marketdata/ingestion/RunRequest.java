package com.fintech.marketdata.ingestion;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalDate;
import java.util.List;

/**
 * Operator request to start a run.
 *
 * @param categories Categories to cover; empty means every category of the universe
 * @param timeframes Timeframe codes; empty means the configured defaults
 * @param workers Worker count; null means the configured default
 * @param incremental Fetch only from the last stored bar; null means the configured default
 * @param from Optional first date for newly generated tasks
 * @param to Optional last date for newly generated tasks
 */
public record RunRequest(
    List<String> categories,
    List<String> timeframes,
    @Min(value = 1, message = "At least one worker is required")
    @Max(value = 64, message = "At most 64 workers are allowed")
    Integer workers,
    Boolean incremental,
    LocalDate from,
    LocalDate to
) {

    public RunRequest {
        categories = categories != null ? List.copyOf(categories) : List.of();
        timeframes = timeframes != null ? List.copyOf(timeframes) : List.of();
    }
}
