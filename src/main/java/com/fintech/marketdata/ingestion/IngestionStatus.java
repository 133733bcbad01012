package com.fintech.marketdata.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.marketdata.domain.ErrorCategory;
import com.fintech.marketdata.domain.RegistryStats;

import java.util.Map;

/**
 * Progress snapshot for operators.
 *
 * @param running Whether a run is active
 * @param stats Registry counts
 * @param etaSeconds Estimated seconds left, null until something completed
 * @param failureBreakdown Failed tasks per category
 * @param lastRun Most recent finished run, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionStatus(
    boolean running,
    RegistryStats stats,
    Long etaSeconds,
    Map<ErrorCategory, Long> failureBreakdown,
    RunReport lastRun
) {
}
