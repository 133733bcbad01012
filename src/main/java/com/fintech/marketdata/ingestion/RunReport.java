package com.fintech.marketdata.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.marketdata.domain.ErrorCategory;
import com.fintech.marketdata.domain.RegistryStats;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one orchestrator run.
 *
 * @param startedAt Run start
 * @param finishedAt Run end
 * @param workers Worker threads used
 * @param before Registry statistics when the run started
 * @param after Registry statistics when the run ended
 * @param tasksCompleted Tasks completed by this run
 * @param tasksFailed Tasks failed by this run
 * @param tasksReleased Tasks returned to pending because dispatch halted
 * @param noDataTasks Completed tasks whose windows were all empty
 * @param barsWritten Bars written to the store
 * @param windowsFetched Successful provider calls
 * @param retries Backoff retries after transient failures
 * @param rateLimitHits Rate-limit responses seen
 * @param integrityWindows Windows discarded for broken bars
 * @param failureBreakdown Failed tasks in the registry per error category
 * @param haltReason Why dispatch stopped early, null if the registry drained
 * @param haltDetail Message accompanying the halt
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
    Instant startedAt,
    Instant finishedAt,
    int workers,
    RegistryStats before,
    RegistryStats after,
    long tasksCompleted,
    long tasksFailed,
    long tasksReleased,
    long noDataTasks,
    long barsWritten,
    long windowsFetched,
    long retries,
    long rateLimitHits,
    long integrityWindows,
    Map<ErrorCategory, Long> failureBreakdown,
    HaltReason haltReason,
    String haltDetail
) {

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public boolean halted() {
        return haltReason != null;
    }
}
