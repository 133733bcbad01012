package com.fintech.marketdata.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Aggregate task counts, recomputed from task statuses.
 */
public record RegistryStats(
    int total,
    int pending,
    int inProgress,
    int completed,
    int failed,
    Instant startedAt,
    Instant updatedAt
) {

    public static RegistryStats of(Collection<Task> tasks, Instant startedAt, Instant updatedAt) {
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new RegistryStats(tasks.size(), pending, inProgress, completed, failed, startedAt, updatedAt);
    }

    /** Returns true when nothing is left to dispatch or running. */
    public boolean isDrained() {
        return pending == 0 && inProgress == 0;
    }

    /**
     * Estimates the time left for the remaining work as
     * {@code elapsed / completed * (pending + inProgress)}.
     *
     * @param elapsed Wall-clock time spent so far
     * @return Estimate, or empty when nothing has completed yet
     */
    public Optional<Duration> estimateRemaining(Duration elapsed) {
        return estimateRemaining(elapsed, completed);
    }

    /**
     * Same estimate from a rate measured over one run only.
     *
     * @param elapsed Time since the run started
     * @param completedInRun Tasks the run completed in that time
     */
    public Optional<Duration> estimateRemaining(Duration elapsed, long completedInRun) {
        if (completedInRun <= 0 || elapsed == null || elapsed.isNegative()) {
            return Optional.empty();
        }
        long remaining = (long) pending + inProgress;
        return Optional.of(elapsed.dividedBy(completedInRun).multipliedBy(remaining));
    }
}
