package com.fintech.marketdata.ingestion;

import com.fintech.marketdata.fetch.FetchException;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry bookkeeping for one request, independent of any network call.
 *
 * READY --failure(retryable, attempts left)--> WAITING --eligible--> READY
 * READY --failure(non-retryable or last attempt)--> EXHAUSTED
 * READY --success--> SUCCEEDED
 *
 * Not thread-safe; owned by a single worker.
 */
public final class RetryState {

    public enum Phase {
        READY,
        WAITING,
        SUCCEEDED,
        EXHAUSTED
    }

    private final BackoffPolicy policy;
    private int attempts;
    private Instant nextEligibleAt;
    private Phase phase = Phase.READY;
    private FetchException lastFailure;

    RetryState(BackoffPolicy policy) {
        this.policy = policy;
    }

    /**
     * Records a failed attempt and decides what happens next.
     *
     * @return The phase after the failure: WAITING or EXHAUSTED
     */
    public Phase recordFailure(FetchException failure, Instant now) {
        requireActive();
        attempts++;
        lastFailure = failure;
        if (!failure.isRetryable() || attempts >= policy.maxAttempts()) {
            phase = Phase.EXHAUSTED;
            nextEligibleAt = null;
        } else {
            phase = Phase.WAITING;
            nextEligibleAt = now.plus(policy.delayAfter(attempts));
        }
        return phase;
    }

    public void recordSuccess() {
        requireActive();
        phase = Phase.SUCCEEDED;
        nextEligibleAt = null;
    }

    /**
     * Returns how long to wait before the next attempt; zero when already eligible.
     */
    public Duration delayUntilEligible(Instant now) {
        if (phase != Phase.WAITING || nextEligibleAt == null || !nextEligibleAt.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, nextEligibleAt);
    }

    /** Moves WAITING to READY once the backoff has elapsed. */
    public boolean canAttempt(Instant now) {
        if (phase == Phase.WAITING && !nextEligibleAt.isAfter(now)) {
            phase = Phase.READY;
        }
        return phase == Phase.READY;
    }

    public boolean isTerminal() {
        return phase == Phase.SUCCEEDED || phase == Phase.EXHAUSTED;
    }

    public Phase phase() {
        return phase;
    }

    public int attempts() {
        return attempts;
    }

    public Instant nextEligibleAt() {
        return nextEligibleAt;
    }

    public FetchException lastFailure() {
        return lastFailure;
    }

    private void requireActive() {
        if (isTerminal()) {
            throw new IllegalStateException("Retry state already terminal: " + phase);
        }
    }
}
