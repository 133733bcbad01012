package com.fintech.marketdata.ingestion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum interval between consecutive provider calls of one worker.
 * One instance per worker thread.
 */
public final class RequestPacer {

    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastCall;

    public RequestPacer(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /** Blocks until the minimum interval since the previous call has passed, then records this call. */
    public void awaitTurn() throws InterruptedException {
        if (lastCall != null && !minInterval.isZero()) {
            Duration wait = Duration.between(clock.instant(), lastCall.plus(minInterval));
            if (!wait.isNegative() && !wait.isZero()) {
                sleeper.sleep(wait);
            }
        }
        lastCall = clock.instant();
    }
}
