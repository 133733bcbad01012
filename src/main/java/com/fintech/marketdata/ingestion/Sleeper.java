package com.fintech.marketdata.ingestion;

import java.time.Duration;

/**
 * Blocking wait used for pacing, backoff and dispatch pauses; replaced by a
 * recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
