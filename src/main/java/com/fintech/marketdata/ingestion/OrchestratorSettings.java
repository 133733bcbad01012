package com.fintech.marketdata.ingestion;

import java.time.Duration;

/**
 * Tunables of a run.
 *
 * @param minCallInterval Minimum gap between two calls of one worker
 * @param rateLimitCooldown Dispatch pause after a rate-limit response
 * @param maxRateLimitPauses Pauses allowed per run before dispatch halts
 * @param lookbackDays Default history depth for tasks without their own window
 * @param incremental Start at the last stored bar instead of the full lookback
 */
public record OrchestratorSettings(
    Duration minCallInterval,
    Duration rateLimitCooldown,
    int maxRateLimitPauses,
    int lookbackDays,
    boolean incremental
) {

    public OrchestratorSettings withIncremental(boolean value) {
        return new OrchestratorSettings(minCallInterval, rateLimitCooldown, maxRateLimitPauses, lookbackDays, value);
    }
}
