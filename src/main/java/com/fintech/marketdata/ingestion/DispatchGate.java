package com.fintech.marketdata.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared switch that lets workers claim and call, pauses them after a
 * provider rate limit, or halts them for the rest of the run.
 *
 * A rate limit pauses all workers for the cooldown. Overlapping reports while
 * a pause is active extend it without counting as a new pause. Once more than
 * {@code maxPauses} pauses happened the gate halts instead, leaving the
 * remaining work pending for a manual resume.
 *
 * Thread-safe.
 */
public class DispatchGate {

    private static final Logger log = LoggerFactory.getLogger(DispatchGate.class);
    private static final Duration POLL = Duration.ofSeconds(1);

    private final Clock clock;
    private final int maxPauses;
    private Instant pausedUntil = Instant.MIN;
    private int pauses;
    private volatile HaltReason haltReason;
    private volatile String haltDetail;

    public DispatchGate(Clock clock, int maxPauses) {
        this.clock = clock;
        this.maxPauses = maxPauses;
    }

    /**
     * Reports a rate-limit hit.
     *
     * @return true if workers should wait and retry, false if the gate halted
     */
    public synchronized boolean onRateLimit(Duration cooldown, String detail) {
        if (isHalted()) {
            return false;
        }
        Instant now = clock.instant();
        Instant until = now.plus(cooldown);
        if (pausedUntil.isAfter(now)) {
            if (until.isAfter(pausedUntil)) {
                pausedUntil = until;
            }
            return true;
        }
        if (pauses >= maxPauses) {
            halt(HaltReason.RATE_LIMIT_EXHAUSTED, "Rate limited after " + pauses + " pauses: " + detail);
            return false;
        }
        pauses++;
        pausedUntil = until;
        log.warn("Rate limited, pausing dispatch: cooldown={}, pause={}/{}, detail={}", cooldown, pauses, maxPauses, detail);
        return true;
    }

    /** Stops all dispatch for the rest of the run. The first reason wins. */
    public synchronized void halt(HaltReason reason, String detail) {
        if (haltReason == null) {
            haltReason = reason;
            haltDetail = detail;
            log.error("Dispatch halted: reason={}, detail={}", reason, detail);
        }
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public Optional<HaltReason> haltReason() {
        return Optional.ofNullable(haltReason);
    }

    public Optional<String> haltDetail() {
        return Optional.ofNullable(haltDetail);
    }

    public synchronized Duration remainingPause() {
        Instant now = clock.instant();
        return pausedUntil.isAfter(now) ? Duration.between(now, pausedUntil) : Duration.ZERO;
    }

    public synchronized int pauses() {
        return pauses;
    }

    /**
     * Blocks while a pause is active.
     *
     * @return true if dispatch may proceed, false if the gate is halted
     */
    public boolean awaitOpen(Sleeper sleeper) throws InterruptedException {
        while (!isHalted()) {
            Duration remaining = remainingPause();
            if (remaining.isZero()) {
                return true;
            }
            sleeper.sleep(remaining.compareTo(POLL) < 0 ? remaining : POLL);
        }
        return false;
    }
}
