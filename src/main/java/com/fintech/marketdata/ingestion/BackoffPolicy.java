package com.fintech.marketdata.ingestion;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter between attempts of the same request.
 *
 * Delay after the n-th failure is {@code min(initial * multiplier^(n-1), max)}
 * plus a uniform jitter in {@code [0, jitter]}.
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .multiplier(1.5)
 *     .maxAttempts(3)
 *     .jitter(Duration.ofMillis(300))
 *     .build();
 * RetryState state = policy.newState();
 * </pre>
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Duration jitter;
    private final DoubleSupplier random;

    private BackoffPolicy(Builder builder) {
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.maxAttempts = builder.maxAttempts;
        this.jitter = builder.jitter;
        this.random = builder.random;
    }

    /** Starts tracking a fresh request. */
    public RetryState newState() {
        return new RetryState(this);
    }

    /**
     * Returns the wait after the given number of consecutive failures.
     *
     * @param failures Failures so far, at least 1
     */
    public Duration delayAfter(int failures) {
        double factor = Math.pow(multiplier, Math.max(0, failures - 1));
        long baseMillis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        long jitterMillis = (long) (random.getAsDouble() * jitter.toMillis());
        return Duration.ofMillis(baseMillis + jitterMillis);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for BackoffPolicy.
     */
    public static final class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 1.5;
        private int maxAttempts = 3;
        private Duration jitter = Duration.ofMillis(300);
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder jitter(Duration jitter) {
            this.jitter = jitter;
            return this;
        }

        /** Source of uniform values in {@code [0, 1)}; fixed in tests. */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.isNegative() || maxDelay.isNegative() || jitter.isNegative()) {
                throw new IllegalArgumentException("Delays cannot be negative");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be >= 1.0: " + multiplier);
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be >= 1: " + maxAttempts);
            }
            return new BackoffPolicy(this);
        }
    }
}
