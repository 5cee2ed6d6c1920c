package in.fxsignal.service.candle;

import java.time.Duration;

/**
 * Bounded retry policy with exponential backoff for candle fetches.
 *
 * Immutable, so one instance can be shared by concurrent fetches. The delay
 * before retry {@code n} (1-based) is {@code initialDelay × multiplier^(n-1)},
 * capped at {@code maxDelay}.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(10))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 * </pre>
 */
public final class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Total attempts including the first call.
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} failed attempts.
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1: " + failedAttempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * REST candle fetches: doubling delays from {@code initialDelay}, capped at
     * 10s or at the initial delay when that is longer.
     */
    public static RetryPolicy forCandleSource(int attempts, Duration initialDelay) {
        Duration cap = Duration.ofSeconds(10);
        return builder()
            .initialDelay(initialDelay)
            .maxDelay(initialDelay.compareTo(cap) > 0 ? initialDelay : cap)
            .multiplier(2.0)
            .maxAttempts(attempts)
            .build();
    }

    @Override
    public String toString() {
        return "RetryPolicy{attempts=" + maxAttempts + ", initial=" + initialDelay.toMillis()
            + "ms, max=" + maxDelay.toMillis() + "ms, x" + multiplier + "}";
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
