package org.endlesssource.scrobbler.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff bounded by a total time budget.
 *
 * @param maxElapsed total time after which no further attempt is started
 * @param initialDelay delay before the second attempt
 * @param multiplier growth factor applied to each following delay
 * @param maxDelay upper bound for a single delay
 */
public record RetryPolicy(Duration maxElapsed, Duration initialDelay, double multiplier, Duration maxDelay) {
    public static final RetryPolicy NOW_PLAYING =
            new RetryPolicy(Duration.ofSeconds(10), Duration.ofMillis(500), 2.0d, Duration.ofSeconds(4));
    public static final RetryPolicy SCROBBLE =
            new RetryPolicy(Duration.ofSeconds(30), Duration.ofSeconds(1), 2.0d, Duration.ofSeconds(10));

    public RetryPolicy {
        Objects.requireNonNull(maxElapsed, "maxElapsed must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxElapsed.isNegative() || initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
    }

    /**
     * A policy that makes exactly one attempt.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(Duration.ZERO, Duration.ZERO, 1.0d, Duration.ZERO);
    }

    /**
     * Delay before attempt {@code attempt + 1}, where {@code attempt} counts from 1.
     */
    public Duration delayAfter(int attempt) {
        double raw = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
        return Duration.ofMillis(Math.max(0L, capped));
    }
}
