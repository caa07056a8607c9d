package org.endlesssource.scrobbler;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime options for the play-session engine and its polling driver.
 */
public final class ScrobblerOptions {
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_THRESHOLD_PERCENT = 50;

    private final Duration refreshInterval;
    private final int thresholdPercent;

    private ScrobblerOptions(Duration refreshInterval, int thresholdPercent) {
        this.refreshInterval = requirePositive("refreshInterval", refreshInterval);
        this.thresholdPercent = requirePercent(thresholdPercent);
    }

    public static ScrobblerOptions defaults() {
        return new ScrobblerOptions(DEFAULT_REFRESH_INTERVAL, DEFAULT_THRESHOLD_PERCENT);
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public int getThresholdPercent() {
        return thresholdPercent;
    }

    public ScrobblerOptions withRefreshInterval(Duration interval) {
        return new ScrobblerOptions(interval, thresholdPercent);
    }

    public ScrobblerOptions withThresholdPercent(int percent) {
        return new ScrobblerOptions(refreshInterval, percent);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static int requirePercent(int percent) {
        if (percent < 1 || percent > 100) {
            throw new IllegalArgumentException("thresholdPercent must be between 1 and 100");
        }
        return percent;
    }
}
