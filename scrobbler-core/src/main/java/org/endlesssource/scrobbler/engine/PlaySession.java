package org.endlesssource.scrobbler.engine;

import org.endlesssource.scrobbler.api.Track;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One continuous playback of one track. Only the two flags change during its life; a track or
 * update-token change replaces the whole session.
 */
final class PlaySession {
    static final long MIN_TRACK_DURATION_SECONDS = 30;
    static final long MAX_SCROBBLE_DELAY_SECONDS = 240;

    private final Track track;
    private final String sourceAppId;
    private final String updateToken;
    private final Instant startedAt;
    private final long durationSeconds;
    private boolean scrobbled;
    private boolean nowPlayingSent;

    PlaySession(Track track, String sourceAppId, String updateToken, Instant startedAt) {
        this.track = track;
        this.sourceAppId = sourceAppId;
        this.updateToken = updateToken;
        this.startedAt = startedAt;
        this.durationSeconds = track.getDurationSeconds().orElse(0L);
    }

    Track track() {
        return track;
    }

    Optional<String> sourceAppId() {
        return Optional.ofNullable(sourceAppId);
    }

    Optional<String> updateToken() {
        return Optional.ofNullable(updateToken);
    }

    Instant startedAt() {
        return startedAt;
    }

    long durationSeconds() {
        return durationSeconds;
    }

    boolean isScrobbled() {
        return scrobbled;
    }

    void markScrobbled() {
        scrobbled = true;
    }

    boolean isNowPlayingSent() {
        return nowPlayingSent;
    }

    void markNowPlayingSent() {
        nowPlayingSent = true;
    }

    long elapsedSeconds(Instant now) {
        return Math.max(0L, Duration.between(startedAt, now).getSeconds());
    }

    /**
     * Seconds of playback after which this session counts as a listen.
     */
    long scrobbleAfterSeconds(int thresholdPercent) {
        long byPercent = durationSeconds * thresholdPercent / 100;
        return Math.min(byPercent, MAX_SCROBBLE_DELAY_SECONDS);
    }

    boolean shouldScrobble(Instant now, int thresholdPercent) {
        if (scrobbled || durationSeconds < MIN_TRACK_DURATION_SECONDS) {
            return false;
        }
        return elapsedSeconds(now) >= scrobbleAfterSeconds(thresholdPercent);
    }
}
