package org.endlesssource.scrobbler.engine;

import org.endlesssource.scrobbler.ScrobblerOptions;
import org.endlesssource.scrobbler.api.AskUserEvent;
import org.endlesssource.scrobbler.api.NowPlayingEvent;
import org.endlesssource.scrobbler.api.ScrobbleEvent;
import org.endlesssource.scrobbler.api.Snapshot;
import org.endlesssource.scrobbler.api.Track;
import org.endlesssource.scrobbler.filter.AppFilterAction;
import org.endlesssource.scrobbler.filter.AppFilterStore;
import org.endlesssource.scrobbler.normalize.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides from successive now-playing snapshots when a track started, when it has played long enough
 * to be scrobbled, and when a new application needs the user's decision.
 * <p>
 * The engine owns the single play session. {@link #poll(Optional, Instant)} is the only mutator and is
 * synchronized, so callers on different threads never observe a half-updated session.
 */
public final class PlaySessionEngine {
    private static final Logger logger = LoggerFactory.getLogger(PlaySessionEngine.class);

    private final TextNormalizer normalizer;
    private final AppFilterStore appFilter;
    private final int thresholdPercent;

    private PlaySession session;

    public PlaySessionEngine(ScrobblerOptions options, TextNormalizer normalizer, AppFilterStore appFilter) {
        Objects.requireNonNull(options, "options must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.appFilter = Objects.requireNonNull(appFilter, "appFilter must not be null");
        this.thresholdPercent = options.getThresholdPercent();
    }

    /**
     * Evaluate one captured snapshot.
     * @param snapshot the snapshot, or empty when no media source is reachable
     * @param now poll time
     * @return the events to deliver
     */
    public synchronized PollResult poll(Optional<Snapshot> snapshot, Instant now) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (snapshot.isEmpty()) {
            if (session != null) {
                logger.info("Media stopped, clearing session for {}", session.track().displayName());
                session = null;
            }
            return PollResult.empty();
        }

        Snapshot current = snapshot.get();
        if (!current.isPlaying()) {
            // Paused: keep the session so resuming does not restart the scrobble clock.
            return PollResult.empty();
        }

        Optional<Track> maybeTrack = toTrack(current);
        if (maybeTrack.isEmpty()) {
            logger.debug("Snapshot without title or artist: {}", current);
            return PollResult.empty();
        }
        Track track = maybeTrack.get();
        String appId = current.sourceAppId();

        AppFilterAction action = appFilter.classify(appId);
        if (action == AppFilterAction.IGNORE) {
            logger.debug("Ignoring playback from {}", appId);
            return PollResult.empty();
        }
        if (action == AppFilterAction.ASK_USER) {
            return PollResult.askUser(new AskUserEvent(appId));
        }

        if (isNewSession(track, current)) {
            PlaySession created = new PlaySession(track, appId, current.updateToken(), now);
            created.markNowPlayingSent();
            session = created;
            logger.info("New track: {} ({}s) from {}", track.displayName(), created.durationSeconds(), appId);
            return PollResult.nowPlaying(new NowPlayingEvent(track, appId));
        }

        if (session.shouldScrobble(now, thresholdPercent)) {
            session.markScrobbled();
            logger.info("Scrobbling: {} (played {}s / {}s)", session.track().displayName(),
                    session.elapsedSeconds(now), session.durationSeconds());
            return PollResult.scrobble(new ScrobbleEvent(session.track(), session.startedAt(),
                    session.sourceAppId().orElse(null)));
        }

        if (!session.isNowPlayingSent()) {
            session.markNowPlayingSent();
            return PollResult.nowPlaying(new NowPlayingEvent(session.track(), session.sourceAppId().orElse(null)));
        }

        return PollResult.empty();
    }

    public synchronized SessionState state() {
        if (session == null) {
            return SessionState.EMPTY;
        }
        return session.isScrobbled() ? SessionState.ACTIVE_SCROBBLED : SessionState.ACTIVE_UNSCROBBLED;
    }

    public synchronized Optional<Track> currentTrack() {
        return session == null ? Optional.empty() : Optional.of(session.track());
    }

    public synchronized Optional<Instant> sessionStartedAt() {
        return session == null ? Optional.empty() : Optional.of(session.startedAt());
    }

    public int getThresholdPercent() {
        return thresholdPercent;
    }

    private boolean isNewSession(Track track, Snapshot snapshot) {
        if (session == null) {
            return true;
        }
        if (!session.track().equals(track)) {
            return true;
        }
        return !Objects.equals(session.updateToken().orElse(null), snapshot.updateToken());
    }

    private Optional<Track> toTrack(Snapshot snapshot) {
        Optional<String> title = snapshot.getTitle().map(normalizer::normalize).filter(s -> !s.isEmpty());
        Optional<String> artist = snapshot.getArtist().map(normalizer::normalize).filter(s -> !s.isEmpty());
        if (title.isEmpty() || artist.isEmpty()) {
            return Optional.empty();
        }
        String album = snapshot.getAlbum().map(normalizer::normalize).filter(s -> !s.isEmpty()).orElse(null);
        return Optional.of(new Track(title.get(), artist.get(), album, snapshot.getDurationSeconds().orElse(null)));
    }
}
