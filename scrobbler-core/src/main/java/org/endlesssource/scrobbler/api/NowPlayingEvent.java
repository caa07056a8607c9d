package org.endlesssource.scrobbler.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Non-authoritative "currently listening to" notification.
 */
public record NowPlayingEvent(Track track, String sourceAppId) implements ScrobbleNotification {
    public NowPlayingEvent {
        Objects.requireNonNull(track, "track must not be null");
    }

    @Override
    public boolean isAuthoritative() {
        return false;
    }

    @Override
    public void deliverTo(BackendService service) throws BackendException {
        service.updateNowPlaying(track);
    }

    public Optional<String> getSourceAppId() {
        return Optional.ofNullable(sourceAppId);
    }
}
