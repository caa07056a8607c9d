package org.endlesssource.scrobbler.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Authoritative "this listen counted" record. {@code listenedAt} is the time the play session started.
 */
public record ScrobbleEvent(Track track, Instant listenedAt, String sourceAppId) implements ScrobbleNotification {
    public ScrobbleEvent {
        Objects.requireNonNull(track, "track must not be null");
        Objects.requireNonNull(listenedAt, "listenedAt must not be null");
    }

    @Override
    public boolean isAuthoritative() {
        return true;
    }

    @Override
    public void deliverTo(BackendService service) throws BackendException {
        service.submitListen(track, listenedAt);
    }

    public Optional<String> getSourceAppId() {
        return Optional.ofNullable(sourceAppId);
    }
}
