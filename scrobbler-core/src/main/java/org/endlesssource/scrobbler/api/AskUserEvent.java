package org.endlesssource.scrobbler.api;

import java.util.Objects;

/**
 * Raised when media from an application nobody has decided about yet is playing.
 */
public record AskUserEvent(String sourceAppId) {
    public AskUserEvent {
        Objects.requireNonNull(sourceAppId, "sourceAppId must not be null");
    }
}
