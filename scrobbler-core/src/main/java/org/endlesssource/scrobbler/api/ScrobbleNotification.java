package org.endlesssource.scrobbler.api;

/**
 * Events that are delivered to backend services.
 */
public interface ScrobbleNotification {

    Track track();

    /**
     * @return {@code true} for a counted listen, {@code false} for a now-playing update
     */
    boolean isAuthoritative();

    /**
     * Deliver this notification to one service.
     */
    void deliverTo(BackendService service) throws BackendException;
}
