package org.endlesssource.scrobbler.api;

import org.endlesssource.scrobbler.dispatch.DispatchOutcome;

import java.util.List;

/**
 * Listener for scrobbler status changes
 */
public interface StatusListener {

    /**
     * Called when a now-playing update was emitted
     * @param event The emitted event
     */
    default void onNowPlaying(NowPlayingEvent event) {}

    /**
     * Called when a scrobble was emitted
     * @param event The emitted event
     */
    default void onScrobble(ScrobbleEvent event) {}

    /**
     * Called when the media source reported nothing and the play session was dropped
     */
    default void onSessionCleared() {}

    /**
     * Called when delivery of a notification finished at every service
     * @param notification The delivered notification
     * @param outcomes One outcome per service
     */
    default void onDelivered(ScrobbleNotification notification, List<DispatchOutcome> outcomes) {}
}
