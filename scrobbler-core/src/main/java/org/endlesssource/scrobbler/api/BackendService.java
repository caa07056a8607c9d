package org.endlesssource.scrobbler.api;

import java.time.Instant;

/**
 * A listen-tracking account (Last.fm, ListenBrainz, ...) that receives now-playing updates and scrobbles.
 */
public interface BackendService {

    /**
     * Stable identifier used in logs and dispatch results, e.g. {@code lastfm} or {@code listenbrainz:Primary}.
     * @return service id
     */
    String id();

    /**
     * Tell the service what is playing right now.
     * @param track the current track
     * @throws BackendException if the service rejected or could not be reached
     */
    void updateNowPlaying(Track track) throws BackendException;

    /**
     * Submit a confirmed listen.
     * @param track the listened track
     * @param listenedAt when the listen started
     * @throws BackendException if the service rejected or could not be reached
     */
    void submitListen(Track track, Instant listenedAt) throws BackendException;
}
