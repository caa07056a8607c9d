package org.endlesssource.scrobbler.engine;

import org.endlesssource.scrobbler.api.AskUserEvent;
import org.endlesssource.scrobbler.api.NowPlayingEvent;
import org.endlesssource.scrobbler.api.ScrobbleEvent;

import java.util.Optional;

/**
 * Events emitted by one poll; at most one of each kind.
 */
public record PollResult(Optional<NowPlayingEvent> nowPlaying,
                         Optional<ScrobbleEvent> scrobble,
                         Optional<AskUserEvent> askUser) {

    private static final PollResult EMPTY = new PollResult(Optional.empty(), Optional.empty(), Optional.empty());

    public static PollResult empty() {
        return EMPTY;
    }

    public static PollResult nowPlaying(NowPlayingEvent event) {
        return new PollResult(Optional.of(event), Optional.empty(), Optional.empty());
    }

    public static PollResult scrobble(ScrobbleEvent event) {
        return new PollResult(Optional.empty(), Optional.of(event), Optional.empty());
    }

    public static PollResult askUser(AskUserEvent event) {
        return new PollResult(Optional.empty(), Optional.empty(), Optional.of(event));
    }

    public boolean isEmpty() {
        return nowPlaying.isEmpty() && scrobble.isEmpty() && askUser.isEmpty();
    }
}
