package org.endlesssource.scrobbler;

import java.util.Optional;

/**
 * What a status display shows: the current track and the last scrobbled one, as "Artist - Title".
 */
public record ScrobbleStatus(String nowPlaying, String lastScrobbled) {
    public static final ScrobbleStatus EMPTY = new ScrobbleStatus(null, null);

    public Optional<String> getNowPlaying() {
        return Optional.ofNullable(nowPlaying);
    }

    public Optional<String> getLastScrobbled() {
        return Optional.ofNullable(lastScrobbled);
    }

    public ScrobbleStatus withNowPlaying(String text) {
        return new ScrobbleStatus(text, lastScrobbled);
    }

    public ScrobbleStatus withLastScrobbled(String text) {
        return new ScrobbleStatus(nowPlaying, text);
    }

    public String nowPlayingLine() {
        return "Now Playing: " + getNowPlaying().orElse("None");
    }

    public String lastScrobbledLine() {
        return "Last Scrobbled: " + getLastScrobbled().orElse("None");
    }
}
