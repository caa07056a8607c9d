package org.endlesssource.scrobbler.api;

import java.util.Objects;
import java.util.Optional;

/**
 * A normalized track. Identity is title, artist and album; the duration is carried along
 * but does not take part in equality.
 */
public final class Track {
    private final String title;
    private final String artist;
    private final String album;
    private final Long durationSeconds;

    public Track(String title, String artist, String album, Long durationSeconds) {
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.artist = Objects.requireNonNull(artist, "artist must not be null");
        this.album = album;
        this.durationSeconds = durationSeconds;
    }

    public String getTitle() {
        return title;
    }

    public String getArtist() {
        return artist;
    }

    public Optional<String> getAlbum() {
        return Optional.ofNullable(album);
    }

    public Optional<Long> getDurationSeconds() {
        return Optional.ofNullable(durationSeconds);
    }

    /**
     * "Artist - Title", used by status displays and log lines.
     */
    public String displayName() {
        return artist + " - " + title;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Track other)) return false;
        return title.equals(other.title)
                && artist.equals(other.artist)
                && Objects.equals(album, other.album);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, artist, album);
    }

    @Override
    public String toString() {
        return "Track[title=" + title + ", artist=" + artist + ", album=" + album
                + ", durationSeconds=" + durationSeconds + "]";
    }
}
