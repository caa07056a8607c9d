package org.endlesssource.scrobbler.api;

import java.util.Optional;

/**
 * Raw now-playing information captured from a media source once per poll.
 * Every field may be missing; a snapshot without title or artist cannot become a {@link Track}.
 */
public record Snapshot(String title,
                       String artist,
                       String album,
                       Long durationSeconds,
                       Boolean playing,
                       String sourceAppId,
                       String updateToken) {

    public Optional<String> getTitle() {
        return nonBlank(title);
    }

    public Optional<String> getArtist() {
        return nonBlank(artist);
    }

    public Optional<String> getAlbum() {
        return nonBlank(album);
    }

    public Optional<Long> getDurationSeconds() {
        return Optional.ofNullable(durationSeconds).filter(seconds -> seconds >= 0);
    }

    /**
     * Missing playing state counts as not playing.
     */
    public boolean isPlaying() {
        return Boolean.TRUE.equals(playing);
    }

    public Optional<String> getSourceAppId() {
        return Optional.ofNullable(sourceAppId);
    }

    public Optional<String> getUpdateToken() {
        return Optional.ofNullable(updateToken);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public static final class Builder {
        private String title;
        private String artist;
        private String album;
        private Long durationSeconds;
        private Boolean playing;
        private String sourceAppId;
        private String updateToken;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder artist(String artist) {
            this.artist = artist;
            return this;
        }

        public Builder album(String album) {
            this.album = album;
            return this;
        }

        public Builder durationSeconds(Long durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder playing(Boolean playing) {
            this.playing = playing;
            return this;
        }

        public Builder sourceAppId(String sourceAppId) {
            this.sourceAppId = sourceAppId;
            return this;
        }

        public Builder updateToken(String updateToken) {
            this.updateToken = updateToken;
            return this;
        }

        public Snapshot build() {
            return new Snapshot(title, artist, album, durationSeconds, playing, sourceAppId, updateToken);
        }
    }
}
