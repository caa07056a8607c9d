package org.endlesssource.scrobbler.linux;

import org.endlesssource.scrobbler.api.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps one MPRIS player's metadata and playback status to a {@link Snapshot}.
 */
final class MprisSnapshots {
    static final String BUS_NAME_PREFIX = "org.mpris.MediaPlayer2.";
    private static final long MICROS_PER_SECOND = 1_000_000L;

    private MprisSnapshots() {
    }

    /**
     * {@code org.mpris.MediaPlayer2.spotify} becomes {@code spotify}; instance suffixes such as
     * {@code .instance1234} are dropped.
     */
    static String appIdFor(String busName) {
        String id = busName.startsWith(BUS_NAME_PREFIX) ? busName.substring(BUS_NAME_PREFIX.length()) : busName;
        int instance = id.indexOf(".instance");
        return instance > 0 ? id.substring(0, instance) : id;
    }

    /**
     * @param playbackStatus {@code Playing}, {@code Paused}, {@code Stopped}, or null when the player does not say
     */
    static Snapshot toSnapshot(String busName, Map<String, Object> metadata, String playbackStatus) {
        return Snapshot.builder()
                .title(MprisMetadataUtils.asString(metadata.get("xesam:title")).orElse(null))
                .artist(artist(metadata).orElse(null))
                .album(MprisMetadataUtils.asString(metadata.get("xesam:album")).orElse(null))
                .durationSeconds(durationSeconds(metadata).orElse(null))
                .playing(playbackStatus == null ? null : "Playing".equals(playbackStatus))
                .sourceAppId(appIdFor(busName))
                .updateToken(MprisMetadataUtils.asString(metadata.get("mpris:trackid")).orElse(null))
                .build();
    }

    private static Optional<String> artist(Map<String, Object> metadata) {
        List<String> artists = MprisMetadataUtils.asStringList(metadata.get("xesam:artist"));
        if (!artists.isEmpty()) {
            return Optional.of(String.join(", ", artists));
        }
        List<String> albumArtists = MprisMetadataUtils.asStringList(metadata.get("xesam:albumArtist"));
        return albumArtists.isEmpty() ? Optional.empty() : Optional.of(String.join(", ", albumArtists));
    }

    private static Optional<Long> durationSeconds(Map<String, Object> metadata) {
        return MprisMetadataUtils.asLong(metadata.get("mpris:length"))
                .or(() -> MprisMetadataUtils.asLong(metadata.get("xesam:length")))
                .filter(micros -> micros > 0)
                .map(micros -> micros / MICROS_PER_SECOND);
    }
}
