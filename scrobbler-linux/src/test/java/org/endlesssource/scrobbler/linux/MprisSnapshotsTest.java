package org.endlesssource.scrobbler.linux;

import org.endlesssource.scrobbler.api.Snapshot;
import org.freedesktop.dbus.ObjectPath;
import org.freedesktop.dbus.types.Variant;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MprisSnapshotsTest {

    private static Map<String, Object> metadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("xesam:title", "Paranoid Android");
        metadata.put("xesam:artist", List.of("Radiohead"));
        metadata.put("xesam:album", "OK Computer");
        metadata.put("mpris:length", 387_000_000L);
        metadata.put("mpris:trackid", new ObjectPath("", "/org/mpris/MediaPlayer2/Track/42"));
        return metadata;
    }

    @Test
    void toSnapshot_mapsMetadata() {
        Snapshot snapshot = MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.spotify", metadata(), "Playing");

        assertEquals(Optional.of("Paranoid Android"), snapshot.getTitle());
        assertEquals(Optional.of("Radiohead"), snapshot.getArtist());
        assertEquals(Optional.of("OK Computer"), snapshot.getAlbum());
        assertEquals(Optional.of(387L), snapshot.getDurationSeconds());
        assertTrue(snapshot.isPlaying());
        assertEquals(Optional.of("spotify"), snapshot.getSourceAppId());
        assertEquals(Optional.of("/org/mpris/MediaPlayer2/Track/42"), snapshot.getUpdateToken());
    }

    @Test
    void toSnapshot_pausedAndUnknownStatus() {
        assertFalse(MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.vlc", metadata(), "Paused").isPlaying());
        Snapshot unknown = MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.vlc", metadata(), null);
        assertFalse(unknown.isPlaying());
        assertNull(unknown.playing());
    }

    @Test
    void toSnapshot_multipleArtistsJoined() {
        Map<String, Object> metadata = metadata();
        metadata.put("xesam:artist", List.of("Daft Punk", "Pharrell Williams"));
        Snapshot snapshot = MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.spotify", metadata, "Playing");
        assertEquals(Optional.of("Daft Punk, Pharrell Williams"), snapshot.getArtist());
    }

    @Test
    void toSnapshot_albumArtistFallback() {
        Map<String, Object> metadata = metadata();
        metadata.remove("xesam:artist");
        metadata.put("xesam:albumArtist", List.of("Various Artists"));
        Snapshot snapshot = MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.spotify", metadata, "Playing");
        assertEquals(Optional.of("Various Artists"), snapshot.getArtist());
    }

    @Test
    void toSnapshot_missingOrZeroLength_hasNoDuration() {
        Map<String, Object> metadata = metadata();
        metadata.put("mpris:length", 0L);
        assertTrue(MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.x", metadata, "Playing")
                .getDurationSeconds().isEmpty());
        metadata.remove("mpris:length");
        assertTrue(MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.x", metadata, "Playing")
                .getDurationSeconds().isEmpty());
    }

    @Test
    void toSnapshot_byteArrayTitle_decoded() {
        Map<String, Object> metadata = metadata();
        metadata.put("xesam:title", "Café".getBytes(StandardCharsets.UTF_8));
        assertEquals(Optional.of("Café"),
                MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.x", metadata, "Playing").getTitle());
    }

    @Test
    void appIdFor_stripsPrefixAndInstance() {
        assertEquals("spotify", MprisSnapshots.appIdFor("org.mpris.MediaPlayer2.spotify"));
        assertEquals("firefox", MprisSnapshots.appIdFor("org.mpris.MediaPlayer2.firefox.instance_1_42"));
        assertEquals("chromium", MprisSnapshots.appIdFor("org.mpris.MediaPlayer2.chromium.instance1234"));
        assertEquals("custom", MprisSnapshots.appIdFor("custom"));
    }

    @Test
    void toMetadataMap_unwrapsVariants() {
        Map<String, Variant<?>> raw = new HashMap<>();
        raw.put("xesam:title", new Variant<>("Song"));
        raw.put("mpris:length", new Variant<>(180_000_000L));

        Map<String, Object> unwrapped = MprisMetadataUtils.toMetadataMap(raw).orElseThrow();

        assertEquals("Song", unwrapped.get("xesam:title"));
        assertEquals(180_000_000L, unwrapped.get("mpris:length"));
    }

    @Test
    void toSnapshot_variantTrackIdObjectPath_becomesUpdateToken() {
        Map<String, Variant<?>> raw = new HashMap<>();
        raw.put("xesam:title", new Variant<>("Paranoid Android"));
        raw.put("xesam:artist", new Variant<>(new String[] {"Radiohead"}));
        raw.put("mpris:length", new Variant<>(387_000_000L));
        raw.put("mpris:trackid", new Variant<>(new ObjectPath("", "/org/mpris/MediaPlayer2/Track/42")));

        Map<String, Object> metadata = MprisMetadataUtils.toMetadataMap(raw).orElseThrow();
        Snapshot snapshot = MprisSnapshots.toSnapshot("org.mpris.MediaPlayer2.spotify", metadata, "Playing");

        assertEquals(Optional.of("/org/mpris/MediaPlayer2/Track/42"), snapshot.getUpdateToken());
        assertEquals(Optional.of("Radiohead"), snapshot.getArtist());
    }

    @Test
    void asString_objectPath_returnsPath() {
        assertEquals(Optional.of("/org/mpris/MediaPlayer2/TrackList/NoTrack"),
                MprisMetadataUtils.asString(new ObjectPath("", "/org/mpris/MediaPlayer2/TrackList/NoTrack")));
    }

    @Test
    void toMetadataMap_emptyOrUnexpected_isEmpty() {
        assertTrue(MprisMetadataUtils.toMetadataMap(null).isEmpty());
        assertTrue(MprisMetadataUtils.toMetadataMap(Map.of()).isEmpty());
        assertTrue(MprisMetadataUtils.toMetadataMap("not a map").isEmpty());
    }

    @Test
    void asLong_coercesStringsAndLists() {
        assertEquals(Optional.of(5L), MprisMetadataUtils.asLong("5"));
        assertEquals(Optional.of(7L), MprisMetadataUtils.asLong(List.of("x", 7)));
        assertTrue(MprisMetadataUtils.asLong("abc").isEmpty());
    }
}
