package org.endlesssource.scrobbler.api;

import org.endlesssource.scrobbler.test.RecordingBackendService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScrobbleNotificationTest {
    private static final Track TRACK = new Track("Song", "Artist", "Album", 200L);
    private static final Instant LISTENED_AT = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void scrobbleEvent_deliverTo_submitsListenWithStartTime() throws Exception {
        RecordingBackendService service = new RecordingBackendService("lastfm");
        ScrobbleNotification event = new ScrobbleEvent(TRACK, LISTENED_AT, "spotify");

        event.deliverTo(service);

        assertTrue(event.isAuthoritative());
        assertEquals(List.of(TRACK), service.listenedTracks());
        assertEquals(List.of(LISTENED_AT), service.listenTimes());
        assertTrue(service.nowPlaying().isEmpty());
    }

    @Test
    void nowPlayingEvent_deliverTo_updatesNowPlaying() throws Exception {
        RecordingBackendService service = new RecordingBackendService("lastfm");
        ScrobbleNotification event = new NowPlayingEvent(TRACK, null);

        event.deliverTo(service);

        assertFalse(event.isAuthoritative());
        assertEquals(List.of(TRACK), service.nowPlaying());
        assertTrue(service.listenedTracks().isEmpty());
    }

    @Test
    void deliverTo_serviceFailure_propagates() {
        RecordingBackendService service = RecordingBackendService.alwaysFailing("listenbrainz:Primary");

        BackendException thrown = assertThrows(BackendException.class,
                () -> new NowPlayingEvent(TRACK, "app").deliverTo(service));
        assertEquals("listenbrainz:Primary unavailable", thrown.getMessage());
    }
}
