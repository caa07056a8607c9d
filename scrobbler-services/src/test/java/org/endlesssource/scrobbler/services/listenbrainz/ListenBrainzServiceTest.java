package org.endlesssource.scrobbler.services.listenbrainz;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.api.Track;
import org.endlesssource.scrobbler.config.ListenBrainzConfig;
import org.endlesssource.scrobbler.services.test.RecordingHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ListenBrainzServiceTest {
    private static final Track TRACK = new Track("Teardrop", "Massive Attack", "Mezzanine", 330L);
    private final ObjectMapper mapper = new ObjectMapper();

    private RecordingHttpServer server;
    private ListenBrainzService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new RecordingHttpServer();
        service = new ListenBrainzService(
                new ListenBrainzConfig(true, "Home", "secret-token", server.uri("/").toString()),
                HttpClient.newHttpClient());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void submitListen_postsSingleListen() throws Exception {
        server.respond(200, "{\"status\":\"ok\"}");

        service.submitListen(TRACK, Instant.ofEpochSecond(1_700_000_000L));

        RecordingHttpServer.Request request = server.lastRequest();
        assertEquals("POST", request.method());
        assertEquals("/1/submit-listens", request.path());
        assertEquals("Token secret-token", request.authorization());

        JsonNode body = mapper.readTree(request.body());
        assertEquals("single", body.path("listen_type").asText());
        JsonNode listen = body.path("payload").get(0);
        assertEquals(1_700_000_000L, listen.path("listened_at").asLong());
        JsonNode metadata = listen.path("track_metadata");
        assertEquals("Massive Attack", metadata.path("artist_name").asText());
        assertEquals("Teardrop", metadata.path("track_name").asText());
        assertEquals("Mezzanine", metadata.path("release_name").asText());
        assertEquals(330_000L, metadata.path("additional_info").path("duration_ms").asLong());
        assertEquals("now-scrobbler", metadata.path("additional_info").path("submission_client").asText());
    }

    @Test
    void updateNowPlaying_hasNoTimestamp() throws Exception {
        service.updateNowPlaying(new Track("Teardrop", "Massive Attack", null, null));

        JsonNode body = mapper.readTree(server.lastRequest().body());
        assertEquals("playing_now", body.path("listen_type").asText());
        JsonNode listen = body.path("payload").get(0);
        assertFalse(listen.has("listened_at"));
        assertFalse(listen.path("track_metadata").has("release_name"));
        assertFalse(listen.path("track_metadata").path("additional_info").has("duration_ms"));
    }

    @Test
    void unauthorized_isTerminal() {
        server.respond(401, "{\"code\":401,\"error\":\"Invalid authorization token.\"}");

        BackendException e = assertThrows(BackendException.class, () -> service.updateNowPlaying(TRACK));
        assertFalse(e.isRetryable());
        assertTrue(e.getMessage().contains("Invalid authorization token."));
    }

    @Test
    void rateLimitedAndServerErrors_areRetryable() {
        server.respond(429, "").respond(502, "");
        assertTrue(assertThrows(BackendException.class, () -> service.updateNowPlaying(TRACK)).isRetryable());
        assertTrue(assertThrows(BackendException.class, () -> service.updateNowPlaying(TRACK)).isRetryable());
    }

    @Test
    void validateToken_returnsUserName() throws Exception {
        server.respond(200, "{\"code\":200,\"message\":\"Token valid.\",\"valid\":true,\"user_name\":\"alice\"}");
        assertEquals(Optional.of("alice"), service.validateToken());
        assertEquals("GET", server.lastRequest().method());
        assertEquals("/1/validate-token", server.lastRequest().path());
    }

    @Test
    void validateToken_invalid_isEmpty() throws Exception {
        server.respond(200, "{\"code\":200,\"message\":\"Token invalid.\",\"valid\":false}");
        assertTrue(service.validateToken().isEmpty());
    }

    @Test
    void id_includesInstanceName() {
        assertEquals("listenbrainz:Home", service.id());
    }
}
