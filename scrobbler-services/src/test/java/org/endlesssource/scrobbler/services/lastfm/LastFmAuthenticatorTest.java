package org.endlesssource.scrobbler.services.lastfm;

import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.services.test.RecordingHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;

import static org.junit.jupiter.api.Assertions.*;

class LastFmAuthenticatorTest {
    private RecordingHttpServer server;
    private LastFmAuthenticator authenticator;

    @BeforeEach
    void setUp() throws Exception {
        server = new RecordingHttpServer();
        authenticator = new LastFmAuthenticator("key", "secret", HttpClient.newHttpClient(), server.uri("/2.0/"));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void fullFlow_returnsSessionKey() throws Exception {
        server.respond(200, "{\"token\":\"tok123\"}")
                .respond(200, "{\"session\":{\"name\":\"user\",\"key\":\"sk-456\",\"subscriber\":0}}");

        String token = authenticator.requestToken();
        assertEquals("tok123", token);
        assertEquals("https://www.last.fm/api/auth/?api_key=key&token=tok123", authenticator.authorizationUrl(token));
        assertEquals("sk-456", authenticator.fetchSessionKey(token));

        assertTrue(server.requests().get(0).body().contains("method=auth.getToken"));
        assertTrue(server.requests().get(1).body().contains("token=tok123"));
    }

    @Test
    void fetchSessionKey_unauthorizedToken_throws() {
        server.respond(200, "{\"error\":14,\"message\":\"This token has not been authorized\"}");
        BackendException e = assertThrows(BackendException.class, () -> authenticator.fetchSessionKey("tok"));
        assertTrue(e.getMessage().contains("not been authorized"));
    }

    @Test
    void requestToken_missingToken_throws() {
        server.respond(200, "{}");
        assertThrows(BackendException.class, () -> authenticator.requestToken());
    }
}
