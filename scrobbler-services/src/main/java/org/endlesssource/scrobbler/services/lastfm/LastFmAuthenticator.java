package org.endlesssource.scrobbler.services.lastfm;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.scrobbler.api.BackendException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Desktop authorization flow: request a token, let the user approve it in the browser, then exchange it
 * for a session key that never expires.
 */
public final class LastFmAuthenticator {
    public static final String AUTH_URL = "https://www.last.fm/api/auth/";

    private final LastFmApi api;

    public LastFmAuthenticator(String apiKey, String apiSecret, HttpClient httpClient) {
        this(apiKey, apiSecret, httpClient, LastFmApi.DEFAULT_API_URL);
    }

    public LastFmAuthenticator(String apiKey, String apiSecret, HttpClient httpClient, URI apiUrl) {
        this.api = new LastFmApi(httpClient, apiUrl, apiKey, apiSecret);
    }

    public String requestToken() throws BackendException {
        JsonNode response = api.call("auth.getToken", Map.of());
        String token = response.path("token").asText("");
        if (token.isEmpty()) {
            throw new BackendException("No token in Last.fm response", false);
        }
        return token;
    }

    /**
     * URL the user opens to grant access for {@code token}.
     */
    public String authorizationUrl(String token) {
        return AUTH_URL + "?api_key=" + URLEncoder.encode(api.apiKey(), StandardCharsets.UTF_8)
                + "&token=" + URLEncoder.encode(token, StandardCharsets.UTF_8);
    }

    /**
     * @throws BackendException with Last.fm error 14 while the user has not authorized the token yet
     */
    public String fetchSessionKey(String token) throws BackendException {
        JsonNode response = api.call("auth.getSession", Map.of("token", token));
        String key = response.path("session").path("key").asText("");
        if (key.isEmpty()) {
            throw new BackendException("No session key in Last.fm response", false);
        }
        return key;
    }
}
