package org.endlesssource.scrobbler.services.listenbrainz;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.api.Track;
import org.endlesssource.scrobbler.config.ListenBrainzConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One ListenBrainz account, on listenbrainz.org or a self-hosted instance.
 */
public final class ListenBrainzService implements BackendService {
    private static final Logger logger = LoggerFactory.getLogger(ListenBrainzService.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    static final String SUBMISSION_CLIENT = "now-scrobbler";

    private final String name;
    private final String token;
    private final String apiUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public ListenBrainzService(ListenBrainzConfig config, HttpClient httpClient) {
        Objects.requireNonNull(config, "config must not be null");
        this.name = config.name();
        this.token = config.token();
        this.apiUrl = stripTrailingSlash(config.apiUrl());
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public String id() {
        return "listenbrainz:" + name;
    }

    @Override
    public void updateNowPlaying(Track track) throws BackendException {
        submit("playing_now", track, null);
    }

    @Override
    public void submitListen(Track track, Instant listenedAt) throws BackendException {
        submit("single", track, Objects.requireNonNull(listenedAt, "listenedAt must not be null"));
    }

    /**
     * Check the token against the instance.
     * @return the user name the token belongs to, or empty when the instance reports it invalid
     */
    public Optional<String> validateToken() throws BackendException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/1/validate-token"))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Token " + token)
                .GET()
                .build();
        JsonNode body = readJson(send(request), "validate-token");
        if (!body.path("valid").asBoolean(false)) {
            return Optional.empty();
        }
        return Optional.of(body.path("user_name").asText(""));
    }

    ObjectNode payload(String listenType, Track track, Instant listenedAt) {
        ObjectNode root = mapper.createObjectNode();
        root.put("listen_type", listenType);
        ArrayNode listens = root.putArray("payload");
        ObjectNode listen = listens.addObject();
        if (listenedAt != null) {
            listen.put("listened_at", listenedAt.getEpochSecond());
        }
        ObjectNode metadata = listen.putObject("track_metadata");
        metadata.put("artist_name", track.getArtist());
        metadata.put("track_name", track.getTitle());
        track.getAlbum().ifPresent(album -> metadata.put("release_name", album));
        ObjectNode additional = metadata.putObject("additional_info");
        track.getDurationSeconds()
                .filter(seconds -> seconds > 0)
                .ifPresent(seconds -> additional.put("duration_ms", seconds * 1000));
        additional.put("submission_client", SUBMISSION_CLIENT);
        return root;
    }

    private void submit(String listenType, Track track, Instant listenedAt) throws BackendException {
        Objects.requireNonNull(track, "track must not be null");
        String body;
        try {
            body = mapper.writeValueAsString(payload(listenType, track, listenedAt));
        } catch (IOException e) {
            throw new BackendException("Failed to encode listen: " + e.getMessage(), false, e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/1/submit-listens"))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Token " + token)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response = send(request);
        checkStatus(response, "submit-listens");
        logger.debug("{} accepted {} listen for {}", id(), listenType, track.displayName());
    }

    private HttpResponse<String> send(HttpRequest request) throws BackendException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendException(id() + " request failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(id() + " request interrupted", false, e);
        }
    }

    private JsonNode readJson(HttpResponse<String> response, String endpoint) throws BackendException {
        checkStatus(response, endpoint);
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new BackendException(id() + " " + endpoint + " returned malformed JSON", true, e);
        }
    }

    private void checkStatus(HttpResponse<String> response, String endpoint) throws BackendException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        boolean retryable = status == 429 || status >= 500;
        throw new BackendException(id() + " " + endpoint + " returned HTTP " + status + errorDetail(response.body()),
                retryable);
    }

    private String errorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            String error = mapper.readTree(body).path("error").asText("");
            return error.isEmpty() ? "" : ": " + error;
        } catch (IOException e) {
            return "";
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
