package org.endlesssource.scrobbler.services.lastfm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.endlesssource.scrobbler.api.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Signed form POSTs against the Audioscrobbler 2.0 endpoint, shared by scrobbling and authentication.
 */
final class LastFmApi {
    private static final Logger logger = LoggerFactory.getLogger(LastFmApi.class);

    static final URI DEFAULT_API_URL = URI.create("https://ws.audioscrobbler.com/2.0/");
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    // Service offline, temporarily unavailable, operation failed, rate limit exceeded
    private static final Set<Integer> RETRYABLE_ERRORS = Set.of(8, 11, 16, 29);

    private final HttpClient httpClient;
    private final URI apiUrl;
    private final String apiKey;
    private final String apiSecret;
    private final ObjectMapper mapper = new ObjectMapper();

    LastFmApi(HttpClient httpClient, URI apiUrl, String apiKey, String apiSecret) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.apiSecret = Objects.requireNonNull(apiSecret, "apiSecret must not be null");
    }

    String apiKey() {
        return apiKey;
    }

    /**
     * Call a method. {@code api_key}, {@code api_sig} and {@code format=json} are added here.
     * @return the parsed JSON response
     * @throws BackendException when the request fails or Last.fm answers with an error
     */
    JsonNode call(String method, Map<String, String> methodParams) throws BackendException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("method", method);
        params.put("api_key", apiKey);
        params.putAll(methodParams);
        params.put("api_sig", LastFmSigner.sign(params, apiSecret));
        params.put("format", "json");

        HttpRequest request = HttpRequest.newBuilder(apiUrl)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(LastFmSigner.formEncode(params)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendException("Last.fm request " + method + " failed: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Last.fm request " + method + " interrupted", false, e);
        }

        JsonNode body = parse(response.body());
        if (body != null && body.has("error")) {
            int code = body.path("error").asInt();
            String message = body.path("message").asText("");
            logger.debug("Last.fm {} returned error {}: {}", method, code, message);
            throw new BackendException("Last.fm error " + code + ": " + message, RETRYABLE_ERRORS.contains(code));
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new BackendException("Last.fm " + method + " returned HTTP " + status, retryable);
        }
        if (body == null) {
            throw new BackendException("Last.fm " + method + " returned a malformed response", true);
        }
        return body;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            logger.debug("Unparseable Last.fm response: {}", e.getMessage());
            return null;
        }
    }
}
