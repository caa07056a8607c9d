package org.endlesssource.scrobbler.services.lastfm;

import com.fasterxml.jackson.databind.JsonNode;
import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.api.Track;
import org.endlesssource.scrobbler.config.LastFmConfig;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Last.fm scrobbling through {@code track.updateNowPlaying} and {@code track.scrobble}.
 */
public final class LastFmService implements BackendService {
    public static final String ID = "lastfm";

    private final LastFmApi api;
    private final String sessionKey;

    public LastFmService(LastFmConfig config, HttpClient httpClient) {
        this(config, httpClient, LastFmApi.DEFAULT_API_URL);
    }

    public LastFmService(LastFmConfig config, HttpClient httpClient, URI apiUrl) {
        Objects.requireNonNull(config, "config must not be null");
        this.api = new LastFmApi(httpClient, apiUrl, config.apiKey(), config.apiSecret());
        this.sessionKey = config.sessionKey();
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void updateNowPlaying(Track track) throws BackendException {
        api.call("track.updateNowPlaying", trackParams(track));
    }

    @Override
    public void submitListen(Track track, Instant listenedAt) throws BackendException {
        Objects.requireNonNull(listenedAt, "listenedAt must not be null");
        Map<String, String> params = trackParams(track);
        params.put("timestamp", Long.toString(listenedAt.getEpochSecond()));
        JsonNode response = api.call("track.scrobble", params);

        JsonNode attributes = response.path("scrobbles").path("@attr");
        if (attributes.path("ignored").asInt(0) > 0) {
            JsonNode ignored = response.path("scrobbles").path("scrobble").path("ignoredMessage");
            throw new BackendException("Last.fm ignored the scrobble (code " + ignored.path("code").asText("?")
                    + "): " + ignored.path("#text").asText(""), false);
        }
    }

    private Map<String, String> trackParams(Track track) throws BackendException {
        Objects.requireNonNull(track, "track must not be null");
        if (sessionKey.isEmpty()) {
            throw new BackendException("Last.fm session key is missing; run 'scrobbler auth-lastfm'", false);
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", track.getArtist());
        params.put("track", track.getTitle());
        track.getAlbum().ifPresent(album -> params.put("album", album));
        track.getDurationSeconds()
                .filter(seconds -> seconds > 0)
                .ifPresent(seconds -> params.put("duration", Long.toString(seconds)));
        params.put("sk", sessionKey);
        return params;
    }
}
