package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LastFmConfig(@JsonProperty("enabled") boolean enabled,
                           @JsonProperty("api_key") String apiKey,
                           @JsonProperty("api_secret") String apiSecret,
                           @JsonProperty("session_key") String sessionKey) {

    public LastFmConfig {
        apiKey = apiKey == null ? "" : apiKey;
        apiSecret = apiSecret == null ? "" : apiSecret;
        sessionKey = sessionKey == null ? "" : sessionKey;
    }

    public static LastFmConfig disabled() {
        return new LastFmConfig(false, "", "", "");
    }

    public LastFmConfig withSessionKey(String key) {
        return new LastFmConfig(enabled, apiKey, apiSecret, key);
    }
}
