package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ListenBrainzConfig(@JsonProperty("enabled") boolean enabled,
                                 @JsonProperty("name") String name,
                                 @JsonProperty("token") String token,
                                 @JsonProperty("api_url") String apiUrl) {
    public static final String DEFAULT_API_URL = "https://api.listenbrainz.org";

    public ListenBrainzConfig {
        name = name == null || name.isBlank() ? "Primary" : name;
        token = token == null ? "" : token;
        apiUrl = apiUrl == null ? DEFAULT_API_URL : apiUrl;
    }

    public static ListenBrainzConfig disabled() {
        return new ListenBrainzConfig(false, "Primary", "", DEFAULT_API_URL);
    }
}
