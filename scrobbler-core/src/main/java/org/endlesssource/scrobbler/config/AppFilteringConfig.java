package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.endlesssource.scrobbler.filter.AppFilterConfig;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Persisted form of the application filter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppFilteringConfig(@JsonProperty("prompt_for_new_apps") boolean promptForNewApps,
                                 @JsonProperty("scrobble_unknown") boolean scrobbleUnknown,
                                 @JsonProperty("allowed_apps") List<String> allowedApps,
                                 @JsonProperty("ignored_apps") List<String> ignoredApps) {

    public AppFilteringConfig {
        allowedApps = allowedApps == null ? List.of() : List.copyOf(allowedApps);
        ignoredApps = ignoredApps == null ? List.of() : List.copyOf(ignoredApps);
    }

    public static AppFilteringConfig defaults() {
        return new AppFilteringConfig(true, true, List.of(), List.of());
    }

    public static AppFilteringConfig from(AppFilterConfig filter) {
        return new AppFilteringConfig(filter.promptForNewApps(), filter.scrobbleUnknown(),
                List.copyOf(filter.allowedApps()), List.copyOf(filter.ignoredApps()));
    }

    /**
     * @throws IllegalArgumentException if an application is both allowed and ignored
     */
    public AppFilterConfig toFilterConfig() {
        return new AppFilterConfig(promptForNewApps, scrobbleUnknown,
                new LinkedHashSet<>(allowedApps), new LinkedHashSet<>(ignoredApps));
    }
}
