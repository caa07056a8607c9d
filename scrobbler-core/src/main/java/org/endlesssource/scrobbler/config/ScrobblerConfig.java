package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.endlesssource.scrobbler.ScrobblerOptions;
import org.endlesssource.scrobbler.filter.AppFilterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The persisted configuration file. Missing sections fall back to their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrobblerConfig(@JsonProperty("refresh_interval") Long refreshInterval,
                              @JsonProperty("scrobble_threshold") Integer scrobbleThreshold,
                              @JsonProperty("cleanup") CleanupConfig cleanup,
                              @JsonProperty("app_filtering") AppFilteringConfig appFiltering,
                              @JsonProperty("lastfm") LastFmConfig lastfm,
                              @JsonProperty("listenbrainz") List<ListenBrainzConfig> listenbrainz) {
    private static final Logger logger = LoggerFactory.getLogger(ScrobblerConfig.class);

    public ScrobblerConfig {
        refreshInterval = refreshInterval == null
                ? ScrobblerOptions.DEFAULT_REFRESH_INTERVAL.getSeconds() : refreshInterval;
        scrobbleThreshold = scrobbleThreshold == null ? ScrobblerOptions.DEFAULT_THRESHOLD_PERCENT : scrobbleThreshold;
        cleanup = cleanup == null ? CleanupConfig.defaults() : cleanup;
        appFiltering = appFiltering == null ? AppFilteringConfig.defaults() : appFiltering;
        listenbrainz = listenbrainz == null ? List.of() : List.copyOf(listenbrainz);
    }

    public static ScrobblerConfig defaults() {
        return new ScrobblerConfig(
                ScrobblerOptions.DEFAULT_REFRESH_INTERVAL.getSeconds(),
                ScrobblerOptions.DEFAULT_THRESHOLD_PERCENT,
                CleanupConfig.defaults(),
                AppFilteringConfig.defaults(),
                LastFmConfig.disabled(),
                List.of(ListenBrainzConfig.disabled()));
    }

    @JsonIgnore
    public Optional<LastFmConfig> getLastFm() {
        return Optional.ofNullable(lastfm);
    }

    public ScrobblerConfig withAppFiltering(AppFilterConfig filter) {
        return new ScrobblerConfig(refreshInterval, scrobbleThreshold, cleanup,
                AppFilteringConfig.from(filter), lastfm, listenbrainz);
    }

    public ScrobblerConfig withLastFm(LastFmConfig config) {
        return new ScrobblerConfig(refreshInterval, scrobbleThreshold, cleanup, appFiltering, config, listenbrainz);
    }

    public ScrobblerOptions toOptions() {
        return ScrobblerOptions.defaults()
                .withRefreshInterval(Duration.ofSeconds(refreshInterval))
                .withThresholdPercent(scrobbleThreshold);
    }

    /**
     * Reject configurations that cannot run. A configuration with no enabled service is accepted with a warning.
     * @throws ConfigException describing the first problem found
     */
    public void validate() throws ConfigException {
        if (refreshInterval <= 0) {
            throw new ConfigException("refresh_interval must be greater than 0");
        }
        if (scrobbleThreshold < 1 || scrobbleThreshold > 100) {
            throw new ConfigException("scrobble_threshold must be between 1 and 100");
        }

        boolean lastFmEnabled = lastfm != null && lastfm.enabled();
        boolean listenBrainzEnabled = listenbrainz.stream().anyMatch(ListenBrainzConfig::enabled);
        if (!lastFmEnabled && !listenBrainzEnabled) {
            logger.warn("No scrobbling services are enabled");
        }

        if (lastFmEnabled) {
            if (lastfm.apiKey().isEmpty()) {
                throw new ConfigException("Last.fm api_key is required when Last.fm is enabled");
            }
            if (lastfm.apiSecret().isEmpty()) {
                throw new ConfigException("Last.fm api_secret is required when Last.fm is enabled");
            }
        }

        Set<String> names = new HashSet<>();
        for (ListenBrainzConfig instance : listenbrainz) {
            if (!instance.enabled()) {
                continue;
            }
            if (instance.token().isEmpty()) {
                throw new ConfigException("ListenBrainz token is required when enabled (instance: "
                        + instance.name() + ")");
            }
            if (instance.apiUrl().isBlank()) {
                throw new ConfigException("ListenBrainz api_url is required (instance: " + instance.name() + ")");
            }
            if (!names.add(instance.name())) {
                throw new ConfigException("Duplicate ListenBrainz instance name: " + instance.name());
            }
        }

        for (String appId : appFiltering.allowedApps()) {
            if (appFiltering.ignoredApps().contains(appId)) {
                throw new ConfigException("Application '" + appId + "' appears in both allowed_apps and ignored_apps");
            }
        }
    }
}
