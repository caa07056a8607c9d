package org.endlesssource.scrobbler.services;

import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.config.LastFmConfig;
import org.endlesssource.scrobbler.config.ListenBrainzConfig;
import org.endlesssource.scrobbler.config.ScrobblerConfig;
import org.endlesssource.scrobbler.services.lastfm.LastFmService;
import org.endlesssource.scrobbler.services.listenbrainz.ListenBrainzService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the enabled backend services from the configuration.
 */
public final class BackendServices {
    private static final Logger logger = LoggerFactory.getLogger(BackendServices.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private BackendServices() {
    }

    public static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static List<BackendService> fromConfig(ScrobblerConfig config) {
        return fromConfig(config, defaultHttpClient());
    }

    /**
     * At most one Last.fm service and one service per enabled ListenBrainz instance, in that order.
     * An enabled Last.fm section without a session key is skipped until it has been authorized.
     */
    public static List<BackendService> fromConfig(ScrobblerConfig config, HttpClient httpClient) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(httpClient, "httpClient must not be null");
        List<BackendService> services = new ArrayList<>();

        LastFmConfig lastFm = config.getLastFm().orElse(null);
        if (lastFm != null && lastFm.enabled()) {
            if (lastFm.sessionKey().isEmpty()) {
                logger.warn("Last.fm is enabled but not authorized; run 'scrobbler auth-lastfm'");
            } else {
                services.add(new LastFmService(lastFm, httpClient));
                logger.info("Last.fm scrobbling enabled");
            }
        }

        for (ListenBrainzConfig instance : config.listenbrainz()) {
            if (instance.enabled()) {
                services.add(new ListenBrainzService(instance, httpClient));
                logger.info("ListenBrainz scrobbling enabled: {} ({})", instance.name(), instance.apiUrl());
            }
        }
        return List.copyOf(services);
    }
}
