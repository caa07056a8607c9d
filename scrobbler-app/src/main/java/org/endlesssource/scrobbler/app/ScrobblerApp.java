package org.endlesssource.scrobbler.app;

import org.endlesssource.scrobbler.NowPlayingSources;
import org.endlesssource.scrobbler.ScrobbleDriver;
import org.endlesssource.scrobbler.ScrobblerOptions;
import org.endlesssource.scrobbler.SourceSupport;
import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.api.NowPlayingSource;
import org.endlesssource.scrobbler.config.ConfigException;
import org.endlesssource.scrobbler.config.ConfigStore;
import org.endlesssource.scrobbler.config.LastFmConfig;
import org.endlesssource.scrobbler.config.ScrobblerConfig;
import org.endlesssource.scrobbler.dispatch.ScrobbleDispatcher;
import org.endlesssource.scrobbler.engine.PlaySessionEngine;
import org.endlesssource.scrobbler.filter.AppFilterConfig;
import org.endlesssource.scrobbler.filter.AppFilterStore;
import org.endlesssource.scrobbler.services.BackendServices;
import org.endlesssource.scrobbler.services.lastfm.LastFmAuthenticator;
import org.endlesssource.scrobbler.services.listenbrainz.ListenBrainzService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

public final class ScrobblerApp {
    private static final Logger logger = LoggerFactory.getLogger(ScrobblerApp.class);

    public static void main(String[] args) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CommandLine.usage());
            System.exit(2);
            return;
        }

        ConfigStore store = new ConfigStore(commandLine.configPath());
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            switch (commandLine.command()) {
                case HELP -> System.out.println(CommandLine.usage());
                case AUTH_LASTFM -> authorizeLastFm(store, console);
                case RUN -> run(store, console);
            }
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(1);
        } catch (BackendException e) {
            System.err.println("Last.fm authorization failed: " + e.getMessage());
            System.exit(1);
        } catch (UnsupportedOperationException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void run(ConfigStore store, BufferedReader console) throws ConfigException, InterruptedException {
        ScrobblerConfig initial = store.loadOrCreate();
        logger.info("Loaded configuration from {}", store.getPath());
        AtomicReference<ScrobblerConfig> config = new AtomicReference<>(initial);

        SourceSupport support = NowPlayingSources.getCurrentSupport();
        if (!support.available()) {
            throw new UnsupportedOperationException("Unsupported platform: " + NowPlayingSources.getPlatformName()
                    + " (" + support.reason() + ")");
        }

        ScrobblerOptions options = initial.toOptions();
        List<BackendService> services = BackendServices.fromConfig(initial);
        if (services.isEmpty()) {
            logger.warn("No scrobbling services configured; edit {} to add one", store.getPath());
        }
        validateListenBrainzTokens(services);

        AppFilterStore appFilter = new AppFilterStore(initial.appFiltering().toFilterConfig());
        NowPlayingSource source = NowPlayingSources.create(options);
        ScrobbleDriver driver = ScrobbleDriver.builder()
                .source(source)
                .engine(new PlaySessionEngine(options, initial.cleanup().toNormalizer(), appFilter))
                .dispatcher(new ScrobbleDispatcher())
                .services(services)
                .appFilter(appFilter)
                .userPrompt(new ConsoleUserPrompt(console, System.out))
                .onFilterChanged(filter -> persistFilter(store, config, filter))
                .options(options)
                .build();
        driver.addStatusListener(new LoggingStatusListener());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            driver.close();
            stopped.countDown();
        }, "scrobbler-shutdown"));

        logger.info("Scrobbler running (refresh {}s, threshold {}%)",
                options.getRefreshInterval().getSeconds(), options.getThresholdPercent());
        driver.start();
        stopped.await();
    }

    private static void validateListenBrainzTokens(List<BackendService> services) {
        for (BackendService service : services) {
            if (service instanceof ListenBrainzService listenBrainz) {
                try {
                    listenBrainz.validateToken().ifPresentOrElse(
                            user -> logger.info("{} authenticated as {}", service.id(), user),
                            () -> logger.warn("{} rejected the configured token", service.id()));
                } catch (BackendException e) {
                    logger.warn("Could not validate {} token: {}", service.id(), e.getMessage());
                }
            }
        }
    }

    private static void persistFilter(ConfigStore store, AtomicReference<ScrobblerConfig> config,
                                      AppFilterConfig filter) {
        ScrobblerConfig updated = config.updateAndGet(current -> current.withAppFiltering(filter));
        try {
            store.save(updated);
        } catch (ConfigException e) {
            logger.error("Failed to save application choice", e);
        }
    }

    private static void authorizeLastFm(ConfigStore store, BufferedReader console)
            throws ConfigException, BackendException {
        ScrobblerConfig config = store.loadOrCreate();
        LastFmConfig lastFm = config.getLastFm().orElse(LastFmConfig.disabled());
        if (lastFm.apiKey().isEmpty() || lastFm.apiSecret().isEmpty()) {
            throw new ConfigException("Set [lastfm] api_key and api_secret in " + store.getPath()
                    + " (get them at https://www.last.fm/api/account/create)");
        }

        LastFmAuthenticator authenticator =
                new LastFmAuthenticator(lastFm.apiKey(), lastFm.apiSecret(), BackendServices.defaultHttpClient());
        System.out.println("Getting authorization token...");
        String token = authenticator.requestToken();
        System.out.println("Please authorize this application:");
        System.out.println("  " + authenticator.authorizationUrl(token));
        System.out.println("After authorizing, press Enter to continue...");
        try {
            console.readLine();
        } catch (IOException e) {
            throw new BackendException("Failed to read from console: " + e.getMessage(), false, e);
        }

        String sessionKey = authenticator.fetchSessionKey(token);
        LastFmConfig authorized = new LastFmConfig(true, lastFm.apiKey(), lastFm.apiSecret(), sessionKey);
        store.save(config.withLastFm(authorized));
        System.out.println("Session key saved to " + store.getPath());
    }

    private ScrobblerApp() {
    }
}
