package org.endlesssource.scrobbler;

import org.endlesssource.scrobbler.api.AppChoice;
import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.api.NowPlayingEvent;
import org.endlesssource.scrobbler.api.NowPlayingSource;
import org.endlesssource.scrobbler.api.ScrobbleEvent;
import org.endlesssource.scrobbler.api.ScrobbleNotification;
import org.endlesssource.scrobbler.api.Snapshot;
import org.endlesssource.scrobbler.api.StatusListener;
import org.endlesssource.scrobbler.api.UserPrompt;
import org.endlesssource.scrobbler.dispatch.ScrobbleDispatcher;
import org.endlesssource.scrobbler.engine.PlaySessionEngine;
import org.endlesssource.scrobbler.engine.PollResult;
import org.endlesssource.scrobbler.engine.SessionState;
import org.endlesssource.scrobbler.filter.AppFilterConfig;
import org.endlesssource.scrobbler.filter.AppFilterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Polls the now-playing source once per refresh interval, runs the play-session engine and hands its
 * events to the dispatcher, the user prompt and the status listeners.
 */
public final class ScrobbleDriver implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScrobbleDriver.class);

    private final NowPlayingSource source;
    private final PlaySessionEngine engine;
    private final ScrobbleDispatcher dispatcher;
    private final List<BackendService> services;
    private final AppFilterStore appFilter;
    private final UserPrompt userPrompt;
    private final Consumer<AppFilterConfig> filterChanged;
    private final Clock clock;
    private final ScrobblerOptions options;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<String> pendingPrompts = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService pollExecutor;
    private final ExecutorService promptExecutor;
    private volatile ScrobbleStatus status = ScrobbleStatus.EMPTY;
    private volatile boolean closed;

    private ScrobbleDriver(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source must not be null");
        this.engine = Objects.requireNonNull(builder.engine, "engine must not be null");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher must not be null");
        this.services = List.copyOf(builder.services);
        this.appFilter = Objects.requireNonNull(builder.appFilter, "appFilter must not be null");
        this.userPrompt = Objects.requireNonNull(builder.userPrompt, "userPrompt must not be null");
        this.filterChanged = builder.filterChanged;
        this.clock = builder.clock;
        this.options = builder.options;
        this.pollExecutor = Executors.newSingleThreadScheduledExecutor();
        this.promptExecutor = Executors.newSingleThreadExecutor();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start polling at the configured refresh interval.
     */
    public void start() {
        long intervalMs = options.getRefreshInterval().toMillis();
        logger.info("Polling now-playing source every {} ms for {} service(s)", intervalMs, services.size());
        pollExecutor.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Capture one snapshot, evaluate it and start delivering the resulting events.
     * @return the events emitted by the engine
     */
    public PollResult pollOnce() {
        Optional<Snapshot> snapshot = captureSnapshot();
        SessionState before = engine.state();
        PollResult result = engine.poll(snapshot, clock.instant());

        if (before != SessionState.EMPTY && engine.state() == SessionState.EMPTY) {
            status = status.withNowPlaying(null);
            listeners.forEach(StatusListener::onSessionCleared);
        }
        result.askUser().ifPresent(event -> askUser(event.sourceAppId()));
        result.nowPlaying().ifPresent(this::publishNowPlaying);
        result.scrobble().ifPresent(this::publishScrobble);
        return result;
    }

    public ScrobbleStatus status() {
        return status;
    }

    public PlaySessionEngine engine() {
        return engine;
    }

    public void addStatusListener(StatusListener listener) {
        listeners.add(listener);
    }

    public void removeStatusListener(StatusListener listener) {
        listeners.remove(listener);
    }

    private void tick() {
        if (closed) {
            return;
        }
        try {
            pollOnce();
        } catch (Exception e) {
            logger.error("Poll failed", e);
        }
    }

    private Optional<Snapshot> captureSnapshot() {
        try {
            return source.currentSnapshot();
        } catch (RuntimeException e) {
            logger.debug("Now-playing source failed, treating as no media: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void publishNowPlaying(NowPlayingEvent event) {
        status = status.withNowPlaying(event.track().displayName());
        listeners.forEach(listener -> listener.onNowPlaying(event));
        deliver(event);
    }

    private void publishScrobble(ScrobbleEvent event) {
        status = status.withLastScrobbled(event.track().displayName());
        listeners.forEach(listener -> listener.onScrobble(event));
        deliver(event);
    }

    private void deliver(ScrobbleNotification notification) {
        dispatcher.dispatchAsync(notification, services)
                .thenAccept(outcomes -> listeners.forEach(listener -> listener.onDelivered(notification, outcomes)));
    }

    private void askUser(String appId) {
        if (!pendingPrompts.add(appId)) {
            return;
        }
        try {
            promptExecutor.execute(() -> {
                try {
                    AppChoice choice = userPrompt.ask(appId);
                    AppFilterConfig updated = appFilter.record(appId, choice);
                    if (filterChanged != null) {
                        filterChanged.accept(updated);
                    }
                } catch (RuntimeException e) {
                    logger.warn("Failed to record decision for {}: {}", appId, e.getMessage());
                } finally {
                    pendingPrompts.remove(appId);
                }
            });
        } catch (RejectedExecutionException e) {
            pendingPrompts.remove(appId);
            logger.debug("Prompt for {} rejected (likely shutdown)", appId);
        }
    }

    @Override
    public void close() {
        closed = true;
        pollExecutor.shutdown();
        promptExecutor.shutdownNow();
        dispatcher.close();
        listeners.clear();
        try {
            source.close();
        } catch (Exception e) {
            logger.error("Failed to close now-playing source", e);
        }
    }

    public static final class Builder {
        private NowPlayingSource source;
        private PlaySessionEngine engine;
        private ScrobbleDispatcher dispatcher;
        private List<BackendService> services = List.of();
        private AppFilterStore appFilter;
        private UserPrompt userPrompt;
        private Consumer<AppFilterConfig> filterChanged;
        private Clock clock = Clock.systemUTC();
        private ScrobblerOptions options = ScrobblerOptions.defaults();

        private Builder() {
        }

        public Builder source(NowPlayingSource source) {
            this.source = source;
            return this;
        }

        public Builder engine(PlaySessionEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder dispatcher(ScrobbleDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder services(List<BackendService> services) {
            this.services = Objects.requireNonNull(services, "services must not be null");
            return this;
        }

        public Builder appFilter(AppFilterStore appFilter) {
            this.appFilter = appFilter;
            return this;
        }

        public Builder userPrompt(UserPrompt userPrompt) {
            this.userPrompt = userPrompt;
            return this;
        }

        /**
         * Called on the prompt thread after a user decision changed the filter, typically to persist it.
         */
        public Builder onFilterChanged(Consumer<AppFilterConfig> filterChanged) {
            this.filterChanged = filterChanged;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder options(ScrobblerOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public ScrobbleDriver build() {
            return new ScrobbleDriver(this);
        }
    }
}
