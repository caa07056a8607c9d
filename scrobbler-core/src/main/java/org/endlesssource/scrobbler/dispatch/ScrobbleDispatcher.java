package org.endlesssource.scrobbler.dispatch;

import org.endlesssource.scrobbler.api.BackendException;
import org.endlesssource.scrobbler.api.BackendService;
import org.endlesssource.scrobbler.api.ScrobbleNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Delivers each notification to every configured service independently. Each service call gets its own
 * retry loop; one service failing never holds back another.
 */
public final class ScrobbleDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScrobbleDispatcher.class);

    private final ExecutorService executor;
    private final Retrier retrier;
    private final RetryPolicy nowPlayingPolicy;
    private final RetryPolicy scrobblePolicy;

    public ScrobbleDispatcher() {
        this(Executors.newCachedThreadPool(), new Retrier(), RetryPolicy.NOW_PLAYING, RetryPolicy.SCROBBLE);
    }

    public ScrobbleDispatcher(ExecutorService executor,
                              Retrier retrier,
                              RetryPolicy nowPlayingPolicy,
                              RetryPolicy scrobblePolicy) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.retrier = Objects.requireNonNull(retrier, "retrier must not be null");
        this.nowPlayingPolicy = Objects.requireNonNull(nowPlayingPolicy, "nowPlayingPolicy must not be null");
        this.scrobblePolicy = Objects.requireNonNull(scrobblePolicy, "scrobblePolicy must not be null");
    }

    /**
     * Deliver and wait for every service to finish.
     * @return one outcome per service, in the order of {@code services}
     */
    public List<DispatchOutcome> dispatch(ScrobbleNotification notification, List<BackendService> services) {
        return dispatchAsync(notification, services).join();
    }

    /**
     * Start delivery to every service in parallel.
     * @return completes once every service succeeded or used up its retry budget; never completes exceptionally
     */
    public CompletableFuture<List<DispatchOutcome>> dispatchAsync(ScrobbleNotification notification,
                                                                  List<BackendService> services) {
        Objects.requireNonNull(notification, "notification must not be null");
        Objects.requireNonNull(services, "services must not be null");
        RetryPolicy policy = policyFor(notification);
        List<CompletableFuture<DispatchOutcome>> perService = services.stream()
                .map(service -> CompletableFuture.supplyAsync(() -> deliver(notification, service, policy), executor)
                        .exceptionally(e -> DispatchOutcome.failed(service.id(),
                                new BackendException("Delivery could not run: " + e.getMessage(), false, e))))
                .toList();
        return CompletableFuture.allOf(perService.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> perService.stream().map(CompletableFuture::join).toList());
    }

    public RetryPolicy policyFor(ScrobbleNotification notification) {
        return notification.isAuthoritative() ? scrobblePolicy : nowPlayingPolicy;
    }

    private DispatchOutcome deliver(ScrobbleNotification notification, BackendService service, RetryPolicy policy) {
        String description = describe(notification) + " to " + service.id();
        try {
            retrier.call(policy, description, () -> {
                notification.deliverTo(service);
                return null;
            });
            logger.info("{}: {} delivered", service.id(), describe(notification));
            return DispatchOutcome.success(service.id());
        } catch (BackendException e) {
            logger.warn("{} failed: {}", description, e.getMessage());
            return DispatchOutcome.failed(service.id(), e);
        } catch (RuntimeException e) {
            logger.warn("{} failed unexpectedly", description, e);
            return DispatchOutcome.failed(service.id(), new BackendException(e.toString(), false, e));
        }
    }

    private static String describe(ScrobbleNotification notification) {
        String kind = notification.isAuthoritative() ? "Scrobble" : "Now playing";
        return kind + " '" + notification.track().displayName() + "'";
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("Abandoning in-flight deliveries on shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
