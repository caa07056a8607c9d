package org.endlesssource.scrobbler.filter;

import org.endlesssource.scrobbler.api.AppChoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the current {@link AppFilterConfig}. Shared between the polling thread and the thread that
 * records user decisions; the lock is held only for the read or the update itself.
 */
public final class AppFilterStore {
    private static final Logger logger = LoggerFactory.getLogger(AppFilterStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private AppFilterConfig config;

    public AppFilterStore(AppFilterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public AppFilterAction classify(String appId) {
        lock.readLock().lock();
        try {
            return AppFilter.classify(appId, config);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AppFilterConfig current() {
        lock.readLock().lock();
        try {
            return config;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Record the user's decision for an application.
     * @return the updated configuration, to be persisted by the caller outside the lock
     */
    public AppFilterConfig record(String appId, AppChoice choice) {
        Objects.requireNonNull(appId, "appId must not be null");
        Objects.requireNonNull(choice, "choice must not be null");
        AppFilterConfig updated;
        lock.writeLock().lock();
        try {
            config = choice == AppChoice.ALLOW ? config.withAllowed(appId) : config.withIgnored(appId);
            updated = config;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Application {} is now {}", appId, choice == AppChoice.ALLOW ? "allowed" : "ignored");
        return updated;
    }
}
