package org.endlesssource.scrobbler.dispatch;

import org.endlesssource.scrobbler.api.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Runs an attempt until it succeeds or the policy's time budget is used up.
 * Every {@link BackendException} is retried, terminal ones included; unchecked exceptions end the loop at once.
 */
public final class Retrier {
    private static final Logger logger = LoggerFactory.getLogger(Retrier.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws BackendException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    public Retrier() {
        this(duration -> Thread.sleep(duration.toMillis()), System::nanoTime);
    }

    public Retrier(Sleeper sleeper, LongSupplier nanoClock) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
    }

    /**
     * @param policy backoff and budget
     * @param description what is being attempted, for logs
     * @param attempt the call
     * @return the first successful result
     * @throws BackendException the last failure once the budget is exhausted or the thread is interrupted
     */
    public <T> T call(RetryPolicy policy, String description, Attempt<T> attempt) throws BackendException {
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        long startNanos = nanoClock.getAsLong();
        long budgetNanos = policy.maxElapsed().toNanos();
        int attemptNumber = 0;
        while (true) {
            attemptNumber++;
            BackendException failure;
            try {
                return attempt.run();
            } catch (BackendException e) {
                failure = e;
            }

            Duration delay = policy.delayAfter(attemptNumber);
            long elapsedNanos = nanoClock.getAsLong() - startNanos;
            if (elapsedNanos + delay.toNanos() > budgetNanos) {
                logger.debug("{} failed after {} attempt(s), retry budget exhausted", description, attemptNumber);
                throw failure;
            }
            logger.debug("{} failed (attempt {}, {}): {}; retrying in {} ms", description, attemptNumber,
                    failure.isRetryable() ? "transient" : "terminal", failure.getMessage(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw failure;
            }
        }
    }
}
