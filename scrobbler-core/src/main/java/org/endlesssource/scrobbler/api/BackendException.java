package org.endlesssource.scrobbler.api;

/**
 * Failure reported by a {@link BackendService}. The adapter classifies it as retryable
 * (network, server errors, timeouts) or terminal (authentication, malformed credentials).
 */
public class BackendException extends Exception {
    private final boolean retryable;

    public BackendException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public BackendException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
