package org.endlesssource.scrobbler.dispatch;

import org.endlesssource.scrobbler.api.BackendException;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of delivering one notification to one service.
 */
public record DispatchOutcome(String serviceId, Optional<BackendException> failure) {
    public DispatchOutcome {
        Objects.requireNonNull(serviceId, "serviceId must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
    }

    public static DispatchOutcome success(String serviceId) {
        return new DispatchOutcome(serviceId, Optional.empty());
    }

    public static DispatchOutcome failed(String serviceId, BackendException failure) {
        return new DispatchOutcome(serviceId, Optional.of(failure));
    }

    public boolean isSuccess() {
        return failure.isEmpty();
    }
}
