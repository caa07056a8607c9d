package org.endlesssource.scrobbler;

import java.util.Objects;

/**
 * Whether a now-playing source can run on this machine.
 */
public record SourceSupport(String platform, boolean compiled, boolean available, String reason) {
    public SourceSupport(String platform, boolean compiled, boolean available, String reason) {
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.compiled = compiled;
        this.available = available;
        this.reason = reason == null ? "" : reason;
    }

    public static SourceSupport available(String platform) {
        return new SourceSupport(platform, true, true, "");
    }

    public static SourceSupport unavailable(String platform, String reason) {
        return new SourceSupport(platform, true, false, reason);
    }

    public static SourceSupport notCompiled(String platform, String reason) {
        return new SourceSupport(platform, false, false, reason);
    }
}
