package org.endlesssource.scrobbler.filter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which applications may be scrobbled. An application id may not be both allowed and ignored.
 */
public record AppFilterConfig(boolean promptForNewApps,
                              boolean scrobbleUnknown,
                              Set<String> allowedApps,
                              Set<String> ignoredApps) {

    public AppFilterConfig(boolean promptForNewApps,
                           boolean scrobbleUnknown,
                           Set<String> allowedApps,
                           Set<String> ignoredApps) {
        this.promptForNewApps = promptForNewApps;
        this.scrobbleUnknown = scrobbleUnknown;
        this.allowedApps = copyOf(allowedApps);
        this.ignoredApps = copyOf(ignoredApps);
        for (String appId : this.allowedApps) {
            if (this.ignoredApps.contains(appId)) {
                throw new IllegalArgumentException(
                        "Application '" + appId + "' appears in both allowed and ignored apps");
            }
        }
    }

    public static AppFilterConfig defaults() {
        return new AppFilterConfig(true, true, Set.of(), Set.of());
    }

    /**
     * Copy with {@code appId} moved into the allowed set.
     */
    public AppFilterConfig withAllowed(String appId) {
        Set<String> allowed = new LinkedHashSet<>(allowedApps);
        Set<String> ignored = new LinkedHashSet<>(ignoredApps);
        ignored.remove(appId);
        allowed.add(appId);
        return new AppFilterConfig(promptForNewApps, scrobbleUnknown, allowed, ignored);
    }

    /**
     * Copy with {@code appId} moved into the ignored set.
     */
    public AppFilterConfig withIgnored(String appId) {
        Set<String> allowed = new LinkedHashSet<>(allowedApps);
        Set<String> ignored = new LinkedHashSet<>(ignoredApps);
        allowed.remove(appId);
        ignored.add(appId);
        return new AppFilterConfig(promptForNewApps, scrobbleUnknown, allowed, ignored);
    }

    private static Set<String> copyOf(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
