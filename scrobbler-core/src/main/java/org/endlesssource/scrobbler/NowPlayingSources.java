package org.endlesssource.scrobbler;

import org.endlesssource.scrobbler.api.NowPlayingSource;
import org.endlesssource.scrobbler.spi.NowPlayingSourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Finds a {@link NowPlayingSourceProvider} for the current platform on the classpath.
 */
public final class NowPlayingSources {
    private static final Logger logger = LoggerFactory.getLogger(NowPlayingSources.class);

    private NowPlayingSources() {}

    /**
     * Open the now-playing source for the current platform.
     * @param options Runtime options
     * @return the source of the first available provider, by platform id
     * @throws UnsupportedOperationException if no provider is available
     * @throws RuntimeException if a provider is available but fails to initialize
     */
    public static NowPlayingSource create(ScrobblerOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        String currentPlatform = getPlatformName();
        logger.debug("Creating now-playing source for platform={}", currentPlatform);
        List<NowPlayingSourceProvider> candidates = loadProviders().stream()
                .filter(NowPlayingSourceProvider::supportsCurrentOs)
                .sorted(Comparator.comparing(NowPlayingSourceProvider::platformId))
                .toList();

        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No now-playing source found for platform: " + currentPlatform);
        }

        List<String> reasons = new ArrayList<>();
        for (NowPlayingSourceProvider provider : candidates) {
            SourceSupport support = provider.probeSupport();
            if (support.available()) {
                logger.info("Using now-playing source {}", provider.platformId());
                return provider.create(options);
            }
            reasons.add(provider.platformId() + ": " + support.reason());
        }

        throw new UnsupportedOperationException("No now-playing source is available: " + String.join("; ", reasons));
    }

    /**
     * Support status for the current platform.
     */
    public static SourceSupport getCurrentSupport() {
        String current = getPlatformName();
        List<NowPlayingSourceProvider> candidates = loadProviders().stream()
                .filter(NowPlayingSourceProvider::supportsCurrentOs)
                .toList();
        if (candidates.isEmpty()) {
            return SourceSupport.notCompiled(current, "No now-playing source on classpath for platform: " + current);
        }
        List<SourceSupport> probes = candidates.stream()
                .map(NowPlayingSourceProvider::probeSupport)
                .toList();
        return probes.stream()
                .filter(SourceSupport::available)
                .findFirst()
                .orElseGet(() -> {
                    String reasons = probes.stream()
                            .map(SourceSupport::reason)
                            .filter(reason -> !reason.isBlank())
                            .collect(Collectors.joining("; "));
                    return SourceSupport.unavailable(current, reasons.isBlank() ? "Provider probe failed" : reasons);
                });
    }

    /**
     * Platform ids of every provider on the classpath.
     */
    public static List<String> getCompiledPlatforms() {
        return loadProviders().stream()
                .map(NowPlayingSourceProvider::platformId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * @return linux, macos, windows or unknown
     */
    public static String getPlatformName() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("nix") || os.contains("nux")) {
            return "linux";
        } else if (os.contains("mac")) {
            return "macos";
        } else if (os.contains("win")) {
            return "windows";
        } else {
            return "unknown";
        }
    }

    private static List<NowPlayingSourceProvider> loadProviders() {
        ServiceLoader<NowPlayingSourceProvider> loader = ServiceLoader.load(NowPlayingSourceProvider.class);
        List<NowPlayingSourceProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered now-playing providers: {}",
                    providers.stream().map(NowPlayingSourceProvider::platformId).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
