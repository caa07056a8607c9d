package org.endlesssource.scrobbler.spi;

import org.endlesssource.scrobbler.ScrobblerOptions;
import org.endlesssource.scrobbler.SourceSupport;
import org.endlesssource.scrobbler.api.NowPlayingSource;

/**
 * SPI implemented by platform modules that can read the system's now-playing information.
 */
public interface NowPlayingSourceProvider {

    /**
     * Stable platform id, e.g. linux.
     */
    String platformId();

    /**
     * True when this provider targets the current operating system.
     */
    boolean supportsCurrentOs();

    /**
     * Probe runtime availability (session bus, native helpers, ...).
     */
    SourceSupport probeSupport();

    /**
     * Open the source.
     */
    NowPlayingSource create(ScrobblerOptions options);
}
