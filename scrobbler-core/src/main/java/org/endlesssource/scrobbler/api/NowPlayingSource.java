package org.endlesssource.scrobbler.api;

import java.util.Optional;

/**
 * Pull interface over the platform's "now playing" information.
 */
public interface NowPlayingSource extends AutoCloseable {

    /**
     * Capture the latest snapshot.
     * @return the snapshot, or empty when no media endpoint is reachable
     */
    Optional<Snapshot> currentSnapshot();

    /**
     * Release resources held by this source.
     */
    @Override
    void close();
}
