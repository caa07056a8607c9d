package org.endlesssource.scrobbler.linux;

import org.endlesssource.scrobbler.SourceSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinuxNowPlayingSourceProviderTest {
    private final LinuxNowPlayingSourceProvider provider = new LinuxNowPlayingSourceProvider();

    @Test
    void platformId_isLinux() {
        assertEquals("linux", provider.platformId());
    }

    @Test
    void probeSupport_reportsCompiled() {
        SourceSupport support = provider.probeSupport();
        assertEquals("linux", support.platform());
        assertTrue(support.compiled());
        if (!provider.supportsCurrentOs()) {
            assertFalse(support.available());
        }
    }
}
