package org.endlesssource.scrobbler.linux;

import org.endlesssource.scrobbler.ScrobblerOptions;
import org.endlesssource.scrobbler.SourceSupport;
import org.endlesssource.scrobbler.api.NowPlayingSource;
import org.endlesssource.scrobbler.spi.NowPlayingSourceProvider;
import org.freedesktop.dbus.exceptions.DBusException;

public final class LinuxNowPlayingSourceProvider implements NowPlayingSourceProvider {
    @Override
    public String platformId() {
        return "linux";
    }

    @Override
    public boolean supportsCurrentOs() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("nix") || os.contains("nux");
    }

    @Override
    public SourceSupport probeSupport() {
        if (!supportsCurrentOs()) {
            return SourceSupport.unavailable(platformId(), "Current OS is not Linux");
        }
        try {
            Class.forName("org.freedesktop.dbus.connections.impl.DBusConnectionBuilder");
        } catch (ClassNotFoundException e) {
            return SourceSupport.unavailable(platformId(), "Missing D-Bus runtime classes");
        }
        String sessionBus = System.getenv("DBUS_SESSION_BUS_ADDRESS");
        if (sessionBus == null || sessionBus.isBlank()) {
            return SourceSupport.unavailable(platformId(), "No D-Bus session bus (DBUS_SESSION_BUS_ADDRESS is not set)");
        }
        return SourceSupport.available(platformId());
    }

    @Override
    public NowPlayingSource create(ScrobblerOptions options) {
        try {
            return new MprisNowPlayingSource();
        } catch (DBusException e) {
            throw new IllegalStateException("Failed to connect to the D-Bus session bus: " + e.getMessage(), e);
        }
    }
}
