package org.endlesssource.scrobbler.linux;

import org.endlesssource.scrobbler.api.NowPlayingSource;
import org.endlesssource.scrobbler.api.Snapshot;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the now-playing state of MPRIS players on the session bus. Each call lists the players anew,
 * so players that start or quit between polls are picked up without a watcher.
 */
public final class MprisNowPlayingSource implements NowPlayingSource {
    private static final Logger logger = LoggerFactory.getLogger(MprisNowPlayingSource.class);
    private static final String OBJECT_PATH = "/org/mpris/MediaPlayer2";
    private static final String PLAYER_INTERFACE = "org.mpris.MediaPlayer2.Player";

    private final DBusConnection connection;

    public MprisNowPlayingSource() throws DBusException {
        this(DBusConnectionBuilder.forSessionBus().build());
    }

    MprisNowPlayingSource(DBusConnection connection) {
        this.connection = connection;
    }

    /**
     * The first player reporting {@code Playing}, otherwise the first player with metadata.
     */
    @Override
    public Optional<Snapshot> currentSnapshot() {
        List<String> players = listPlayers();
        Snapshot fallback = null;
        for (String busName : players) {
            Optional<Snapshot> snapshot = readPlayer(busName);
            if (snapshot.isEmpty()) {
                continue;
            }
            if (snapshot.get().isPlaying()) {
                return snapshot;
            }
            if (fallback == null) {
                fallback = snapshot.get();
            }
        }
        return Optional.ofNullable(fallback);
    }

    List<String> listPlayers() {
        try {
            DBus dbus = connection.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
            return Arrays.stream(dbus.ListNames())
                    .filter(name -> name.startsWith(MprisSnapshots.BUS_NAME_PREFIX))
                    .sorted()
                    .toList();
        } catch (DBusException e) {
            throw new IllegalStateException("Failed to list MPRIS players: " + e.getMessage(), e);
        }
    }

    private Optional<Snapshot> readPlayer(String busName) {
        Properties properties;
        Object metadata;
        try {
            properties = connection.getRemoteObject(busName, OBJECT_PATH, Properties.class);
            metadata = properties.Get(PLAYER_INTERFACE, "Metadata");
        } catch (Exception e) {
            logger.debug("Failed to read metadata from {}: {}", busName, e.getMessage());
            return Optional.empty();
        }
        Optional<Map<String, Object>> metadataMap = MprisMetadataUtils.toMetadataMap(metadata);
        if (metadataMap.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MprisSnapshots.toSnapshot(busName, metadataMap.get(), readPlaybackStatus(properties, busName)));
    }

    private String readPlaybackStatus(Properties properties, String busName) {
        try {
            Object status = MprisMetadataUtils.unwrap(properties.Get(PLAYER_INTERFACE, "PlaybackStatus"));
            return status instanceof String text ? text : null;
        } catch (Exception e) {
            // Some players (Firefox) do not expose PlaybackStatus reliably
            logger.debug("Failed to read playback status from {}: {}", busName, e.getMessage());
            return null;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (Exception e) {
            logger.error("Failed to close D-Bus connection", e);
        }
    }
}
