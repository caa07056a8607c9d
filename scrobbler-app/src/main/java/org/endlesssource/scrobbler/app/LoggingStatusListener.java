package org.endlesssource.scrobbler.app;

import org.endlesssource.scrobbler.api.NowPlayingEvent;
import org.endlesssource.scrobbler.api.ScrobbleEvent;
import org.endlesssource.scrobbler.api.ScrobbleNotification;
import org.endlesssource.scrobbler.api.StatusListener;
import org.endlesssource.scrobbler.dispatch.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reports status changes to the log in place of a tray menu.
 */
final class LoggingStatusListener implements StatusListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingStatusListener.class);

    @Override
    public void onNowPlaying(NowPlayingEvent event) {
        logger.info("Now Playing: {}", event.track().displayName());
    }

    @Override
    public void onScrobble(ScrobbleEvent event) {
        logger.info("Last Scrobbled: {}", event.track().displayName());
    }

    @Override
    public void onSessionCleared() {
        logger.info("Now Playing: None");
    }

    @Override
    public void onDelivered(ScrobbleNotification notification, List<DispatchOutcome> outcomes) {
        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        if (failed > 0) {
            logger.warn("{} of {} service(s) did not receive '{}'", failed, outcomes.size(),
                    notification.track().displayName());
        }
    }
}
