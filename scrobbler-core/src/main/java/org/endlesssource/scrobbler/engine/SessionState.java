package org.endlesssource.scrobbler.engine;

/**
 * Observable state of the play-session engine.
 */
public enum SessionState {
    EMPTY,
    ACTIVE_UNSCROBBLED,
    ACTIVE_SCROBBLED
}
