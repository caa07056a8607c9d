package org.endlesssource.scrobbler.filter;

/**
 * Outcome of classifying a source application.
 */
public enum AppFilterAction {
    ALLOW,
    IGNORE,
    ASK_USER
}
