package org.endlesssource.scrobbler.api;

/**
 * The user's answer when asked about a new application.
 */
public enum AppChoice {
    ALLOW,
    IGNORE
}
