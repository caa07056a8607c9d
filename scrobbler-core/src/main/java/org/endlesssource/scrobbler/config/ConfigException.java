package org.endlesssource.scrobbler.config;

/**
 * Configuration could not be read, parsed, validated or written.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
