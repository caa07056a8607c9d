package org.endlesssource.scrobbler.api;

/**
 * Asks the user whether media from a new application should be scrobbled.
 */
public interface UserPrompt {

    /**
     * Block until the user decided.
     * @param sourceAppId application identifier
     * @return the decision; implementations answer {@link AppChoice#IGNORE} when the prompt is dismissed
     */
    AppChoice ask(String sourceAppId);
}
