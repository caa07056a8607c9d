package org.endlesssource.scrobbler.app;

import org.endlesssource.scrobbler.api.AppChoice;
import org.endlesssource.scrobbler.api.UserPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Asks on the terminal whether to scrobble from a newly seen application. Anything but an explicit
 * allow, including end of input, counts as ignore.
 */
final class ConsoleUserPrompt implements UserPrompt {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleUserPrompt.class);

    private final BufferedReader in;
    private final PrintStream out;

    ConsoleUserPrompt(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public synchronized AppChoice ask(String sourceAppId) {
        String app = sourceAppId == null ? "an unknown application" : sourceAppId;
        out.println();
        out.println("New application detected: " + app);
        out.print("Scrobble music from this application? [a]llow / [i]gnore: ");
        out.flush();

        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            logger.warn("Failed to read answer for {}: {}", app, e.getMessage());
            return AppChoice.IGNORE;
        }
        return parse(line);
    }

    static AppChoice parse(String answer) {
        if (answer == null) {
            return AppChoice.IGNORE;
        }
        return switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "a", "allow", "y", "yes" -> AppChoice.ALLOW;
            default -> AppChoice.IGNORE;
        };
    }
}
