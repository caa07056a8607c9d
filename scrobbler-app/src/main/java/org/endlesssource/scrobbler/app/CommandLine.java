package org.endlesssource.scrobbler.app;

import org.endlesssource.scrobbler.config.ConfigStore;

import java.nio.file.Path;

/**
 * Parsed command line: {@code [auth-lastfm] [--config <path>]}, or {@code help}.
 */
record CommandLine(Command command, Path configPath) {
    enum Command {
        RUN,
        AUTH_LASTFM,
        HELP
    }

    static CommandLine parse(String[] args) {
        Command command = Command.RUN;
        Path configPath = ConfigStore.defaultPath();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "auth-lastfm" -> command = Command.AUTH_LASTFM;
                case "help", "-h", "--help" -> command = Command.HELP;
                case "--config", "-c" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing path after " + arg);
                    }
                    configPath = Path.of(args[++i]);
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return new CommandLine(command, configPath);
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: scrobbler [--config <path>]",
                "       scrobbler auth-lastfm [--config <path>]",
                "",
                "  (no command)   Watch the now-playing source and scrobble to the configured services",
                "  auth-lastfm    Authorize Last.fm and store the session key in the config file",
                "  --config, -c   Config file (default: " + ConfigStore.defaultPath() + ")");
    }
}
