package org.endlesssource.scrobbler.app;

import org.endlesssource.scrobbler.config.ConfigStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommandLineTest {

    @Test
    void parse_noArguments_runsWithDefaultConfig() {
        CommandLine commandLine = CommandLine.parse(new String[0]);
        assertEquals(CommandLine.Command.RUN, commandLine.command());
        assertEquals(ConfigStore.defaultPath(), commandLine.configPath());
    }

    @Test
    void parse_authWithConfig() {
        CommandLine commandLine = CommandLine.parse(new String[]{"auth-lastfm", "--config", "/tmp/s.toml"});
        assertEquals(CommandLine.Command.AUTH_LASTFM, commandLine.command());
        assertEquals(Path.of("/tmp/s.toml"), commandLine.configPath());
    }

    @Test
    void parse_configBeforeCommand() {
        CommandLine commandLine = CommandLine.parse(new String[]{"-c", "other.toml", "auth-lastfm"});
        assertEquals(CommandLine.Command.AUTH_LASTFM, commandLine.command());
        assertEquals(Path.of("other.toml"), commandLine.configPath());
    }

    @Test
    void parse_help() {
        assertEquals(CommandLine.Command.HELP, CommandLine.parse(new String[]{"--help"}).command());
    }

    @Test
    void parse_missingConfigPath_throws() {
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[]{"--config"}));
    }

    @Test
    void parse_unknownArgument_throws() {
        assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[]{"--verbose"}));
    }
}
