package org.endlesssource.scrobbler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.endlesssource.scrobbler.normalize.TextNormalizer;

import java.util.List;

/**
 * Text cleanup settings: regular expressions removed from track, artist and album names, in order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CleanupConfig(@JsonProperty("enabled") boolean enabled,
                            @JsonProperty("patterns") List<String> patterns) {

    public CleanupConfig {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public static CleanupConfig defaults() {
        return new CleanupConfig(true, TextNormalizer.DEFAULT_PATTERNS);
    }

    public TextNormalizer toNormalizer() {
        return TextNormalizer.create(enabled, patterns);
    }
}
