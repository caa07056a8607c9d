package org.endlesssource.scrobbler.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Strips configured noise such as "[Explicit]" from track, artist and album names.
 */
public final class TextNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "\\s*\\[Explicit\\]",
            "\\s*\\[Clean\\]",
            "\\s*\\(Explicit\\)",
            "\\s*\\(Clean\\)",
            "\\s*- Explicit",
            "\\s*- Clean"
    );

    private final boolean enabled;
    private final List<Pattern> patterns;

    private TextNormalizer(boolean enabled, List<Pattern> patterns) {
        this.enabled = enabled;
        this.patterns = Collections.unmodifiableList(patterns);
    }

    /**
     * Compile the given patterns in declaration order. Patterns that do not compile are logged and skipped.
     * @param enabled false makes {@link #normalize(String)} the identity
     * @param patterns regular expressions whose matches are removed
     * @return the normalizer
     */
    public static TextNormalizer create(boolean enabled, List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (enabled && patterns != null) {
            for (String pattern : patterns) {
                if (pattern == null) {
                    continue;
                }
                try {
                    compiled.add(Pattern.compile(pattern));
                } catch (PatternSyntaxException e) {
                    logger.warn("Invalid cleanup pattern '{}': {}", pattern, e.getDescription());
                }
            }
        }
        return new TextNormalizer(enabled, compiled);
    }

    public static TextNormalizer defaults() {
        return create(true, DEFAULT_PATTERNS);
    }

    public static TextNormalizer disabled() {
        return new TextNormalizer(false, List.of());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int patternCount() {
        return patterns.size();
    }

    /**
     * Remove every match of every pattern, in order, then trim. Passes repeat until the text stops changing,
     * so normalizing an already normalized value returns it unchanged. A pass that changes the text always
     * shortens it, which bounds the number of passes by the length.
     */
    public String normalize(String text) {
        if (!enabled || text == null) {
            return text;
        }
        String current = text;
        String next = applyOnce(current);
        while (!next.equals(current)) {
            current = next;
            next = applyOnce(current);
        }
        return current;
    }

    public Optional<String> normalizeOptional(String text) {
        return Optional.ofNullable(text).map(this::normalize);
    }

    private String applyOnce(String text) {
        String result = text;
        for (Pattern pattern : patterns) {
            result = pattern.matcher(result).replaceAll("");
        }
        return result.trim();
    }
}
