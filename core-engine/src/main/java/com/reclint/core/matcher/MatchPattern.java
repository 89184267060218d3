package com.reclint.core.matcher;

import java.util.Locale;
import java.util.Optional;

/**
 * Pattern kind of a single {@link MatchItem}.
 *
 * <p>
 * The three positive kinds test the file name or the full path string. Each
 * negative kind is the per-keyword negation of its positive counterpart.
 * </p>
 *
 * @since 1.0.0
 */
public enum MatchPattern {

    FILE_STARTS_WITH(false),
    FILE_ENDS_WITH(false),
    PATH_CONTAINS(false),
    FILE_NOT_STARTS_WITH(true),
    FILE_NOT_ENDS_WITH(true),
    PATH_NOT_CONTAINS(true);

    private final boolean negative;

    MatchPattern(boolean negative) {
        this.negative = negative;
    }

    /**
     * Test one keyword against a file, applying the negation of negative kinds.
     *
     * @param fileName last path element
     * @param path     full path string
     * @param keyword  keyword to test
     * @return result of the (possibly negated) keyword test
     */
    public boolean test(String fileName, String path, String keyword) {
        boolean positive = switch (this) {
            case FILE_STARTS_WITH, FILE_NOT_STARTS_WITH -> fileName.startsWith(keyword);
            case FILE_ENDS_WITH, FILE_NOT_ENDS_WITH -> fileName.endsWith(keyword);
            case PATH_CONTAINS, PATH_NOT_CONTAINS -> path.contains(keyword);
        };
        return negative != positive;
    }

    /**
     * Name used in rule files, e.g. {@code file_not_ends_with}.
     *
     * @return snake_case configuration name
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configuration name.
     *
     * @param name snake_case name from a rule file; may be {@code null}
     * @return the matching pattern, or empty if unknown
     */
    public static Optional<MatchPattern> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MatchPattern pattern : values()) {
            if (pattern.configName().equals(normalized)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
