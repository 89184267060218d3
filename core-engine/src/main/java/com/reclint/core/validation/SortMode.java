package com.reclint.core.validation;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordering and layout of violation output.
 *
 * @since 1.0.0
 */
public enum SortMode {

    /** Grouped by message, then file, line and column. */
    RULE,
    /** Grouped by file, then line, column and message. */
    FILE;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SortMode> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "rule" -> Optional.of(RULE);
            case "file" -> Optional.of(FILE);
            default -> Optional.empty();
        };
    }
}
