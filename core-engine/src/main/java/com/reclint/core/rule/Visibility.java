package com.reclint.core.rule;

import java.util.Locale;
import java.util.Optional;

/**
 * Declaration scope a doc-required rule checks.
 *
 * @since 1.0.0
 */
public enum Visibility {

    /** Only public declarations. */
    PUBLIC,
    /** Every declaration. */
    ALL;

    public static Optional<Visibility> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "public" -> Optional.of(PUBLIC);
            case "all" -> Optional.of(ALL);
            default -> Optional.empty();
        };
    }
}
