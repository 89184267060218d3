package com.reclint.core.matcher;

import java.util.Locale;
import java.util.Optional;

/**
 * How the keywords of one {@link MatchItem} are combined.
 *
 * @since 1.0.0
 */
public enum MatchCondition {

    AND,
    OR;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configuration name ({@code and} / {@code or}).
     *
     * @param name name from a rule file; may be {@code null}
     * @return the condition, or empty if unknown
     */
    public static Optional<MatchCondition> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "and" -> Optional.of(AND);
            case "or" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }
}
