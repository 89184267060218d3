package com.reclint.core.filter;

import java.util.Locale;
import java.util.Optional;

/**
 * Test applied by one {@link ExcludeFilter} entry.
 *
 * @since 1.0.0
 */
public enum ExcludeFilterType {

    FILE_STARTS_WITH,
    FILE_ENDS_WITH,
    PATH_CONTAINS;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configuration name such as {@code path_contains}.
     *
     * @param name name from a rule file; may be {@code null}
     * @return the filter type, or empty if unknown
     */
    public static Optional<ExcludeFilterType> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ExcludeFilterType type : values()) {
            if (type.configName().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
