package com.reclint.core.rule;

import java.util.Locale;
import java.util.Optional;

/**
 * How strictly a test-existence rule checks for tests.
 *
 * @since 1.0.0
 */
public enum TestRequireLevel {

    /** A test file (or test module) must exist. */
    EXISTS,
    /** Every public method or function must be referenced by a test. */
    ALL_PUBLIC;

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TestRequireLevel> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "exists" -> Optional.of(EXISTS);
            case "all_public" -> Optional.of(ALL_PUBLIC);
            default -> Optional.empty();
        };
    }
}
