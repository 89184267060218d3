package com.reclint.core.hierarchy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A rule or item tagged with the directory whose rule file declared it.
 *
 * @param value     the rule or item
 * @param sourceDir canonical directory of the declaring rule file
 * @param <T>       wrapped type
 * @since 1.0.0
 */
public record Sourced<T>(T value, Path sourceDir) {

    public Sourced {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(sourceDir, "sourceDir must not be null");
    }
}
