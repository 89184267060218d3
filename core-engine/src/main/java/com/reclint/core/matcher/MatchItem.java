package com.reclint.core.matcher;

import java.util.List;
import java.util.Objects;

/**
 * One clause of a {@link FileMatcher}: a pattern kind, its keywords and the
 * condition combining them.
 *
 * <p>
 * Negative kinds negate every keyword test before the condition is applied,
 * so {@code path_not_contains [A, B] or} holds unless the path contains both
 * {@code A} and {@code B}. An item without keywords holds under {@code and}
 * and fails under {@code or}.
 * </p>
 *
 * @param pattern   pattern kind
 * @param keywords  keywords, in declaration order
 * @param condition keyword combinator
 * @since 1.0.0
 */
public record MatchItem(MatchPattern pattern, List<String> keywords, MatchCondition condition) {

    public MatchItem {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /**
     * Evaluate this clause.
     *
     * @param fileName last path element
     * @param path     full path string
     * @return whether the clause holds
     */
    public boolean matches(String fileName, String path) {
        return switch (condition) {
            case AND -> keywords.stream().allMatch(k -> pattern.test(fileName, path, k));
            case OR -> keywords.stream().anyMatch(k -> pattern.test(fileName, path, k));
        };
    }
}
