package com.reclint.core.rule;

import com.reclint.core.filter.ExcludeFilter;
import com.reclint.core.filter.ExtFilter;
import com.reclint.core.matcher.FileMatcher;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Fields shared by every rule variant.
 *
 * @param label         identifier used in error messages
 * @param message       message reported with each violation
 * @param category      section the rule was declared under
 * @param matcher       path predicate selecting the files the rule applies to
 * @param excludeFilter per-rule exclusions ({@code exclude_files})
 * @param extFilter     per-rule suffix filter ({@code include_exts} / {@code exclude_exts})
 * @since 1.0.0
 */
public record RuleHeader(
        String label,
        String message,
        Category category,
        FileMatcher matcher,
        ExcludeFilter excludeFilter,
        ExtFilter extFilter) {

    public RuleHeader {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (!category.isEnforced()) {
            throw new IllegalArgumentException(
                    "Rule '" + label + "' cannot be declared under '" + category.configKey() + "'");
        }
        matcher = matcher != null ? matcher : FileMatcher.always();
        excludeFilter = excludeFilter != null ? excludeFilter : ExcludeFilter.none();
        extFilter = extFilter != null ? extFilter : ExtFilter.all();
    }

    /**
     * Whether the rule applies to a file: the matcher accepts it, no
     * exclusion entry rejects it and its name passes the suffix filter.
     *
     * @param file canonical file path
     * @return {@code true} if the rule must be checked against the file
     */
    public boolean appliesTo(Path file) {
        if (!matcher.matches(file) || excludeFilter.shouldExclude(file)) {
            return false;
        }
        Path name = file.getFileName();
        return extFilter.matches(name != null ? name.toString() : "");
    }

    /**
     * Reject a header whose category cannot hold the given kind.
     *
     * @param kind kind of the rule being built
     * @throws IllegalArgumentException if the kind is not allowed in this category
     */
    void requireAllowed(RuleKind kind) {
        if (!kind.isAllowedIn(category)) {
            throw new IllegalArgumentException("Rule '" + label + "' of type '" + kind.configName()
                    + "' cannot be declared under '" + category.configKey() + "'");
        }
    }
}
