package com.reclint.core.rule;

import com.reclint.core.filter.ExtFilter;
import com.reclint.core.matcher.FileMatcher;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry of a {@code review} or {@code guideline} section: a message scoped to
 * a set of files, with no enforcement.
 *
 * @param category  {@link Category#REVIEW} or {@link Category#GUIDELINE}
 * @param message   text shown to readers of the rule set
 * @param matcher   files the item concerns
 * @param extFilter suffix filter
 * @since 1.0.0
 */
public record AuxiliaryItem(Category category, String message, FileMatcher matcher, ExtFilter extFilter) {

    public AuxiliaryItem {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (category.isEnforced()) {
            throw new IllegalArgumentException("Items cannot be declared under '" + category.configKey() + "'");
        }
        matcher = matcher != null ? matcher : FileMatcher.always();
        extFilter = extFilter != null ? extFilter : ExtFilter.all();
    }

    public boolean appliesTo(Path file) {
        Path name = file.getFileName();
        return matcher.matches(file) && extFilter.matches(name != null ? name.toString() : "");
    }
}
