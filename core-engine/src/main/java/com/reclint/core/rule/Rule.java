package com.reclint.core.rule;

import com.reclint.core.matcher.FileMatcher;

import java.nio.file.Path;

/**
 * A single enforced rule, immutable once constructed.
 *
 * <p>
 * The set of variants is closed; code that needs per-variant behavior
 * dispatches through {@link #accept(RuleVisitor)} so that adding a variant
 * is a compile error everywhere it is not handled.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface Rule
        permits TextRule, RegexRule, CommandRule, DocRequiredRule, CommentLanguageRule, TestNameRule,
        TestExistenceRule {

    RuleHeader header();

    RuleKind kind();

    <R> R accept(RuleVisitor<R> visitor);

    default String label() {
        return header().label();
    }

    default String message() {
        return header().message();
    }

    default Category category() {
        return header().category();
    }

    default FileMatcher matcher() {
        return header().matcher();
    }

    default boolean appliesTo(Path file) {
        return header().appliesTo(file);
    }
}
