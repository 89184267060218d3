package com.reclint.core.rule;

import com.reclint.core.comment.CommentSource;

import java.util.Objects;

/**
 * {@code require_japanese_comment} / {@code require_english_comment}.
 *
 * @param header common fields
 * @param script required script
 * @param source language preset or custom syntax used to extract comments
 * @since 1.0.0
 */
public record CommentLanguageRule(RuleHeader header, CommentScript script, CommentSource source) implements Rule {

    public CommentLanguageRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(script, "script must not be null");
        Objects.requireNonNull(source, "source must not be null");
        header.requireAllowed(script.ruleKind());
    }

    @Override
    public RuleKind kind() {
        return script.ruleKind();
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitCommentLanguage(this);
    }
}
