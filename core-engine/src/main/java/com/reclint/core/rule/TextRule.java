package com.reclint.core.rule;

import java.util.List;
import java.util.Objects;

/**
 * {@code forbidden_texts}: reports the first forbidden keyword found on each
 * line, testing keywords in declaration order.
 *
 * @param header   common fields
 * @param keywords literal substrings, never empty
 * @since 1.0.0
 */
public record TextRule(RuleHeader header, List<String> keywords) implements Rule {

    public TextRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(keywords, "keywords must not be null");
        header.requireAllowed(RuleKind.FORBIDDEN_TEXTS);
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + header.label() + "' requires at least one keyword");
        }
        keywords = List.copyOf(keywords);
    }

    @Override
    public RuleKind kind() {
        return RuleKind.FORBIDDEN_TEXTS;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
