package com.reclint.core.rule;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * {@code forbidden_patterns}: like {@link TextRule} with compiled regular
 * expressions searched anywhere in the line.
 *
 * @param header   common fields
 * @param patterns compiled patterns, never empty
 * @since 1.0.0
 */
public record RegexRule(RuleHeader header, List<Pattern> patterns) implements Rule {

    public RegexRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(patterns, "patterns must not be null");
        header.requireAllowed(RuleKind.FORBIDDEN_PATTERNS);
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + header.label() + "' requires at least one pattern");
        }
        patterns = List.copyOf(patterns);
    }

    /**
     * Source text of the patterns, as declared.
     *
     * @return pattern strings
     */
    public List<String> keywords() {
        return patterns.stream().map(Pattern::pattern).toList();
    }

    @Override
    public RuleKind kind() {
        return RuleKind.FORBIDDEN_PATTERNS;
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitRegex(this);
    }

    // Pattern has identity equality
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegexRule that))
            return false;
        return header.equals(that.header) && keywords().equals(that.keywords());
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, keywords());
    }
}
