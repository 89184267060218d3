package com.reclint.core.rule;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@code require_*_doc}: declarations of the configured kinds must carry a
 * doc comment. Checked by a registered validator.
 *
 * @param header   common fields
 * @param language source language
 * @param elements declaration kind to the visibility it is checked at
 * @since 1.0.0
 */
public record DocRequiredRule(RuleHeader header, DocLanguage language, Map<String, Visibility> elements)
        implements Rule {

    public DocRequiredRule {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(elements, "elements must not be null");
        header.requireAllowed(language.ruleKind());
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + header.label() + "' requires at least one doc element");
        }
        for (String element : elements.keySet()) {
            if (!language.elements().contains(element)) {
                throw new IllegalArgumentException("Rule '" + header.label() + "': unknown "
                        + language.name().toLowerCase(Locale.ROOT) + " doc element '" + element + "'");
            }
        }
        elements = Map.copyOf(elements);
    }

    @Override
    public RuleKind kind() {
        return language.ruleKind();
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visitDocRequired(this);
    }
}
