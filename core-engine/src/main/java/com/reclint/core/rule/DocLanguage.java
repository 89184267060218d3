package com.reclint.core.rule;

import java.util.Optional;
import java.util.Set;

/**
 * Source language of a doc-required rule and the declaration kinds its
 * {@code doc} block may name.
 *
 * @since 1.0.0
 */
public enum DocLanguage {

    JAVA(RuleKind.REQUIRE_JAVA_DOC,
            Set.of("class", "interface", "enum", "record", "annotation", "method")),
    KOTLIN(RuleKind.REQUIRE_KOTLIN_DOC,
            Set.of("class", "interface", "object", "enum_class", "sealed_class", "sealed_interface",
                    "data_class", "value_class", "annotation_class", "typealias", "function")),
    RUST(RuleKind.REQUIRE_RUST_DOC,
            Set.of("struct", "enum", "trait", "type_alias", "union", "fn", "macro_rules", "mod")),
    PHP(RuleKind.REQUIRE_PHP_DOC,
            Set.of("class", "interface", "trait", "enum", "function"));

    private final RuleKind ruleKind;
    private final Set<String> elements;

    DocLanguage(RuleKind ruleKind, Set<String> elements) {
        this.ruleKind = ruleKind;
        this.elements = elements;
    }

    public RuleKind ruleKind() {
        return ruleKind;
    }

    /**
     * Declaration kinds accepted as keys of the {@code doc} block.
     *
     * @return element names
     */
    public Set<String> elements() {
        return elements;
    }

    /**
     * Language checked by a {@code require_*_doc} kind.
     *
     * @param kind rule kind
     * @return the language, or empty for other kinds
     */
    public static Optional<DocLanguage> forRuleKind(RuleKind kind) {
        for (DocLanguage language : values()) {
            if (language.ruleKind == kind) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
