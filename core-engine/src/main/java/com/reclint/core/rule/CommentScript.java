package com.reclint.core.rule;

import com.reclint.core.comment.ScriptDetector;

import java.util.Optional;

/**
 * Script a comment-language rule requires.
 *
 * @since 1.0.0
 */
public enum CommentScript {

    JAPANESE(RuleKind.REQUIRE_JAPANESE_COMMENT),
    ENGLISH(RuleKind.REQUIRE_ENGLISH_COMMENT);

    private final RuleKind ruleKind;

    CommentScript(RuleKind ruleKind) {
        this.ruleKind = ruleKind;
    }

    public RuleKind ruleKind() {
        return ruleKind;
    }

    /**
     * Whether a comment breaks this requirement. A Japanese requirement is
     * broken by comments without Japanese; an English one by comments with
     * any Japanese character.
     *
     * @param text comment text
     * @return {@code true} if the comment is a violation
     */
    public boolean isViolatedBy(String text) {
        boolean japanese = ScriptDetector.containsJapanese(text);
        return this == JAPANESE ? !japanese : japanese;
    }

    public static Optional<CommentScript> forRuleKind(RuleKind kind) {
        for (CommentScript script : values()) {
            if (script.ruleKind == kind) {
                return Optional.of(script);
            }
        }
        return Optional.empty();
    }
}
