package com.reclint.core.validation;

import com.reclint.core.comment.Comment;
import com.reclint.core.comment.ScriptDetector;
import com.reclint.core.rule.CommentLanguageRule;
import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Built-in validator for {@code require_japanese_comment} and
 * {@code require_english_comment}.
 *
 * <p>
 * Comments are extracted with the rule's preset or custom syntax. Blank
 * comments and lone {@code *} decoration lines are ignored. Each finding is
 * reported at column 1 with the comment text, cut to
 * {@value #MAX_FOUND_LENGTH} characters.
 * </p>
 *
 * @since 1.0.0
 */
public final class CommentLanguageValidator implements Validator {

    static final int MAX_FOUND_LENGTH = 40;

    private static final Set<RuleKind> KINDS =
            Set.of(RuleKind.REQUIRE_JAPANESE_COMMENT, RuleKind.REQUIRE_ENGLISH_COMMENT);

    @Override
    public Set<RuleKind> supportedKinds() {
        return KINDS;
    }

    @Override
    public List<Finding> validate(Path file, String content, Rule rule, Path rootDir) {
        if (!(rule instanceof CommentLanguageRule commentRule)) {
            throw new IllegalArgumentException("Unsupported rule kind: " + rule.kind().configName());
        }
        List<Finding> findings = new ArrayList<>();
        for (Comment comment : commentRule.source().extractComments(content)) {
            if (ScriptDetector.isEmptyOrDecoration(comment.text())) {
                continue;
            }
            if (commentRule.script().isViolatedBy(comment.text())) {
                findings.add(new Finding(comment.line(), 1, truncate(comment.text())));
            }
        }
        return findings;
    }

    static String truncate(String text) {
        if (text.codePointCount(0, text.length()) <= MAX_FOUND_LENGTH) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, MAX_FOUND_LENGTH)) + "...";
    }
}
