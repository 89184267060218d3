package com.reclint.core.rule;

/**
 * Exhaustive dispatch over the {@link Rule} variants.
 *
 * @param <R> result type
 * @since 1.0.0
 */
public interface RuleVisitor<R> {

    R visitText(TextRule rule);

    R visitRegex(RegexRule rule);

    R visitCommand(CommandRule rule);

    R visitDocRequired(DocRequiredRule rule);

    R visitCommentLanguage(CommentLanguageRule rule);

    R visitTestName(TestNameRule rule);

    R visitTestExistence(TestExistenceRule rule);
}
