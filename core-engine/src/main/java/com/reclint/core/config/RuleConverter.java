package com.reclint.core.config;

import com.reclint.core.comment.BlockMarker;
import com.reclint.core.comment.CommentSource;
import com.reclint.core.comment.CommentSyntax;
import com.reclint.core.comment.SourceLanguage;
import com.reclint.core.filter.ExcludeFilter;
import com.reclint.core.filter.ExcludeFilterType;
import com.reclint.core.filter.ExtFilter;
import com.reclint.core.matcher.FileMatcher;
import com.reclint.core.matcher.MatchCondition;
import com.reclint.core.matcher.MatchItem;
import com.reclint.core.matcher.MatchPattern;
import com.reclint.core.model.CommentDefinition;
import com.reclint.core.model.CustomSyntaxDefinition;
import com.reclint.core.model.ExcludeDefinition;
import com.reclint.core.model.ItemDefinition;
import com.reclint.core.model.MatchDefinition;
import com.reclint.core.model.RuleDefinition;
import com.reclint.core.model.TestDefinition;
import com.reclint.core.rule.AuxiliaryItem;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.CommandRule;
import com.reclint.core.rule.CommentLanguageRule;
import com.reclint.core.rule.CommentScript;
import com.reclint.core.rule.DocLanguage;
import com.reclint.core.rule.DocRequiredRule;
import com.reclint.core.rule.RegexRule;
import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleHeader;
import com.reclint.core.rule.RuleKind;
import com.reclint.core.rule.RuleSet;
import com.reclint.core.rule.TestExistenceRule;
import com.reclint.core.rule.TestFramework;
import com.reclint.core.rule.TestNameRule;
import com.reclint.core.rule.TestRequireLevel;
import com.reclint.core.rule.TextRule;
import com.reclint.core.rule.Visibility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts validated rule file definitions into the typed rule model.
 *
 * <p>
 * This is the single point of extension when adding a rule type: add the
 * constant to {@link RuleKind}, its checks to {@link RuleDefinition} and its
 * construction here.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConverter {

    private RuleConverter() {
        // utility class - not instantiable
    }

    /**
     * Validate and convert a whole rule file.
     *
     * @param config parsed rule file; must not be {@code null}
     * @param source file name or resource used in error messages
     * @return converted rules and items in declaration order
     * @throws InvalidRuleException if any entry is invalid
     */
    public static RuleSet convert(RuleFileConfig config, String source) {
        Objects.requireNonNull(config, "Rule file config must not be null");
        config.validate(source);

        return new RuleSet(
                convertRules(config.getRequired(), Category.REQUIRED),
                convertRules(config.getDeny(), Category.DENY),
                convertItems(config.getReview(), Category.REVIEW),
                convertItems(config.getGuideline(), Category.GUIDELINE));
    }

    /**
     * Convert one validated rule definition.
     *
     * @param definition definition that passed {@link RuleDefinition#validate(Category)}
     * @param category   section it was declared under
     * @return the typed rule
     * @throws IllegalArgumentException if the definition was not validated
     */
    public static Rule convert(RuleDefinition definition, Category category) {
        Objects.requireNonNull(definition, "Rule definition must not be null");
        RuleKind kind = RuleKind.fromConfigName(definition.getType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule type: '" + definition.getType() + "'"));
        RuleHeader header = new RuleHeader(
                definition.getLabel(),
                definition.getMessage(),
                category,
                toMatcher(definition.getMatch()),
                toExcludeFilter(definition.getExcludeFiles()),
                new ExtFilter(definition.getIncludeExts(), definition.getExcludeExts()));

        return switch (kind) {
            case FORBIDDEN_TEXTS -> new TextRule(header, definition.getKeywords());
            case FORBIDDEN_PATTERNS -> new RegexRule(header,
                    definition.getKeywords().stream().map(Pattern::compile).toList());
            case CUSTOM -> new CommandRule(header, definition.getExec());
            case REQUIRE_JAVA_DOC, REQUIRE_KOTLIN_DOC, REQUIRE_RUST_DOC, REQUIRE_PHP_DOC -> new DocRequiredRule(
                    header, DocLanguage.forRuleKind(kind).orElseThrow(), toVisibilities(definition.getDoc()));
            case REQUIRE_JAPANESE_COMMENT, REQUIRE_ENGLISH_COMMENT -> new CommentLanguageRule(
                    header, CommentScript.forRuleKind(kind).orElseThrow(), toCommentSource(definition.getComment()));
            case REQUIRE_JAPANESE_PHPUNIT_TEST_NAME, REQUIRE_JAPANESE_KOTEST_TEST_NAME,
                    REQUIRE_JAPANESE_RUST_TEST_NAME -> new TestNameRule(
                            header, TestFramework.forTestNameKind(kind).orElseThrow());
            case REQUIRE_PHPUNIT_TEST, REQUIRE_KOTEST_TEST, REQUIRE_RUST_UNIT_TEST -> toTestExistence(
                    header, TestFramework.forTestExistenceKind(kind).orElseThrow(), definition.getTest());
        };
    }

    /**
     * Build a matcher from {@code match} entries.
     *
     * @param entries entries; {@code null} or empty matches every file
     * @return the matcher
     */
    public static FileMatcher toMatcher(List<MatchDefinition> entries) {
        if (entries == null || entries.isEmpty()) {
            return FileMatcher.always();
        }
        List<MatchItem> items = new ArrayList<>(entries.size());
        for (MatchDefinition entry : entries) {
            MatchPattern pattern = MatchPattern.fromConfigName(entry.getPattern())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown match pattern: '" + entry.getPattern() + "'"));
            MatchCondition condition = entry.getCond() == null
                    ? MatchCondition.OR
                    : MatchCondition.fromConfigName(entry.getCond())
                            .orElseThrow(() -> new IllegalArgumentException("Unknown match condition: '" + entry.getCond() + "'"));
            items.add(new MatchItem(pattern, entry.getKeywords(), condition));
        }
        return FileMatcher.of(items);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<Rule> convertRules(List<RuleDefinition> definitions, Category category) {
        return definitions.stream().map(d -> convert(d, category)).toList();
    }

    private static List<AuxiliaryItem> convertItems(List<ItemDefinition> definitions, Category category) {
        return definitions.stream()
                .map(d -> new AuxiliaryItem(category, d.getMessage(), toMatcher(d.getMatch()),
                        new ExtFilter(d.getIncludeExts(), d.getExcludeExts())))
                .toList();
    }

    private static ExcludeFilter toExcludeFilter(List<ExcludeDefinition> entries) {
        if (entries == null || entries.isEmpty()) {
            return ExcludeFilter.none();
        }
        return ExcludeFilter.of(entries.stream()
                .map(e -> new ExcludeFilter.Entry(
                        ExcludeFilterType.fromConfigName(e.getFilter()).orElseThrow(), e.getKeyword()))
                .toList());
    }

    private static Map<String, Visibility> toVisibilities(Map<String, String> doc) {
        Map<String, Visibility> elements = new LinkedHashMap<>();
        doc.forEach((element, visibility) ->
                elements.put(element, Visibility.fromConfigName(visibility).orElseThrow()));
        return elements;
    }

    private static CommentSource toCommentSource(CommentDefinition comment) {
        if (comment.getLang() != null) {
            return SourceLanguage.fromConfigName(comment.getLang()).orElseThrow();
        }
        CustomSyntaxDefinition custom = comment.getCustom();
        List<BlockMarker> blocks = custom.getBlocks().stream()
                .map(b -> new BlockMarker(b.getStart(), b.getEnd()))
                .toList();
        return new CommentSyntax(custom.getLines(), blocks);
    }

    private static TestExistenceRule toTestExistence(RuleHeader header, TestFramework framework,
            TestDefinition test) {
        if (test == null) {
            return new TestExistenceRule(header, framework, null, TestRequireLevel.EXISTS, null);
        }
        TestRequireLevel level = test.getRequire() == null
                ? TestRequireLevel.EXISTS
                : TestRequireLevel.fromConfigName(test.getRequire()).orElseThrow();
        return new TestExistenceRule(header, framework, test.getTestDirectory(), level, test.getTestFileSuffix());
    }
}
