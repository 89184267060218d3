package com.reclint.core.model;

import com.reclint.core.comment.SourceLanguage;
import com.reclint.core.filter.ExcludeFilterType;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.DocLanguage;
import com.reclint.core.rule.RuleKind;
import com.reclint.core.rule.TestFramework;
import com.reclint.core.rule.TestRequireLevel;
import com.reclint.core.rule.Visibility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Describes a single rule entry as read from a rule file.
 *
 * <p>
 * The {@code type} field selects the rule variant and decides which other
 * fields are required or forbidden:
 * </p>
 * <ul>
 * <li>{@code forbidden_texts}, {@code forbidden_patterns}: {@code keywords}</li>
 * <li>{@code custom}: {@code exec}</li>
 * <li>{@code require_*_doc}: {@code doc}</li>
 * <li>{@code require_*_comment}: {@code comment}</li>
 * <li>{@code require_*_test}: {@code test}</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate(Category)} after deserialization; conversion to a
 * typed rule assumes a valid definition.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String type;
    private String label;
    private String message;

    private List<MatchDefinition> match = new ArrayList<>();
    private List<String> includeExts = new ArrayList<>();
    private List<String> excludeExts = new ArrayList<>();
    private List<ExcludeDefinition> excludeFiles = new ArrayList<>();

    // --- forbidden_texts / forbidden_patterns ---
    private List<String> keywords;

    // --- custom ---
    private String exec;

    // --- require_*_doc ---
    private Map<String, String> doc;

    // --- require_*_comment ---
    private CommentDefinition comment;

    // --- require_*_test ---
    private TestDefinition test;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared type are present,
     * that no forbidden field is set and that the type may be declared under
     * the given section.
     *
     * @param category section the entry was declared under
     * @throws IllegalStateException if validation fails
     */
    public void validate(Category category) {
        Objects.requireNonNull(category, "Category must not be null");
        List<String> errors = new ArrayList<>();
        String owner = "Rule '" + (label != null ? label : "<unlabeled>") + "'";

        if (label == null || label.isBlank()) {
            errors.add("Rule 'label' is required");
        }
        if (message == null || message.isBlank()) {
            errors.add(owner + " requires 'message'");
        }
        MatchDefinition.validateAll(owner, match, errors);
        ItemDefinition.validateExtensions(owner, "include_exts", includeExts, errors);
        ItemDefinition.validateExtensions(owner, "exclude_exts", excludeExts, errors);
        validateExcludeFiles(owner, errors);

        Optional<RuleKind> kind = RuleKind.fromConfigName(type);
        if (type == null || type.isBlank()) {
            errors.add(owner + " requires 'type'");
        } else if (kind.isEmpty()) {
            errors.add(owner + ": unknown rule type '" + type + "'");
        } else if (!kind.get().isAllowedIn(category)) {
            errors.add(owner + ": type '" + type + "' is not allowed under '" + category.configKey() + "'");
        } else {
            validateKind(kind.get(), owner, errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    private void validateKind(RuleKind kind, String owner, List<String> errors) {
        switch (kind) {
            case FORBIDDEN_TEXTS -> {
                requireKeywords(owner, errors);
                forbid(exec != null, owner, "exec", errors);
            }
            case FORBIDDEN_PATTERNS -> {
                requireKeywords(owner, errors);
                forbid(exec != null, owner, "exec", errors);
                if (keywords != null) {
                    for (String keyword : keywords) {
                        try {
                            Pattern.compile(keyword);
                        } catch (PatternSyntaxException e) {
                            errors.add(owner + ": invalid pattern '" + keyword + "': " + e.getDescription());
                        }
                    }
                }
            }
            case CUSTOM -> {
                if (exec == null || exec.isBlank()) {
                    errors.add(owner + " requires 'exec'");
                }
                forbid(keywords != null, owner, "keywords", errors);
            }
            case REQUIRE_JAVA_DOC, REQUIRE_KOTLIN_DOC, REQUIRE_RUST_DOC, REQUIRE_PHP_DOC -> {
                forbidKeywordsAndExec(owner, errors);
                validateDoc(DocLanguage.forRuleKind(kind).orElseThrow(), owner, errors);
            }
            case REQUIRE_JAPANESE_COMMENT, REQUIRE_ENGLISH_COMMENT -> {
                forbidKeywordsAndExec(owner, errors);
                validateComment(owner, errors);
            }
            case REQUIRE_JAPANESE_PHPUNIT_TEST_NAME, REQUIRE_JAPANESE_KOTEST_TEST_NAME,
                    REQUIRE_JAPANESE_RUST_TEST_NAME -> forbidKeywordsAndExec(owner, errors);
            case REQUIRE_PHPUNIT_TEST, REQUIRE_KOTEST_TEST, REQUIRE_RUST_UNIT_TEST -> {
                forbidKeywordsAndExec(owner, errors);
                validateTest(TestFramework.forTestExistenceKind(kind).orElseThrow(), owner, errors);
            }
        }
    }

    private void requireKeywords(String owner, List<String> errors) {
        if (keywords == null || keywords.isEmpty()) {
            errors.add(owner + " requires non-empty 'keywords'");
        } else if (keywords.stream().anyMatch(k -> k == null || k.isEmpty())) {
            errors.add(owner + ": 'keywords' must not contain empty entries");
        }
    }

    private void forbidKeywordsAndExec(String owner, List<String> errors) {
        forbid(keywords != null, owner, "keywords", errors);
        forbid(exec != null, owner, "exec", errors);
    }

    private void forbid(boolean present, String owner, String field, List<String> errors) {
        if (present) {
            errors.add(owner + ": '" + field + "' is not allowed for type '" + type + "'");
        }
    }

    private void validateExcludeFiles(String owner, List<String> errors) {
        for (ExcludeDefinition entry : excludeFiles) {
            if (entry == null) {
                errors.add(owner + ": empty 'exclude_files' entry");
                continue;
            }
            if (ExcludeFilterType.fromConfigName(entry.getFilter()).isEmpty()) {
                errors.add(owner + ": unknown exclude filter '" + entry.getFilter() + "'");
            }
            if (entry.getKeyword() == null) {
                errors.add(owner + ": 'exclude_files' entry requires 'keyword'");
            }
        }
    }

    private void validateDoc(DocLanguage language, String owner, List<String> errors) {
        if (doc == null || doc.isEmpty()) {
            errors.add(owner + " requires 'doc' with at least one element");
            return;
        }
        doc.forEach((element, visibility) -> {
            if (!language.elements().contains(element)) {
                errors.add(owner + ": unknown doc element '" + element + "'");
            }
            if (Visibility.fromConfigName(visibility).isEmpty()) {
                errors.add(owner + ": doc element '" + element + "' must be 'public' or 'all'");
            }
        });
    }

    private void validateComment(String owner, List<String> errors) {
        if (comment == null) {
            errors.add(owner + " requires 'comment'");
            return;
        }
        boolean hasLang = comment.getLang() != null;
        boolean hasCustom = comment.getCustom() != null;
        if (hasLang == hasCustom) {
            errors.add(owner + ": 'comment' requires exactly one of 'lang' and 'custom'");
            return;
        }
        if (hasLang) {
            if (SourceLanguage.fromConfigName(comment.getLang()).isEmpty()) {
                errors.add(owner + ": unknown comment language '" + comment.getLang() + "'");
            }
            return;
        }
        CustomSyntaxDefinition custom = comment.getCustom();
        if (custom.getLines().isEmpty() && custom.getBlocks().isEmpty()) {
            errors.add(owner + ": custom comment syntax requires 'lines' or 'blocks'");
        }
        if (custom.getLines().stream().anyMatch(m -> m == null || m.isEmpty())) {
            errors.add(owner + ": custom line markers must not be empty");
        }
        for (BlockDefinition block : custom.getBlocks()) {
            if (block == null || block.getStart() == null || block.getStart().isEmpty()
                    || block.getEnd() == null || block.getEnd().isEmpty()) {
                errors.add(owner + ": custom block markers require non-empty 'start' and 'end'");
            }
        }
    }

    private void validateTest(TestFramework framework, String owner, List<String> errors) {
        if (test == null) {
            if (framework.hasSeparateTestFile()) {
                errors.add(owner + " requires 'test' with 'test_directory'");
            }
            return;
        }
        if (framework.hasSeparateTestFile()
                && (test.getTestDirectory() == null || test.getTestDirectory().isBlank())) {
            errors.add(owner + " requires 'test.test_directory'");
        }
        if (test.getRequire() != null && TestRequireLevel.fromConfigName(test.getRequire()).isEmpty()) {
            errors.add(owner + ": 'test.require' must be 'exists' or 'all_public'");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<MatchDefinition> getMatch() {
        return match;
    }

    public void setMatch(List<MatchDefinition> match) {
        this.match = match != null ? new ArrayList<>(match) : new ArrayList<>();
    }

    public List<String> getIncludeExts() {
        return includeExts;
    }

    public void setIncludeExts(List<String> includeExts) {
        this.includeExts = includeExts != null ? new ArrayList<>(includeExts) : new ArrayList<>();
    }

    public List<String> getExcludeExts() {
        return excludeExts;
    }

    public void setExcludeExts(List<String> excludeExts) {
        this.excludeExts = excludeExts != null ? new ArrayList<>(excludeExts) : new ArrayList<>();
    }

    public List<ExcludeDefinition> getExcludeFiles() {
        return excludeFiles;
    }

    public void setExcludeFiles(List<ExcludeDefinition> excludeFiles) {
        this.excludeFiles = excludeFiles != null ? new ArrayList<>(excludeFiles) : new ArrayList<>();
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? new ArrayList<>(keywords) : null;
    }

    public String getExec() {
        return exec;
    }

    public void setExec(String exec) {
        this.exec = exec;
    }

    public Map<String, String> getDoc() {
        return doc;
    }

    public void setDoc(Map<String, String> doc) {
        this.doc = doc != null ? new LinkedHashMap<>(doc) : null;
    }

    public CommentDefinition getComment() {
        return comment;
    }

    public void setComment(CommentDefinition comment) {
        this.comment = comment;
    }

    public TestDefinition getTest() {
        return test;
    }

    public void setTest(TestDefinition test) {
        this.test = test;
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "type='" + type + '\'' +
                ", label='" + label + '\'' +
                ", message='" + message + '\'' +
                ", keywords=" + keywords +
                ", exec='" + exec + '\'' +
                '}';
    }
}
