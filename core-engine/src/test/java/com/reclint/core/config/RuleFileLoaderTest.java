package com.reclint.core.config;

import com.reclint.core.comment.CommentSyntax;
import com.reclint.core.comment.SourceLanguage;
import com.reclint.core.rule.AuxiliaryItem;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.CommandRule;
import com.reclint.core.rule.CommentLanguageRule;
import com.reclint.core.rule.CommentScript;
import com.reclint.core.rule.DocLanguage;
import com.reclint.core.rule.DocRequiredRule;
import com.reclint.core.rule.RegexRule;
import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleKind;
import com.reclint.core.rule.RuleSet;
import com.reclint.core.rule.TestExistenceRule;
import com.reclint.core.rule.TestRequireLevel;
import com.reclint.core.rule.TextRule;
import com.reclint.core.rule.Visibility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleFileLoader}.
 */
class RuleFileLoaderTest {

    @Test
    @DisplayName("Should load every rule type from classpath in declaration order")
    void shouldLoadFromClasspath() {
        RuleSet rules = RuleFileLoader.fromClasspath("rules/valid.yaml");

        assertThat(rules.required()).extracting(Rule::label).containsExactly(
                "english-comments", "ruby-comments", "javadoc", "rust-test-names",
                "php-tests", "rust-tests", "formatter");
        assertThat(rules.deny()).extracting(Rule::kind)
                .containsExactly(RuleKind.FORBIDDEN_TEXTS, RuleKind.FORBIDDEN_PATTERNS);
        assertThat(rules.review()).extracting(AuxiliaryItem::message)
                .containsExactly("Check thread safety of shared caches");
        assertThat(rules.guideline()).hasSize(1);
    }

    @Test
    @DisplayName("Should convert rule-specific fields")
    void shouldConvertRuleFields() {
        RuleSet rules = RuleFileLoader.fromClasspath("rules/valid.yaml");

        CommentLanguageRule english = (CommentLanguageRule) rules.required().get(0);
        assertThat(english.script()).isEqualTo(CommentScript.ENGLISH);
        assertThat(english.source()).isEqualTo(SourceLanguage.JAVA);

        CommentLanguageRule ruby = (CommentLanguageRule) rules.required().get(1);
        assertThat(ruby.source()).isInstanceOf(CommentSyntax.class);
        assertThat(((CommentSyntax) ruby.source()).lineMarkers()).containsExactly("#");

        DocRequiredRule javadoc = (DocRequiredRule) rules.required().get(2);
        assertThat(javadoc.language()).isEqualTo(DocLanguage.JAVA);
        assertThat(javadoc.elements()).isEqualTo(Map.of("class", Visibility.PUBLIC, "method", Visibility.ALL));

        TestExistenceRule phpTests = (TestExistenceRule) rules.required().get(4);
        assertThat(phpTests.testDirectory()).isEqualTo("tests");
        assertThat(phpTests.requireLevel()).isEqualTo(TestRequireLevel.ALL_PUBLIC);
        assertThat(phpTests.testFileSuffix()).isEqualTo("Test");

        assertThat(((CommandRule) rules.required().get(6)).exec()).isEqualTo("fmt-check {file}");

        TextRule noTodo = (TextRule) rules.deny().get(0);
        assertThat(noTodo.keywords()).containsExactly("TODO", "FIXME");
        assertThat(noTodo.category()).isEqualTo(Category.DENY);
        assertThat(noTodo.appliesTo(Path.of("/r/src/GeneratedFoo.java"))).isFalse();
        assertThat(noTodo.appliesTo(Path.of("/r/README.md"))).isFalse();
        assertThat(noTodo.appliesTo(Path.of("/r/src/Foo.java"))).isTrue();

        RegexRule noPrintln = (RegexRule) rules.deny().get(1);
        assertThat(noPrintln.keywords()).containsExactly("System\\.(out|err)\\.print");
        assertThat(noPrintln.appliesTo(Path.of("/r/src/main/A.java"))).isTrue();
        assertThat(noPrintln.appliesTo(Path.of("/r/src/test/A.java"))).isFalse();
    }

    @Test
    @DisplayName("Should report every invalid entry of a file with its label")
    void shouldCollectAllRuleErrors() {
        assertThatThrownBy(() -> RuleFileLoader.fromClasspath("rules/invalid.yaml"))
                .isInstanceOf(InvalidRuleException.class)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Rule 'wrong-section'")
                .hasMessageContaining("not allowed under 'required'")
                .hasMessageContaining("Rule 'bad-doc': unknown doc element 'method'")
                .hasMessageContaining("Rule 'bad-regex': invalid pattern")
                .hasMessageContaining("Rule 'both-fields': 'keywords' is not allowed")
                .hasMessageContaining("Rule 'mystery': unknown rule type 'no_such_type'")
                .hasMessageContaining("review[0]: 'message' is required");
    }

    @Test
    @DisplayName("Should treat malformed YAML as a parse error")
    void shouldFailOnMalformedYaml() {
        assertThatThrownBy(() -> RuleFileLoader.fromClasspath("rules/malformed.yaml"))
                .isInstanceOf(RuleFileParseException.class)
                .hasMessageContaining("malformed.yaml");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> RuleFileLoader.fromClasspath("rules/duplicate-keys.yaml"))
                .isInstanceOf(RuleFileParseException.class);
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> RuleFileLoader.fromClasspath("rules/unknown-key.yaml"))
                .isInstanceOf(RuleFileParseException.class)
                .hasMessageContaining("keyword");
    }

    @Test
    @DisplayName("Should load an empty rule set from a comment-only file")
    void shouldLoadEmptyFile() {
        assertThat(RuleFileLoader.fromClasspath("rules/empty.yaml").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RuleFileLoader.fromClasspath("does-not-exist.yaml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load a rule file from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(LintFiles.RULE_FILE);
        Files.writeString(file, String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: no-debug",
                "    message: Remove debug output",
                "    keywords: [DEBUG]",
                ""));

        RuleSet rules = RuleFileLoader.fromFile(file);

        assertThat(rules.deny()).singleElement().extracting(Rule::label).isEqualTo("no-debug");
    }

    @Test
    @DisplayName("Should reject an empty match keyword with the rule label")
    void shouldRejectNullMatchKeyword(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(LintFiles.RULE_FILE);
        Files.writeString(file, String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: scoped",
                "    message: Scoped rule",
                "    keywords: [x]",
                "    match:",
                "      - pattern: path_contains",
                "        keywords: [src, ~]",
                ""));

        assertThatThrownBy(() -> RuleFileLoader.fromFile(file))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Rule 'scoped': match entry 0 has an empty keyword");
    }

    @Test
    @DisplayName("Should reject empty extension entries in rules and items")
    void shouldRejectNullExtensions(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(LintFiles.RULE_FILE);
        Files.writeString(file, String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: java-only",
                "    message: Java only",
                "    keywords: [x]",
                "    include_exts: [.java, ~]",
                "guideline:",
                "  - message: Keep it short",
                "    exclude_exts: [~]",
                ""));

        assertThatThrownBy(() -> RuleFileLoader.fromFile(file))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Rule 'java-only': 'include_exts' must not contain empty entries")
                .hasMessageContaining("guideline[0]: 'exclude_exts' must not contain empty entries");
    }

    @Test
    @DisplayName("Should wrap read failures in a parse error naming the file")
    void shouldWrapReadFailures(@TempDir Path dir) {
        Path missing = dir.resolve("missing.yaml");

        assertThatThrownBy(() -> RuleFileLoader.fromFile(missing))
                .isInstanceOf(RuleFileParseException.class)
                .hasMessageContaining("missing.yaml")
                .satisfies(e -> assertThat(((RuleFileParseException) e).getFile()).isEqualTo(missing));
    }
}
