package com.reclint.core.hierarchy;

import com.reclint.core.config.InvalidRuleException;
import com.reclint.core.config.LintFiles;
import com.reclint.core.config.NoRootFoundException;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleHierarchyResolver}.
 */
class RuleHierarchyResolverTest {

    @TempDir
    Path tmp;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("project")).toRealPath();
        Files.writeString(root.resolve(LintFiles.ROOT_MARKER), "exclude_dirs: [build]\n");
    }

    @Test
    @DisplayName("Should find the root from a nested directory and from a file")
    void shouldFindRoot() throws IOException {
        Path nested = Files.createDirectories(root.resolve("a/b"));
        Path file = Files.writeString(nested.resolve("X.java"), "");

        assertThat(RuleHierarchyResolver.findRoot(nested)).isEqualTo(root);
        assertThat(RuleHierarchyResolver.findRoot(file)).isEqualTo(root);
        assertThat(RuleHierarchyResolver.findRoot(root)).isEqualTo(root);
    }

    @Test
    @DisplayName("Should fail when no ancestor has a root marker")
    void shouldFailWithoutRoot() throws IOException {
        Path outside = Files.createDirectories(tmp.resolve("elsewhere"));

        assertThatThrownBy(() -> RuleHierarchyResolver.findRoot(outside))
                .isInstanceOf(NoRootFoundException.class)
                .hasMessageContaining(LintFiles.ROOT_MARKER);
        assertThatThrownBy(() -> RuleHierarchyResolver.resolveEffectiveRules(outside))
                .isInstanceOf(NoRootFoundException.class);
    }

    @Test
    @DisplayName("Should inherit parent rules additively, root first")
    void shouldInheritAdditively() throws IOException {
        writeDenyRule(root, "root-rule");
        Path child = Files.createDirectories(root.resolve("child"));
        writeDenyRule(child, "child-rule");
        Path grandchild = Files.createDirectories(child.resolve("grand"));

        CollectedRuleSet atRoot = RuleHierarchyResolver.resolveEffectiveRules(root);
        CollectedRuleSet atGrandchild = RuleHierarchyResolver.resolveEffectiveRules(grandchild);

        assertThat(atRoot.rules(Category.DENY)).extracting(s -> s.value().label()).containsExactly("root-rule");
        assertThat(atGrandchild.rules(Category.DENY)).extracting(s -> s.value().label())
                .containsExactly("root-rule", "child-rule");
        assertThat(atGrandchild.rules(Category.DENY)).extracting(Sourced::sourceDir)
                .containsExactly(root, child);
        assertThat(atGrandchild.rootDir()).isEqualTo(root);
        assertThat(atGrandchild.rootConfig().shouldExcludeDir("build")).isTrue();
    }

    @Test
    @DisplayName("Should stop at the root and ignore rule files above it")
    void shouldStopAtRoot() throws IOException {
        writeDenyRule(tmp, "above-root");
        writeDenyRule(root, "root-rule");

        CollectedRuleSet rules = RuleHierarchyResolver.resolveEffectiveRules(root);

        assertThat(rules.enforcedRules()).extracting(Rule::label).containsExactly("root-rule");
    }

    @Test
    @DisplayName("Should order enforced rules required first, then deny")
    void shouldOrderRequiredBeforeDeny() throws IOException {
        Files.writeString(root.resolve(LintFiles.RULE_FILE), String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: d1",
                "    message: m",
                "    keywords: [x]",
                "required:",
                "  - type: custom",
                "    label: r1",
                "    message: m",
                "    exec: \"true\"",
                "review:",
                "  - message: look at this",
                ""));

        CollectedRuleSet rules = RuleHierarchyResolver.resolveEffectiveRules(root);

        assertThat(rules.enforcedRules()).extracting(Rule::label).containsExactly("r1", "d1");
        assertThat(rules.items(Category.REVIEW)).extracting(s -> s.value().message())
                .containsExactly("look at this");
        assertThat(rules.items(Category.GUIDELINE)).isEmpty();
    }

    @Test
    @DisplayName("Should surface invalid rules before any validation")
    void shouldFailOnInvalidRule() throws IOException {
        Files.writeString(root.resolve(LintFiles.RULE_FILE), String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: empty",
                "    message: m",
                "    keywords: []",
                ""));

        assertThatThrownBy(() -> RuleHierarchyResolver.resolveEffectiveRules(root))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("Rule 'empty'");
    }

    @Test
    @DisplayName("Should display paths relative to the root")
    void shouldRelativizeToRoot() {
        CollectedRuleSet rules = RuleHierarchyResolver.resolveEffectiveRules(root);

        assertThat(rules.relativize(root.resolve("src").resolve("A.java")))
                .isEqualTo(Path.of("src", "A.java").toString());
        assertThat(rules.relativize(tmp.resolve("B.java"))).isEqualTo(tmp.resolve("B.java").toString());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void writeDenyRule(Path dir, String label) throws IOException {
        Files.writeString(dir.resolve(LintFiles.RULE_FILE), String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: " + label,
                "    message: " + label + " message",
                "    keywords: [FORBIDDEN]",
                ""));
    }
}
