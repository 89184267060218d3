package com.reclint.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reclint.core.config.NoRootFoundException;
import com.reclint.core.validation.SortMode;
import com.reclint.core.validation.ValidationReport;
import com.reclint.core.validation.ValidatorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link RecLintRunner} on a temporary project.
 */
class RecLintRunnerTest {

    @TempDir
    Path tmp;

    private Path root;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("project")).toRealPath();
        Files.writeString(root.resolve(".rec_lint_config.yaml"), "include_extensions: [java]\n");
        Files.writeString(root.resolve(".rec_lint.yaml"), String.join("\n",
                "deny:",
                "  - type: forbidden_texts",
                "    label: no-todo",
                "    message: Resolve TODOs",
                "    keywords: [TODO]",
                ""));
        Files.writeString(root.resolve("A.java"), "class A {} // TODO\n");
        Files.writeString(root.resolve("notes.txt"), "TODO\n");
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should print text violations for the configured paths")
    void shouldPrintTextReport() {
        RunConfig config = new RunConfig.Builder().paths(List.of(root)).build();

        ValidationReport report = RecLintRunner.run(config, ValidatorRegistry.withBuiltins(), out);

        assertThat(report.violations()).hasSize(1);
        assertThat(output()).isEqualTo("Resolve TODOs: A.java:1:15" + System.lineSeparator());
    }

    @Test
    @DisplayName("Should print the file-first layout when sorting by file")
    void shouldPrintFileMode() {
        RunConfig config = new RunConfig.Builder().paths(List.of(root)).sortMode(SortMode.FILE).build();

        RecLintRunner.run(config, ValidatorRegistry.withBuiltins(), out);

        assertThat(output().trim()).isEqualTo("A.java:1:15: Resolve TODOs");
    }

    @Test
    @DisplayName("Should print a JSON report when requested")
    void shouldPrintJsonReport() throws IOException {
        RunConfig config = new RunConfig.Builder().paths(List.of(root)).outputFormat(OutputFormat.JSON).build();

        RecLintRunner.run(config, ValidatorRegistry.withBuiltins(), out);

        JsonNode json = new ObjectMapper().readTree(output());
        assertThat(json.get("violations")).hasSize(1);
        assertThat(json.get("violations").get(0).get("file").asText()).isEqualTo("A.java");
    }

    @Test
    @DisplayName("Should print nothing for a clean tree")
    void shouldPrintNothingWhenClean() throws IOException {
        Files.writeString(root.resolve("A.java"), "class A {}\n");
        RunConfig config = new RunConfig.Builder().paths(List.of(root)).build();

        ValidationReport report = RecLintRunner.run(config, ValidatorRegistry.withBuiltins(), out);

        assertThat(report.hasFindings()).isFalse();
        assertThat(output()).isEmpty();
    }

    @Test
    @DisplayName("Should fail when the paths are outside any rec-lint root")
    void shouldFailWithoutRoot() throws IOException {
        Path outside = Files.createDirectories(tmp.resolve("outside"));
        Files.writeString(outside.resolve("B.java"), "// TODO\n");
        RunConfig config = new RunConfig.Builder().paths(List.of(outside)).build();

        assertThatThrownBy(() -> RecLintRunner.run(config, ValidatorRegistry.withBuiltins(), out))
                .isInstanceOf(NoRootFoundException.class);
        assertThat(output()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
