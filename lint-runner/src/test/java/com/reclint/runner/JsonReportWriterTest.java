package com.reclint.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reclint.core.validation.LintError;
import com.reclint.core.validation.SortMode;
import com.reclint.core.validation.ValidationReport;
import com.reclint.core.validation.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportWriterTest {

    private final JsonReportWriter writer = new JsonReportWriter();

    @Test
    @DisplayName("Should write errors and violations as one JSON document")
    void shouldWriteReport() throws Exception {
        ValidationReport report = new ValidationReport(SortMode.FILE,
                List.of(LintError.directory("/r/broken", "Failed to parse")),
                List.of(Violation.atLine("A.java", 2, 5, "No TODO", null),
                        Violation.command("A.java", "Unformatted", "diff")));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        writer.write(report, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        JsonNode json = new ObjectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));

        assertThat(json.get("sort").asText()).isEqualTo("file");
        assertThat(json.get("errors")).hasSize(1);
        assertThat(json.get("errors").get(0).get("scope").asText()).isEqualTo("directory");
        assertThat(json.get("errors").get(0).get("subject").asText()).isEqualTo("/r/broken");

        JsonNode first = json.get("violations").get(0);
        assertThat(first.get("line").asInt()).isEqualTo(2);
        assertThat(first.get("column").asInt()).isEqualTo(5);
        assertThat(first.has("found")).isFalse();
        assertThat(first.has("output")).isFalse();

        JsonNode second = json.get("violations").get(1);
        assertThat(second.get("line").asInt()).isZero();
        assertThat(second.get("output").asText()).isEqualTo("diff");
    }

    @Test
    @DisplayName("Should write empty arrays for an empty report")
    void shouldWriteEmptyReport() {
        JsonNode json = writer.toJson(ValidationReport.empty(SortMode.RULE));

        assertThat(json.get("sort").asText()).isEqualTo("rule");
        assertThat(json.get("errors").isArray()).isTrue();
        assertThat(json.get("errors")).isEmpty();
        assertThat(json.get("violations")).isEmpty();
    }

    @Test
    @DisplayName("Should keep the found detail of a violation")
    void shouldWriteFound() {
        ValidationReport report = new ValidationReport(SortMode.RULE, List.of(),
                List.of(Violation.atLine("A.java", 1, 1, "Docs", "class A")));

        assertThat(writer.toJson(report).get("violations").get(0).get("found").asText()).isEqualTo("class A");
    }
}
