package com.reclint.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reclint.core.validation.LintError;
import com.reclint.core.validation.ValidationReport;
import com.reclint.core.validation.Violation;

import java.io.PrintStream;
import java.util.Locale;

/**
 * JSON report.
 *
 * <pre>
 * {
 *   "sort" : "rule",
 *   "errors" : [ { "scope" : "directory", "subject" : "...", "message" : "..." } ],
 *   "violations" : [ { "file" : "src/A.java", "line" : 3, "column" : 5,
 *                      "message" : "...", "found" : "...", "output" : "..." } ]
 * }
 * </pre>
 *
 * <p>
 * {@code line} and {@code column} are {@code 0} for file-level violations;
 * {@code found} and {@code output} are omitted when absent.
 * </p>
 *
 * @since 1.0.0
 */
class JsonReportWriter implements ReportWriter {

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void write(ValidationReport report, PrintStream out) {
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report)));
            out.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation report: " + e.getMessage(), e);
        }
    }

    ObjectNode toJson(ValidationReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("sort", report.sortMode().configName());

        ArrayNode errors = root.putArray("errors");
        for (LintError error : report.errors()) {
            errors.addObject()
                    .put("scope", error.scope().name().toLowerCase(Locale.ROOT))
                    .put("subject", error.subject())
                    .put("message", error.message());
        }

        ArrayNode violations = root.putArray("violations");
        for (Violation violation : report.violations()) {
            ObjectNode node = violations.addObject()
                    .put("file", violation.file())
                    .put("line", violation.line())
                    .put("column", violation.column())
                    .put("message", violation.message());
            if (violation.found() != null) {
                node.put("found", violation.found());
            }
            if (violation.processOutput() != null) {
                node.put("output", violation.processOutput());
            }
        }
        return root;
    }
}
