package com.reclint.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one validation run: scoped errors and sorted violations.
 *
 * @param sortMode   order the violations are sorted in
 * @param errors     errors in the order they were encountered
 * @param violations violations sorted per {@code sortMode}
 * @since 1.0.0
 */
public record ValidationReport(SortMode sortMode, List<LintError> errors, List<Violation> violations) {

    public ValidationReport {
        Objects.requireNonNull(sortMode, "sortMode must not be null");
        errors = errors != null ? List.copyOf(errors) : List.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static ValidationReport empty(SortMode sortMode) {
        return new ValidationReport(sortMode, List.of(), List.of());
    }

    public boolean hasFindings() {
        return !errors.isEmpty() || !violations.isEmpty();
    }

    /**
     * Report lines: errors first, then violations.
     *
     * @return output lines
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>(errors.size() + violations.size());
        for (LintError error : errors) {
            lines.add(error.format());
        }
        lines.addAll(ViolationFormatter.format(violations, sortMode));
        return lines;
    }

    public String format() {
        return String.join(System.lineSeparator(), lines());
    }
}
