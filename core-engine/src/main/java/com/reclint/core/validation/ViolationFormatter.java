package com.reclint.core.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders violations as output lines.
 *
 * <pre>
 * rule mode:  message: file:line:col [ found: X ]     message: file
 * file mode:  file:line:col: message [ found: X ]     file: message
 * </pre>
 *
 * <p>
 * The output of a failed command, when present, follows on its own line.
 * </p>
 *
 * @since 1.0.0
 */
public final class ViolationFormatter {

    private ViolationFormatter() {
        // utility class - not instantiable
    }

    /**
     * Format violations in the given order.
     *
     * @param violations violations, already sorted
     * @param mode       layout
     * @return output lines
     */
    public static List<String> format(List<Violation> violations, SortMode mode) {
        List<String> lines = new ArrayList<>(violations.size());
        for (Violation violation : violations) {
            lines.add(formatLine(violation, mode));
            if (violation.processOutput() != null) {
                lines.add(violation.processOutput());
            }
        }
        return lines;
    }

    public static String formatLine(Violation v, SortMode mode) {
        String found = v.found() != null ? " [ found: " + v.found() + " ]" : "";
        if (mode == SortMode.FILE) {
            if (v.isFileLevel()) {
                return v.file() + ": " + v.message() + found;
            }
            return v.file() + ":" + v.line() + ":" + v.column() + ": " + v.message() + found;
        }
        if (v.isFileLevel()) {
            return v.message() + ": " + v.file() + found;
        }
        return v.message() + ": " + v.file() + ":" + v.line() + ":" + v.column() + found;
    }
}
