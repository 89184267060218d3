package com.reclint.core.validation;

/**
 * One problem reported by a {@link Validator}.
 *
 * @param line   1-based line, or {@code 0} for a file-level finding
 * @param column 1-based column; ignored for file-level findings
 * @param found  detail shown next to the violation, e.g. the offending
 *               declaration; {@code null} for none
 * @since 1.0.0
 */
public record Finding(int line, int column, String found) {

    public Finding {
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0, got " + line);
        }
        if (line > 0 && column < 1) {
            throw new IllegalArgumentException("column must be >= 1, got " + column);
        }
    }

    public static Finding fileLevel(String found) {
        return new Finding(0, 0, found);
    }

    public boolean isFileLevel() {
        return line == 0;
    }
}
