package com.reclint.core.validation;

import java.util.Comparator;
import java.util.Objects;

/**
 * One reported rule violation.
 *
 * <p>
 * Line-based violations carry a 1-based line and column. File-level
 * violations (command rules, file-level validator findings) have line and
 * column {@code 0}; command violations may carry the process output.
 * </p>
 *
 * @param file          path relative to the root directory
 * @param line          1-based line, {@code 0} for file-level
 * @param column        1-based column, {@code 0} for file-level
 * @param message       message of the violated rule
 * @param found         detail shown as {@code [ found: ... ]}; may be {@code null}
 * @param processOutput trimmed output of a failed command; may be {@code null}
 * @since 1.0.0
 */
public record Violation(String file, int line, int column, String message, String found, String processOutput) {

    /** Message, file, line, column. */
    public static final Comparator<Violation> BY_RULE = Comparator
            .comparing(Violation::message)
            .thenComparing(Violation::file)
            .thenComparingInt(Violation::line)
            .thenComparingInt(Violation::column);

    /** File, line, column, message. */
    public static final Comparator<Violation> BY_FILE = Comparator
            .comparing(Violation::file)
            .thenComparingInt(Violation::line)
            .thenComparingInt(Violation::column)
            .thenComparing(Violation::message);

    public Violation {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Violation atLine(String file, int line, int column, String message, String found) {
        return new Violation(file, line, column, message, found, null);
    }

    /**
     * Violation of a command rule.
     *
     * @param file    display path
     * @param message rule message
     * @param output  trimmed process output; empty output is not kept
     * @return the violation
     */
    public static Violation command(String file, String message, String output) {
        return new Violation(file, 0, 0, message, null,
                output == null || output.isEmpty() ? null : output);
    }

    public boolean isFileLevel() {
        return line == 0;
    }

    public static Comparator<Violation> comparator(SortMode mode) {
        return mode == SortMode.FILE ? BY_FILE : BY_RULE;
    }
}
