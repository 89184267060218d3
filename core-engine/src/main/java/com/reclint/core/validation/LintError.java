package com.reclint.core.validation;

import java.util.Objects;

/**
 * A problem that prevented part of a run from being checked. Reported next
 * to the violations.
 *
 * @param scope   what was skipped
 * @param subject directory or file the error concerns
 * @param message cause description
 * @since 1.0.0
 */
public record LintError(Scope scope, String subject, String message) {

    /** Extent of the work lost to an error. */
    public enum Scope {
        /** Every file of a directory was skipped. */
        DIRECTORY,
        /** One file, or one rule on one file, was skipped. */
        FILE
    }

    public LintError {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static LintError directory(String subject, String message) {
        return new LintError(Scope.DIRECTORY, subject, message);
    }

    public static LintError file(String subject, String message) {
        return new LintError(Scope.FILE, subject, message);
    }

    /**
     * Output line: {@code <subject>: <message>}.
     *
     * @return formatted error
     */
    public String format() {
        return subject + ": " + message;
    }
}
