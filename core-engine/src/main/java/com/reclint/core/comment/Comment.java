package com.reclint.core.comment;

import java.util.Objects;

/**
 * One extracted comment span.
 *
 * @param line 1-based line number
 * @param text trimmed comment text without markers
 * @since 1.0.0
 */
public record Comment(int line, String text) {

    public Comment {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got: " + line);
        }
        Objects.requireNonNull(text, "text must not be null");
    }
}
