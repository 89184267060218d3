package com.reclint.core.comment;

/**
 * Start and end marker of a block comment, e.g. {@code /*} and {@code *}{@code /}.
 *
 * @param start opening marker
 * @param end   closing marker
 * @since 1.0.0
 */
public record BlockMarker(String start, String end) {

    public BlockMarker {
        if (start == null || start.isEmpty()) {
            throw new IllegalArgumentException("Block comment start marker must not be empty");
        }
        if (end == null || end.isEmpty()) {
            throw new IllegalArgumentException("Block comment end marker must not be empty");
        }
    }
}
