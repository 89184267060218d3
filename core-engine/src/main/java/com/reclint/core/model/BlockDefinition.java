package com.reclint.core.model;

/**
 * Block comment delimiters of a custom comment syntax.
 *
 * @since 1.0.0
 */
public class BlockDefinition {

    private String start;
    private String end;

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }
}
