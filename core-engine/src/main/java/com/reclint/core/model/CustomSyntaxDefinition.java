package com.reclint.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code comment.custom}: line markers and block delimiters for languages
 * without a preset.
 *
 * <pre>
 * comment:
 *   custom:
 *     lines: ["#"]
 *     blocks:
 *       - start: "=begin"
 *         end: "=end"
 * </pre>
 *
 * @since 1.0.0
 */
public class CustomSyntaxDefinition {

    private List<String> lines = new ArrayList<>();
    private List<BlockDefinition> blocks = new ArrayList<>();

    public List<String> getLines() {
        return lines;
    }

    public void setLines(List<String> lines) {
        this.lines = lines != null ? new ArrayList<>(lines) : new ArrayList<>();
    }

    public List<BlockDefinition> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<BlockDefinition> blocks) {
        this.blocks = blocks != null ? new ArrayList<>(blocks) : new ArrayList<>();
    }
}
