package com.reclint.core.comment;

import java.util.List;

/**
 * Syntax descriptor driving the {@link CommentTokenizer}.
 *
 * <p>
 * Declaration order matters: when two markers start at the same column, line
 * markers win over block markers, and earlier entries win over later ones.
 * </p>
 *
 * @param lineMarkers  markers starting a comment that runs to the end of the line
 * @param blockMarkers start/end pairs of block comments
 * @since 1.0.0
 */
public record CommentSyntax(List<String> lineMarkers, List<BlockMarker> blockMarkers) implements CommentSource {

    public CommentSyntax {
        lineMarkers = lineMarkers != null ? List.copyOf(lineMarkers) : List.of();
        blockMarkers = blockMarkers != null ? List.copyOf(blockMarkers) : List.of();
        for (String marker : lineMarkers) {
            if (marker.isEmpty()) {
                throw new IllegalArgumentException("Line comment marker must not be empty");
            }
        }
    }

    /**
     * C-family syntax: {@code //} line comments and {@code /* ... *}{@code /} blocks.
     *
     * @return the syntax descriptor
     */
    public static CommentSyntax cStyle() {
        return new CommentSyntax(List.of("//"), List.of(new BlockMarker("/*", "*/")));
    }

    @Override
    public List<Comment> extractComments(String content) {
        return CommentTokenizer.tokenize(content, this);
    }
}
