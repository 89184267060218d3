package com.reclint.core.comment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generic, purely lexical comment extractor driven by a {@link CommentSyntax}.
 *
 * <h3>Algorithm</h3>
 * <p>
 * A single forward pass over the lines of the content. The only state is
 * whether the scan is inside a block comment, and which end marker closes it.
 * </p>
 * <ul>
 * <li>Outside a block, the earliest line or block-start marker wins. A line
 * marker emits the trimmed rest of the line. A block start closed on the same
 * line emits the enclosed text and scanning continues after the end marker;
 * an unclosed block start emits its non-empty trailing text and enters the
 * block state.</li>
 * <li>Inside a block, a line containing the end marker emits the non-empty
 * text before it and scanning resumes after the marker; any other line is
 * emitted whole, trimmed.</li>
 * </ul>
 * <p>
 * A two-character line marker directly preceded by {@code :} is ignored so
 * that {@code http://} is not a comment. String literals are not recognised:
 * comment markers inside strings are extracted like any other.
 * </p>
 *
 * @since 1.0.0
 */
public final class CommentTokenizer {

    private CommentTokenizer() {
        // utility class - not instantiable
    }

    /**
     * Extract all comments.
     *
     * @param content source text; must not be {@code null}
     * @param syntax  syntax descriptor; must not be {@code null}
     * @return comments in source order
     */
    public static List<Comment> tokenize(String content, CommentSyntax syntax) {
        Objects.requireNonNull(content, "Content must not be null");
        Objects.requireNonNull(syntax, "Comment syntax must not be null");

        List<Comment> comments = new ArrayList<>();
        String activeEnd = null;
        int lineNumber = 0;

        for (String line : SourceLines.split(content)) {
            String remaining = line;
            lineNumber++;

            if (activeEnd != null) {
                int end = remaining.indexOf(activeEnd);
                if (end < 0) {
                    comments.add(new Comment(lineNumber, remaining.trim()));
                    continue;
                }
                String before = remaining.substring(0, end).trim();
                if (!before.isEmpty()) {
                    comments.add(new Comment(lineNumber, before));
                }
                remaining = remaining.substring(end + activeEnd.length());
                activeEnd = null;
            }

            activeEnd = scanOutsideBlock(remaining, lineNumber, syntax, comments);
        }
        return comments;
    }

    /**
     * Scan text that is not inside a block comment.
     *
     * @return the end marker of a block left open at the end of the line, or
     *         {@code null}
     */
    private static String scanOutsideBlock(String text, int lineNumber, CommentSyntax syntax, List<Comment> out) {
        String remaining = text;
        while (true) {
            MarkerHit hit = findEarliestMarker(remaining, syntax);
            if (hit == null) {
                return null;
            }
            if (hit.block() == null) {
                out.add(new Comment(lineNumber, remaining.substring(hit.position() + hit.markerLength()).trim()));
                return null;
            }

            BlockMarker block = hit.block();
            String after = remaining.substring(hit.position() + block.start().length());
            int end = after.indexOf(block.end());
            if (end < 0) {
                String trailing = after.trim();
                if (!trailing.isEmpty()) {
                    out.add(new Comment(lineNumber, trailing));
                }
                return block.end();
            }
            out.add(new Comment(lineNumber, after.substring(0, end).trim()));
            remaining = after.substring(end + block.end().length());
        }
    }

    private static MarkerHit findEarliestMarker(String text, CommentSyntax syntax) {
        MarkerHit best = null;
        for (String marker : syntax.lineMarkers()) {
            int position = indexOfLineMarker(text, marker);
            if (position >= 0 && (best == null || position < best.position())) {
                best = new MarkerHit(position, marker.length(), null);
            }
        }
        for (BlockMarker block : syntax.blockMarkers()) {
            int position = text.indexOf(block.start());
            if (position >= 0 && (best == null || position < best.position())) {
                best = new MarkerHit(position, block.start().length(), block);
            }
        }
        return best;
    }

    private static int indexOfLineMarker(String text, String marker) {
        int from = 0;
        while (true) {
            int position = text.indexOf(marker, from);
            if (position < 0) {
                return -1;
            }
            if (marker.length() == 2 && position > 0 && text.charAt(position - 1) == ':') {
                from = position + 1;
                continue;
            }
            return position;
        }
    }

    /** Position of a marker; {@code block} is {@code null} for line markers. */
    private record MarkerHit(int position, int markerLength, BlockMarker block) {
    }
}
