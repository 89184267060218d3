package com.reclint.core.comment;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits file content into lines.
 *
 * <p>
 * Only {@code \n} ends a line; one trailing {@code \r} is dropped from each
 * line, so CRLF files number like LF files while a lone {@code \r} stays part
 * of its line. A final line terminator does not start an extra empty line.
 * </p>
 *
 * @since 1.0.0
 */
public final class SourceLines {

    private SourceLines() {
        // utility class - not instantiable
    }

    public static List<String> split(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < content.length()) {
            int end = content.indexOf('\n', start);
            if (end < 0) {
                end = content.length();
            }
            String line = content.substring(start, end);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
            start = end + 1;
        }
        return lines;
    }
}
