package com.reclint.core.validation;

import com.reclint.core.comment.SourceLines;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-by-line search used by {@code forbidden_texts} and
 * {@code forbidden_patterns}.
 *
 * <p>
 * At most one finding per line: keywords are tried in declaration order and
 * the first one that occurs wins, even if a later keyword occurs further
 * left. Columns are 1-based and count code points.
 * </p>
 *
 * @since 1.0.0
 */
final class LineScanner {

    private LineScanner() {
        // utility class - not instantiable
    }

    static List<Finding> scanTexts(String content, List<String> keywords) {
        List<Finding> findings = new ArrayList<>();
        int lineNumber = 0;
        for (String line : SourceLines.split(content)) {
            lineNumber++;
            for (String keyword : keywords) {
                int index = line.indexOf(keyword);
                if (index >= 0) {
                    findings.add(new Finding(lineNumber, column(line, index), null));
                    break;
                }
            }
        }
        return findings;
    }

    static List<Finding> scanPatterns(String content, List<Pattern> patterns) {
        List<Finding> findings = new ArrayList<>();
        int lineNumber = 0;
        for (String line : SourceLines.split(content)) {
            lineNumber++;
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(line);
                if (matcher.find()) {
                    findings.add(new Finding(lineNumber, column(line, matcher.start()), null));
                    break;
                }
            }
        }
        return findings;
    }

    private static int column(String line, int index) {
        return line.codePointCount(0, index) + 1;
    }
}
