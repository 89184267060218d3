package com.reclint.core.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class LineScannerTest {

    @Test
    @DisplayName("Should report one finding per line at the first keyword in declaration order")
    void shouldPreferDeclarationOrder() {
        List<Finding> findings = LineScanner.scanTexts("FIXME then TODO\nclean\nTODO", List.of("TODO", "FIXME"));

        assertThat(findings).containsExactly(new Finding(1, 12, null), new Finding(3, 1, null));
    }

    @Test
    @DisplayName("Should count columns in code points")
    void shouldCountCodePoints() {
        List<Finding> findings = LineScanner.scanTexts("日本😀 TODO", List.of("TODO"));

        assertThat(findings).containsExactly(new Finding(1, 5, null));
    }

    @Test
    @DisplayName("Should report the start of the first regex match")
    void shouldReportRegexMatchStart() {
        List<Finding> findings = LineScanner.scanPatterns("  System.out.println(x);\n  log.info(x);",
                List.of(Pattern.compile("System\\.(out|err)")));

        assertThat(findings).containsExactly(new Finding(1, 3, null));
    }

    @Test
    @DisplayName("Should handle CRLF line endings and empty content")
    void shouldHandleLineEndings() {
        assertThat(LineScanner.scanTexts("a\r\nb x\r\n", List.of("x"))).containsExactly(new Finding(2, 3, null));
        assertThat(LineScanner.scanTexts("", List.of("x"))).isEmpty();
    }

    @Test
    @DisplayName("Should not start a new line at a lone CR")
    void shouldNotSplitOnLoneCarriageReturn() {
        List<Finding> findings = LineScanner.scanTexts("a\rx\nx", List.of("x"));

        assertThat(findings).containsExactly(new Finding(1, 3, null), new Finding(2, 1, null));
    }
}
