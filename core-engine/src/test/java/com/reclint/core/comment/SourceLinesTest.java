package com.reclint.core.comment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLinesTest {

    @Test
    @DisplayName("Should split on LF and drop the CR of CRLF endings")
    void shouldSplitOnLineFeed() {
        assertThat(SourceLines.split("a\r\nb\n\nc")).containsExactly("a", "b", "", "c");
    }

    @Test
    @DisplayName("Should keep a lone CR inside its line")
    void shouldKeepLoneCarriageReturn() {
        assertThat(SourceLines.split("a\rb\nc\n")).containsExactly("a\rb", "c");
    }

    @Test
    @DisplayName("Should not add a line after the final terminator")
    void shouldIgnoreFinalTerminator() {
        assertThat(SourceLines.split("")).isEmpty();
        assertThat(SourceLines.split("\n")).containsExactly("");
    }
}
