package com.reclint.core.comment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CommentTokenizer}.
 */
class CommentTokenizerTest {

    private static final CommentSyntax C_STYLE = CommentSyntax.cStyle();

    @Test
    @DisplayName("Should extract a line comment as trimmed text")
    void shouldExtractLineComment() {
        assertThat(CommentTokenizer.tokenize("// hello", C_STYLE))
                .containsExactly(new Comment(1, "hello"));
    }

    @Test
    @DisplayName("Should extract the trailing comment after code")
    void shouldExtractTrailingComment() {
        assertThat(CommentTokenizer.tokenize("int x = 1; // one\nint y = 2;", C_STYLE))
                .containsExactly(new Comment(1, "one"));
    }

    @Test
    @DisplayName("Should not treat a URL scheme as a line comment")
    void shouldSkipUrlScheme() {
        assertThat(CommentTokenizer.tokenize("http://example.com", C_STYLE)).isEmpty();
        assertThat(CommentTokenizer.tokenize("see http://example.com // link", C_STYLE))
                .containsExactly(new Comment(1, "link"));
    }

    @Test
    @DisplayName("Should emit each line of a two-line block comment")
    void shouldExtractTwoLineBlock() {
        assertThat(CommentTokenizer.tokenize("/* a\n b */", C_STYLE))
                .containsExactly(new Comment(1, "a"), new Comment(2, "b"));
    }

    @Test
    @DisplayName("Should emit middle lines of a block, including blank ones")
    void shouldEmitMiddleLines() {
        String content = "/**\n * first\n\n * second\n */";

        assertThat(CommentTokenizer.tokenize(content, C_STYLE)).containsExactly(
                new Comment(1, "*"),
                new Comment(2, "* first"),
                new Comment(3, ""),
                new Comment(4, "* second"));
    }

    @Test
    @DisplayName("Should keep scanning after a block closed on the same line")
    void shouldContinueAfterInlineBlock() {
        assertThat(CommentTokenizer.tokenize("a /* x */ b /* y */ c // z", C_STYLE))
                .containsExactly(new Comment(1, "x"), new Comment(1, "y"), new Comment(1, "z"));
    }

    @Test
    @DisplayName("Should resume scanning after a block closes mid-line")
    void shouldResumeAfterBlockEnd() {
        assertThat(CommentTokenizer.tokenize("/*\nend */ code // tail", C_STYLE))
                .containsExactly(new Comment(2, "end"), new Comment(2, "tail"));
    }

    @Test
    @DisplayName("Should let the earliest marker win")
    void shouldPreferEarliestMarker() {
        assertThat(CommentTokenizer.tokenize("/* // inner */", C_STYLE))
                .containsExactly(new Comment(1, "// inner"));
        assertThat(CommentTokenizer.tokenize("// /* not a block", C_STYLE))
                .containsExactly(new Comment(1, "/* not a block"));
    }

    @Test
    @DisplayName("Should extract markers inside string literals")
    void shouldIgnoreStringLiterals() {
        assertThat(CommentTokenizer.tokenize("String s = \"// not really\";", C_STYLE))
                .containsExactly(new Comment(1, "not really\";"));
    }

    @Test
    @DisplayName("Should support custom line and block markers")
    void shouldSupportCustomSyntax() {
        CommentSyntax syntax = new CommentSyntax(List.of("#"), List.of(new BlockMarker("=begin", "=end")));
        String content = "x = 1 # note\n=begin\ndoc\n=end\n";

        assertThat(CommentTokenizer.tokenize(content, syntax)).containsExactly(
                new Comment(1, "note"),
                new Comment(3, "doc"));
    }

    @Test
    @DisplayName("Should drop Rust doc comments from the rust preset")
    void shouldDropRustDocComments() {
        String content = "/// doc\n//! crate doc\n// plain\n";

        assertThat(SourceLanguage.RUST.extractComments(content)).containsExactly(new Comment(3, "plain"));
        assertThat(SourceLanguage.JAVA.extractComments(content)).hasSize(3);
    }

    @Test
    @DisplayName("Should number lines by LF only")
    void shouldNumberLinesByLineFeed() {
        assertThat(CommentTokenizer.tokenize("x = 1;\r// a\r\n// b", C_STYLE)).containsExactly(
                new Comment(1, "a"),
                new Comment(2, "b"));
    }
}
