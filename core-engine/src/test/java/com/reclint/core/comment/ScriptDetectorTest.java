package com.reclint.core.comment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ScriptDetector}.
 */
class ScriptDetectorTest {

    @Test
    @DisplayName("Should detect Hiragana, Katakana and Kanji")
    void shouldDetectJapanese() {
        assertThat(ScriptDetector.containsJapanese("これは")).isTrue();
        assertThat(ScriptDetector.containsJapanese("カタカナ")).isTrue();
        assertThat(ScriptDetector.containsJapanese("漢字")).isTrue();
        assertThat(ScriptDetector.containsJapanese("ｶﾀｶﾅ")).isTrue();
    }

    @Test
    @DisplayName("Should not detect Japanese in ASCII or other scripts")
    void shouldNotDetectOtherScripts() {
        assertThat(ScriptDetector.containsJapanese("plain text")).isFalse();
        assertThat(ScriptDetector.containsJapanese("한국어")).isFalse();
    }

    @Test
    @DisplayName("Should treat blank text and a lone asterisk as decoration")
    void shouldRecognizeDecoration() {
        assertThat(ScriptDetector.isEmptyOrDecoration("")).isTrue();
        assertThat(ScriptDetector.isEmptyOrDecoration("  *  ")).isTrue();
        assertThat(ScriptDetector.isEmptyOrDecoration("* text")).isFalse();
    }
}
