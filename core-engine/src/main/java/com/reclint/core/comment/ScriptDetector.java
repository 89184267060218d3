package com.reclint.core.comment;

/**
 * Detects Japanese script in comment text.
 *
 * @since 1.0.0
 */
public final class ScriptDetector {

    private ScriptDetector() {
        // utility class - not instantiable
    }

    /**
     * Whether the text contains Hiragana, Katakana (including phonetic
     * extensions and half-width forms) or CJK unified ideographs.
     *
     * @param text text to inspect
     * @return {@code true} if at least one Japanese character is present
     */
    public static boolean containsJapanese(String text) {
        return text.codePoints().anyMatch(ScriptDetector::isJapanese);
    }

    /**
     * Whether a comment carries no prose: blank, or a lone {@code *} left over
     * from block comment decoration.
     *
     * @param text comment text
     * @return {@code true} if the comment should not be checked
     */
    public static boolean isEmptyOrDecoration(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() || trimmed.equals("*");
    }

    private static boolean isJapanese(int codePoint) {
        return (codePoint >= 0x3040 && codePoint <= 0x309F)
                || (codePoint >= 0x30A0 && codePoint <= 0x30FF)
                || (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0x31F0 && codePoint <= 0x31FF)
                || (codePoint >= 0xFF65 && codePoint <= 0xFF9F);
    }
}
