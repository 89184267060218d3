package com.reclint.core.comment;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in comment syntax presets selectable with {@code comment.lang}.
 *
 * @since 1.0.0
 */
public enum SourceLanguage implements CommentSource {

    JAVA,
    KOTLIN,
    /** Doc comments ({@code ///}, {@code //!}) are not ordinary comments and are dropped. */
    RUST;

    private static final CommentSyntax C_STYLE = CommentSyntax.cStyle();

    @Override
    public List<Comment> extractComments(String content) {
        List<Comment> comments = CommentTokenizer.tokenize(content, C_STYLE);
        if (this != RUST) {
            return comments;
        }
        return comments.stream()
                .filter(c -> !c.text().startsWith("/") && !c.text().startsWith("!"))
                .toList();
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SourceLanguage> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (language.configName().equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
