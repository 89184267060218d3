package com.reclint.core.comment;

import java.util.List;

/**
 * Something that can extract comments from source text: a language preset
 * or a custom {@link CommentSyntax}.
 *
 * @since 1.0.0
 */
public interface CommentSource {

    /**
     * Extract comments in source order.
     *
     * @param content full file content
     * @return extracted comments
     */
    List<Comment> extractComments(String content);
}
