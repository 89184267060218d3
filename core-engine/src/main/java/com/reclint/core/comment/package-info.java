/**
 * Lexical comment extraction.
 *
 * <p>
 * {@link com.reclint.core.comment.CommentTokenizer} extracts
 * {@link com.reclint.core.comment.Comment} spans using a
 * {@link com.reclint.core.comment.CommentSyntax} descriptor. Language presets
 * live in {@link com.reclint.core.comment.SourceLanguage}. Extraction is not
 * syntax-aware: markers inside string literals are treated as comments.
 * </p>
 *
 * @since 1.0.0
 */
package com.reclint.core.comment;
