package com.reclint.core.model;

/**
 * {@code comment} block of a comment-language rule. Exactly one of
 * {@code lang} and {@code custom} is set.
 *
 * @since 1.0.0
 */
public class CommentDefinition {

    /** Preset name: java, kotlin or rust. */
    private String lang;

    private CustomSyntaxDefinition custom;

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }

    public CustomSyntaxDefinition getCustom() {
        return custom;
    }

    public void setCustom(CustomSyntaxDefinition custom) {
        this.custom = custom;
    }
}
