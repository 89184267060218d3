package com.reclint.core.model;

import com.reclint.core.matcher.MatchCondition;
import com.reclint.core.matcher.MatchPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@code match} entry of a rule or item.
 *
 * <pre>
 * match:
 *   - pattern: path_contains
 *     keywords: [src/main]
 *     cond: and
 * </pre>
 *
 * <p>
 * {@code cond} defaults to {@code or}.
 * </p>
 *
 * @since 1.0.0
 */
public class MatchDefinition {

    private String pattern;
    private List<String> keywords = new ArrayList<>();
    private String cond;

    /**
     * Check every entry of a {@code match} list.
     *
     * @param owner   label used in messages
     * @param entries entries; may be {@code null}
     * @param errors  collector for error messages
     */
    public static void validateAll(String owner, List<MatchDefinition> entries, List<String> errors) {
        if (entries == null) {
            return;
        }
        for (int i = 0; i < entries.size(); i++) {
            MatchDefinition entry = entries.get(i);
            if (entry == null) {
                errors.add(owner + ": match entry " + i + " is empty");
                continue;
            }
            if (entry.pattern == null || MatchPattern.fromConfigName(entry.pattern).isEmpty()) {
                errors.add(owner + ": unknown match pattern '" + entry.pattern + "'");
            }
            if (entry.cond != null && MatchCondition.fromConfigName(entry.cond).isEmpty()) {
                errors.add(owner + ": unknown match condition '" + entry.cond + "' (expected and, or)");
            }
            if (entry.keywords.stream().anyMatch(Objects::isNull)) {
                errors.add(owner + ": match entry " + i + " has an empty keyword");
            }
        }
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
    }

    public String getCond() {
        return cond;
    }

    public void setCond(String cond) {
        this.cond = cond;
    }

    @Override
    public String toString() {
        return "MatchDefinition{pattern='" + pattern + "', keywords=" + keywords + ", cond='" + cond + "'}";
    }
}
