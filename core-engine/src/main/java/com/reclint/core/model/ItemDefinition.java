package com.reclint.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry of a {@code review} or {@code guideline} section.
 *
 * @since 1.0.0
 */
public class ItemDefinition {

    private String message;
    private List<MatchDefinition> match = new ArrayList<>();
    private List<String> includeExts = new ArrayList<>();
    private List<String> excludeExts = new ArrayList<>();

    /**
     * Validate the item.
     *
     * @param owner label used in messages, e.g. {@code review[2]}
     * @throws IllegalStateException if validation fails
     */
    public void validate(String owner) {
        List<String> errors = new ArrayList<>();
        if (message == null || message.isBlank()) {
            errors.add(owner + ": 'message' is required");
        }
        MatchDefinition.validateAll(owner, match, errors);
        validateExtensions(owner, "include_exts", includeExts, errors);
        validateExtensions(owner, "exclude_exts", excludeExts, errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    /**
     * Reject empty entries of an {@code include_exts} / {@code exclude_exts} list.
     */
    static void validateExtensions(String owner, String field, List<String> values, List<String> errors) {
        if (values != null && values.stream().anyMatch(Objects::isNull)) {
            errors.add(owner + ": '" + field + "' must not contain empty entries");
        }
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<MatchDefinition> getMatch() {
        return match;
    }

    public void setMatch(List<MatchDefinition> match) {
        this.match = match != null ? new ArrayList<>(match) : new ArrayList<>();
    }

    public List<String> getIncludeExts() {
        return includeExts;
    }

    public void setIncludeExts(List<String> includeExts) {
        this.includeExts = includeExts != null ? new ArrayList<>(includeExts) : new ArrayList<>();
    }

    public List<String> getExcludeExts() {
        return excludeExts;
    }

    public void setExcludeExts(List<String> excludeExts) {
        this.excludeExts = excludeExts != null ? new ArrayList<>(excludeExts) : new ArrayList<>();
    }
}
