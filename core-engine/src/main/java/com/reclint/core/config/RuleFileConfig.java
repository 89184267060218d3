package com.reclint.core.config;

import com.reclint.core.model.ItemDefinition;
import com.reclint.core.model.RuleDefinition;
import com.reclint.core.rule.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for a rule file.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * required:
 *   - type: require_english_comment
 *     label: english-comments
 *     message: Write comments in English
 *     comment:
 *       lang: java
 * deny:
 *   - type: forbidden_texts
 *     label: no-todo
 *     message: Resolve TODOs before merging
 *     keywords: [TODO, FIXME]
 * review:
 *   - message: Check thread safety of shared caches
 * guideline:
 *   - message: Prefer records for value types
 * </pre>
 *
 * <p>
 * Call {@link #validate(String)} after loading to verify every entry.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleFileConfig {

    private List<RuleDefinition> required = new ArrayList<>();
    private List<RuleDefinition> deny = new ArrayList<>();
    private List<ItemDefinition> review = new ArrayList<>();
    private List<ItemDefinition> guideline = new ArrayList<>();

    public List<RuleDefinition> getRequired() {
        return Collections.unmodifiableList(required);
    }

    public void setRequired(List<RuleDefinition> required) {
        this.required = required != null ? new ArrayList<>(required) : new ArrayList<>();
    }

    public List<RuleDefinition> getDeny() {
        return Collections.unmodifiableList(deny);
    }

    public void setDeny(List<RuleDefinition> deny) {
        this.deny = deny != null ? new ArrayList<>(deny) : new ArrayList<>();
    }

    public List<ItemDefinition> getReview() {
        return Collections.unmodifiableList(review);
    }

    public void setReview(List<ItemDefinition> review) {
        this.review = review != null ? new ArrayList<>(review) : new ArrayList<>();
    }

    public List<ItemDefinition> getGuideline() {
        return Collections.unmodifiableList(guideline);
    }

    public void setGuideline(List<ItemDefinition> guideline) {
        this.guideline = guideline != null ? new ArrayList<>(guideline) : new ArrayList<>();
    }

    /**
     * Rule definitions of an enforced section.
     *
     * @param category {@link Category#REQUIRED} or {@link Category#DENY}
     * @return definitions in declaration order; empty for auxiliary sections
     */
    public List<RuleDefinition> rules(Category category) {
        return switch (category) {
            case REQUIRED -> getRequired();
            case DENY -> getDeny();
            case REVIEW, GUIDELINE -> List.of();
        };
    }

    public List<ItemDefinition> items(Category category) {
        return switch (category) {
            case REVIEW -> getReview();
            case GUIDELINE -> getGuideline();
            case REQUIRED, DENY -> List.of();
        };
    }

    /**
     * Validate every entry of this file.
     *
     * <p>
     * Collects all errors and throws a single exception if any entry is
     * invalid.
     * </p>
     *
     * @param source file name or resource used in the message
     * @throws InvalidRuleException if one or more entries are invalid
     */
    public void validate(String source) {
        List<String> errors = new ArrayList<>();

        for (Category category : Category.enforced()) {
            List<RuleDefinition> definitions = rules(category);
            for (int i = 0; i < definitions.size(); i++) {
                RuleDefinition definition = definitions.get(i);
                if (definition == null) {
                    errors.add(category.configKey() + "[" + i + "] is empty");
                    continue;
                }
                try {
                    definition.validate(category);
                } catch (IllegalStateException e) {
                    errors.add(e.getMessage());
                }
            }
        }
        for (Category category : Category.auxiliary()) {
            List<ItemDefinition> definitions = items(category);
            for (int i = 0; i < definitions.size(); i++) {
                String owner = category.configKey() + "[" + i + "]";
                ItemDefinition definition = definitions.get(i);
                if (definition == null) {
                    errors.add(owner + " is empty");
                    continue;
                }
                try {
                    definition.validate(owner);
                } catch (IllegalStateException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidRuleException(
                    "Invalid rule file " + source + ":\n  - " + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RuleFileConfig{required=" + required + ", deny=" + deny
                + ", review=" + review.size() + ", guideline=" + guideline.size() + '}';
    }
}
