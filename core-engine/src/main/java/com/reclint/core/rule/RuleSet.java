package com.reclint.core.rule;

import java.util.List;

/**
 * Converted content of one rule file, in declaration order.
 *
 * @param required  {@code required} rules
 * @param deny      {@code deny} rules
 * @param review    {@code review} items
 * @param guideline {@code guideline} items
 * @since 1.0.0
 */
public record RuleSet(List<Rule> required, List<Rule> deny, List<AuxiliaryItem> review,
        List<AuxiliaryItem> guideline) {

    private static final RuleSet EMPTY = new RuleSet(List.of(), List.of(), List.of(), List.of());

    public RuleSet {
        required = required != null ? List.copyOf(required) : List.of();
        deny = deny != null ? List.copyOf(deny) : List.of();
        review = review != null ? List.copyOf(review) : List.of();
        guideline = guideline != null ? List.copyOf(guideline) : List.of();
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public List<Rule> rules(Category category) {
        return switch (category) {
            case REQUIRED -> required;
            case DENY -> deny;
            case REVIEW, GUIDELINE -> List.of();
        };
    }

    public List<AuxiliaryItem> items(Category category) {
        return switch (category) {
            case REVIEW -> review;
            case GUIDELINE -> guideline;
            case REQUIRED, DENY -> List.of();
        };
    }

    public boolean isEmpty() {
        return required.isEmpty() && deny.isEmpty() && review.isEmpty() && guideline.isEmpty();
    }
}
