package com.reclint.core.rule;

import java.util.List;
import java.util.Locale;

/**
 * Top-level section of a rule file.
 *
 * <p>
 * {@link #REQUIRED} and {@link #DENY} hold enforced rules and are applied in
 * that order during validation. {@link #REVIEW} and {@link #GUIDELINE} hold
 * auxiliary items that only carry a message.
 * </p>
 *
 * @since 1.0.0
 */
public enum Category {

    REQUIRED(true),
    DENY(true),
    REVIEW(false),
    GUIDELINE(false);

    private static final List<Category> ENFORCED = List.of(REQUIRED, DENY);
    private static final List<Category> AUXILIARY = List.of(REVIEW, GUIDELINE);

    private final boolean enforced;

    Category(boolean enforced) {
        this.enforced = enforced;
    }

    public boolean isEnforced() {
        return enforced;
    }

    /**
     * Key of this section in a rule file.
     *
     * @return lowercase key, e.g. {@code deny}
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Categories holding rules, in validation order.
     *
     * @return {@code [REQUIRED, DENY]}
     */
    public static List<Category> enforced() {
        return ENFORCED;
    }

    /**
     * Categories holding auxiliary items.
     *
     * @return {@code [REVIEW, GUIDELINE]}
     */
    public static List<Category> auxiliary() {
        return AUXILIARY;
    }
}
