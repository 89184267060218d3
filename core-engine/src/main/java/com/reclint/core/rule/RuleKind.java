package com.reclint.core.rule;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of rule types, keyed by the {@code type} discriminator of a rule
 * entry.
 *
 * <p>
 * Each kind is bound to the categories it may be declared under:
 * {@code forbidden_*} kinds only under {@code deny}, {@code require_*} kinds
 * only under {@code required}, {@code custom} under both.
 * </p>
 *
 * @since 1.0.0
 */
public enum RuleKind {

    FORBIDDEN_TEXTS(Category.DENY),
    FORBIDDEN_PATTERNS(Category.DENY),
    CUSTOM(Category.REQUIRED, Category.DENY),
    REQUIRE_JAVA_DOC(Category.REQUIRED),
    REQUIRE_KOTLIN_DOC(Category.REQUIRED),
    REQUIRE_RUST_DOC(Category.REQUIRED),
    REQUIRE_PHP_DOC(Category.REQUIRED),
    REQUIRE_JAPANESE_COMMENT(Category.REQUIRED),
    REQUIRE_ENGLISH_COMMENT(Category.REQUIRED),
    REQUIRE_JAPANESE_PHPUNIT_TEST_NAME(Category.REQUIRED),
    REQUIRE_JAPANESE_KOTEST_TEST_NAME(Category.REQUIRED),
    REQUIRE_JAPANESE_RUST_TEST_NAME(Category.REQUIRED),
    REQUIRE_PHPUNIT_TEST(Category.REQUIRED),
    REQUIRE_KOTEST_TEST(Category.REQUIRED),
    REQUIRE_RUST_UNIT_TEST(Category.REQUIRED);

    private final Set<Category> allowedCategories;

    RuleKind(Category first, Category... rest) {
        this.allowedCategories = rest.length == 0 ? Set.of(first) : Set.of(first, rest[0]);
    }

    /**
     * Whether a rule of this kind may be declared under the given section.
     *
     * @param category rule file section
     * @return {@code true} if allowed
     */
    public boolean isAllowedIn(Category category) {
        return allowedCategories.contains(category);
    }

    /**
     * Value of the {@code type} field, e.g. {@code forbidden_texts}.
     *
     * @return snake_case type name
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RuleKind> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RuleKind kind : values()) {
            if (kind.configName().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
