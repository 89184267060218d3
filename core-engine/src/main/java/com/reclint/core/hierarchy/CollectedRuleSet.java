package com.reclint.core.hierarchy;

import com.reclint.core.config.RootConfig;
import com.reclint.core.rule.AuxiliaryItem;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.Rule;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Effective rules for one directory: everything declared from the root down
 * to that directory, root first, each file's entries in declaration order.
 *
 * <p>
 * Inheritance is strictly additive. A child rule file never removes or
 * overrides a rule of an ancestor.
 * </p>
 *
 * @param rootDir    canonical root directory
 * @param rootConfig settings from the root marker
 * @param rules      enforced rules per category
 * @param items      auxiliary items per category
 * @since 1.0.0
 */
public record CollectedRuleSet(
        Path rootDir,
        RootConfig rootConfig,
        Map<Category, List<Sourced<Rule>>> rules,
        Map<Category, List<Sourced<AuxiliaryItem>>> items) {

    public CollectedRuleSet {
        Objects.requireNonNull(rootDir, "rootDir must not be null");
        Objects.requireNonNull(rootConfig, "rootConfig must not be null");
        rules = copy(rules);
        items = copy(items);
    }

    /**
     * Rules of one category.
     *
     * @param category section
     * @return rules root-first; empty if none
     */
    public List<Sourced<Rule>> rules(Category category) {
        return rules.getOrDefault(category, List.of());
    }

    public List<Sourced<AuxiliaryItem>> items(Category category) {
        return items.getOrDefault(category, List.of());
    }

    /**
     * All enforced rules in validation order: {@code required} then
     * {@code deny}, each root-first.
     *
     * @return flattened rules
     */
    public List<Rule> enforcedRules() {
        List<Rule> result = new ArrayList<>();
        for (Category category : Category.enforced()) {
            for (Sourced<Rule> sourced : rules(category)) {
                result.add(sourced.value());
            }
        }
        return result;
    }

    /**
     * Path of a file as shown in reports: relative to the root when the
     * file lies under it, otherwise unchanged.
     *
     * @param file canonical file path
     * @return display path
     */
    public String relativize(Path file) {
        if (file.startsWith(rootDir)) {
            return rootDir.relativize(file).toString();
        }
        return file.toString();
    }

    private static <T> Map<Category, List<T>> copy(Map<Category, List<T>> source) {
        Map<Category, List<T>> copy = new EnumMap<>(Category.class);
        if (source != null) {
            source.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
