package com.reclint.core.validation;

import com.reclint.core.config.ConfigurationException;
import com.reclint.core.config.RuleFileParseException;
import com.reclint.core.hierarchy.CollectedRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Effective rules per directory, resolved once per distinct directory
 * before the parallel phase and read-only afterwards.
 *
 * @since 1.0.0
 */
final class RuleSetCache {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetCache.class);

    private final Map<Path, CollectedRuleSet> rules;
    private final List<LintError> errors;

    private RuleSetCache(Map<Path, CollectedRuleSet> rules, List<LintError> errors) {
        this.rules = Collections.unmodifiableMap(rules);
        this.errors = List.copyOf(errors);
    }

    /**
     * Resolve every directory, in sorted order.
     *
     * <p>
     * A directory whose rule files cannot be parsed is recorded as an error
     * and left out of the cache. Configuration errors propagate.
     * </p>
     *
     * @param dirs     directories to resolve; duplicates are resolved once
     * @param resolver hierarchy resolution
     * @return the populated cache
     * @throws ConfigurationException if a directory has no root or an invalid rule
     */
    static RuleSetCache build(Collection<Path> dirs, Function<Path, CollectedRuleSet> resolver) {
        Map<Path, CollectedRuleSet> rules = new HashMap<>();
        List<LintError> errors = new ArrayList<>();
        for (Path dir : new TreeSet<>(dirs)) {
            try {
                rules.put(dir, resolver.apply(dir));
            } catch (RuleFileParseException e) {
                LOG.warn("Skipping {}: {}", dir, e.getMessage());
                errors.add(LintError.directory(dir.toString(), e.getMessage()));
            }
        }
        LOG.debug("Resolved rules for {} director(ies)", rules.size());
        return new RuleSetCache(rules, errors);
    }

    Optional<CollectedRuleSet> get(Path dir) {
        return Optional.ofNullable(rules.get(dir));
    }

    List<LintError> errors() {
        return errors;
    }

    int size() {
        return rules.size();
    }
}
