package com.reclint.core.hierarchy;

import com.reclint.core.config.ConfigurationException;
import com.reclint.core.config.InvalidRuleException;
import com.reclint.core.config.LintFiles;
import com.reclint.core.config.NoRootFoundException;
import com.reclint.core.config.RootConfig;
import com.reclint.core.config.RootConfigLoader;
import com.reclint.core.config.RuleFileLoader;
import com.reclint.core.config.RuleFileParseException;
import com.reclint.core.rule.AuxiliaryItem;
import com.reclint.core.rule.Category;
import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers the project root and merges the rule files between the root and
 * a target directory.
 *
 * <h3>Resolution</h3>
 * <ol>
 * <li>Canonicalize the target (symlinks resolved).</li>
 * <li>Walk upward from the target, loading the rule file of every directory
 * that has one, up to and including the first directory that contains the
 * root marker.</li>
 * <li>Reverse into root-to-target order and concatenate each category.</li>
 * </ol>
 *
 * <p>
 * Stateless; safe to call from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleHierarchyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RuleHierarchyResolver.class);

    private RuleHierarchyResolver() {
        // utility class - not instantiable
    }

    /**
     * Find the nearest directory at or above {@code start} that contains the
     * root marker.
     *
     * @param start file or directory to start from; must not be {@code null}
     * @return canonical root directory
     * @throws NoRootFoundException   if no ancestor has a root marker
     * @throws ConfigurationException if {@code start} does not exist
     */
    public static Path findRoot(Path start) {
        Objects.requireNonNull(start, "Start path must not be null");
        Path dir = startDirectory(canonicalize(start));
        for (Path current = dir; current != null; current = current.getParent()) {
            if (Files.isRegularFile(current.resolve(LintFiles.ROOT_MARKER))) {
                return current;
            }
        }
        throw new NoRootFoundException(dir);
    }

    /**
     * Compute the effective rules of a directory.
     *
     * @param targetDir directory whose files will be validated; must not be
     *                  {@code null}
     * @return merged rules, root first
     * @throws NoRootFoundException    if no ancestor has a root marker
     * @throws InvalidRuleException    if a rule file on the path is invalid
     * @throws RuleFileParseException  if a rule file or the root marker is malformed
     */
    public static CollectedRuleSet resolveEffectiveRules(Path targetDir) {
        Objects.requireNonNull(targetDir, "Target directory must not be null");
        Path dir = startDirectory(canonicalize(targetDir));

        List<Sourced<RuleSet>> chain = new ArrayList<>();
        Path root = null;
        for (Path current = dir; current != null; current = current.getParent()) {
            Path ruleFile = current.resolve(LintFiles.RULE_FILE);
            if (Files.isRegularFile(ruleFile)) {
                chain.add(new Sourced<>(RuleFileLoader.fromFile(ruleFile), current));
            }
            if (Files.isRegularFile(current.resolve(LintFiles.ROOT_MARKER))) {
                root = current;
                break;
            }
        }
        if (root == null) {
            throw new NoRootFoundException(dir);
        }
        Collections.reverse(chain);

        RootConfig rootConfig = RootConfigLoader.fromRootDir(root);
        CollectedRuleSet collected = flatten(root, rootConfig, chain);
        LOG.debug("Resolved {} rule file(s) for {} (root {})", chain.size(), dir, root);
        return collected;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static CollectedRuleSet flatten(Path root, RootConfig rootConfig, List<Sourced<RuleSet>> chain) {
        Map<Category, List<Sourced<Rule>>> rules = new EnumMap<>(Category.class);
        Map<Category, List<Sourced<AuxiliaryItem>>> items = new EnumMap<>(Category.class);
        for (Category category : Category.enforced()) {
            List<Sourced<Rule>> list = new ArrayList<>();
            for (Sourced<RuleSet> link : chain) {
                for (Rule rule : link.value().rules(category)) {
                    list.add(new Sourced<>(rule, link.sourceDir()));
                }
            }
            rules.put(category, list);
        }
        for (Category category : Category.auxiliary()) {
            List<Sourced<AuxiliaryItem>> list = new ArrayList<>();
            for (Sourced<RuleSet> link : chain) {
                for (AuxiliaryItem item : link.value().items(category)) {
                    list.add(new Sourced<>(item, link.sourceDir()));
                }
            }
            items.put(category, list);
        }
        return new CollectedRuleSet(root, rootConfig, rules, items);
    }

    private static Path canonicalize(Path path) {
        try {
            return path.toAbsolutePath().toRealPath();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot access " + path + ": " + e.getMessage(), e);
        }
    }

    private static Path startDirectory(Path canonical) {
        if (Files.isDirectory(canonical)) {
            return canonical;
        }
        Path parent = canonical.getParent();
        return parent != null ? parent : canonical;
    }
}
