package com.reclint.core.config;

import com.reclint.core.rule.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads, validates and converts a rule file.
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code from*} method validates the parsed file before conversion so
 * that an invalid rule <strong>fails fast</strong>, before any file is
 * checked. An empty or comment-only file yields an empty rule set.
 * </p>
 *
 * <h3>Errors</h3>
 * <ul>
 * <li>{@link RuleFileParseException}: the file cannot be read or is not
 * well-formed YAML of the expected structure</li>
 * <li>{@link InvalidRuleException}: the YAML is well formed but an entry
 * violates its rule type's invariants</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RuleFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFileLoader.class);

    private RuleFileLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load a rule file from the file system.
     *
     * @param file path to the rule file; must not be {@code null}
     * @return converted rule set
     * @throws RuleFileParseException if reading or parsing fails
     * @throws InvalidRuleException   if rule validation fails
     */
    public static RuleSet fromFile(Path file) {
        Objects.requireNonNull(file, "Rule file path must not be null");
        try (InputStream is = Files.newInputStream(file)) {
            return parseAndConvert(is, file);
        } catch (IOException e) {
            throw new RuleFileParseException(file, "Failed to read rule file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a rule file from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return converted rule set
     * @throws IllegalArgumentException if the resource does not exist
     * @throws RuleFileParseException   if reading or parsing fails
     * @throws InvalidRuleException     if rule validation fails
     */
    public static RuleSet fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RuleFileLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndConvert(is, Path.of(resource));
        } catch (IOException e) {
            throw new RuleFileParseException(Path.of(resource),
                    "Failed to read classpath resource " + resource + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RuleSet parseAndConvert(InputStream is, Path source) {
        RuleFileConfig config;
        try {
            config = YamlSupport.typedLoader(RuleFileConfig.class).load(is);
        } catch (YAMLException e) {
            throw new RuleFileParseException(source, "Failed to parse " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.debug("Rule file {} is empty", source);
            return RuleSet.empty();
        }

        RuleSet ruleSet = RuleConverter.convert(config, source.toString());
        LOG.debug("Loaded {} required, {} deny, {} review, {} guideline entr(ies) from {}",
                ruleSet.required().size(), ruleSet.deny().size(),
                ruleSet.review().size(), ruleSet.guideline().size(), source);
        return ruleSet;
    }
}
