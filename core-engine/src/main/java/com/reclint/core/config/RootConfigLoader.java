package com.reclint.core.config;

import com.reclint.core.model.RootConfigDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the {@link RootConfig} from a root marker file.
 *
 * <p>
 * The marker's presence is what designates the root; its body is optional.
 * An empty or comment-only marker yields {@link RootConfig#defaults()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RootConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RootConfigLoader.class);

    private RootConfigLoader() {
        // utility class - not instantiable
    }

    /**
     * Load the root config of a root directory.
     *
     * @param rootDir directory containing the marker; must not be {@code null}
     * @return the config, or defaults if the marker is empty
     * @throws RuleFileParseException if the marker cannot be read or parsed
     */
    public static RootConfig fromRootDir(Path rootDir) {
        Objects.requireNonNull(rootDir, "Root directory must not be null");
        return fromFile(rootDir.resolve(LintFiles.ROOT_MARKER));
    }

    /**
     * Load a root marker file.
     *
     * @param file marker path; must not be {@code null}
     * @return the config, or defaults if the marker is empty
     * @throws RuleFileParseException if the marker cannot be read or parsed
     */
    public static RootConfig fromFile(Path file) {
        Objects.requireNonNull(file, "Root marker path must not be null");
        RootConfigDefinition definition;
        try (InputStream is = Files.newInputStream(file)) {
            definition = YamlSupport.typedLoader(RootConfigDefinition.class).load(is);
        } catch (IOException e) {
            throw new RuleFileParseException(file, "Failed to read " + file + ": " + e.getMessage(), e);
        } catch (YAMLException e) {
            throw new RuleFileParseException(file, "Failed to parse " + file + ": " + e.getMessage(), e);
        }

        if (definition == null) {
            return RootConfig.defaults();
        }
        RootConfig config = RootConfig.of(definition.getIncludeExtensions(), definition.getExcludeDirs());
        LOG.debug("Loaded {} from {}", config, file);
        return config;
    }
}
