package com.reclint.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Creates the SnakeYAML instances used for rule and root files.
 *
 * @since 1.0.0
 */
final class YamlSupport {

    private YamlSupport() {
        // utility class - not instantiable
    }

    /**
     * A typed loader for the given root bean: duplicate keys rejected,
     * snake_case keys mapped to bean properties.
     *
     * <p>
     * {@link Yaml} is not thread-safe; create one per load.
     * </p>
     *
     * @param rootType bean class of the document
     * @return a new loader
     */
    static Yaml typedLoader(Class<?> rootType) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Constructor constructor = new Constructor(rootType, options);
        constructor.setPropertyUtils(new SnakeCasePropertyUtils());
        return new Yaml(constructor);
    }
}
