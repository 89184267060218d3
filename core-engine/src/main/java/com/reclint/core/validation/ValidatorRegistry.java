package com.reclint.core.validation;

import com.reclint.core.rule.RuleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Maps rule kinds to the {@link Validator} that checks them.
 *
 * <p>
 * Register validators before handing the registry to a
 * {@link ValidationDriver}; lookups during a run are read-only. A later
 * registration for a kind replaces the earlier one.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidatorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<RuleKind, Validator> validators = new EnumMap<>(RuleKind.class);

    private ValidatorRegistry() {
    }

    /**
     * Registry with the built-in comment-language validator only.
     *
     * @return a new registry
     */
    public static ValidatorRegistry withBuiltins() {
        return new ValidatorRegistry().register(new CommentLanguageValidator());
    }

    /**
     * Built-ins plus every {@link Validator} published through
     * {@code META-INF/services/com.reclint.core.validation.Validator}.
     *
     * @return a new registry
     */
    public static ValidatorRegistry discover() {
        ValidatorRegistry registry = withBuiltins();
        for (Validator validator : ServiceLoader.load(Validator.class)) {
            registry.register(validator);
        }
        return registry;
    }

    /**
     * Register a validator for all of its supported kinds.
     *
     * @param validator validator; must not be {@code null}
     * @return this registry
     */
    public synchronized ValidatorRegistry register(Validator validator) {
        Objects.requireNonNull(validator, "Validator must not be null");
        for (RuleKind kind : validator.supportedKinds()) {
            Validator previous = validators.put(kind, validator);
            if (previous != null && previous != validator) {
                LOG.debug("Validator {} replaces {} for {}", validator.getClass().getName(),
                        previous.getClass().getName(), kind.configName());
            }
        }
        return this;
    }

    public synchronized Optional<Validator> find(RuleKind kind) {
        return Optional.ofNullable(validators.get(kind));
    }
}
