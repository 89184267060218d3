package com.reclint.core.validation;

import com.reclint.core.rule.Rule;
import com.reclint.core.rule.RuleKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Checker for the rule kinds that need per-language knowledge: doc
 * comments, comment language, test names and test existence.
 *
 * <p>
 * Implementations are registered in a {@link ValidatorRegistry}, either
 * programmatically or through {@link java.util.ServiceLoader}. They are
 * called concurrently from validation threads and must be thread-safe.
 * Apart from test-existence checks, which may read candidate test files
 * under the root directory, a validator must not touch the file system.
 * </p>
 *
 * @since 1.0.0
 */
public interface Validator {

    /**
     * Rule kinds this validator handles.
     *
     * @return non-empty set of kinds
     */
    Set<RuleKind> supportedKinds();

    /**
     * Check one file against one rule.
     *
     * @param file    canonical path of the file
     * @param content file content
     * @param rule    rule of one of the {@link #supportedKinds()}
     * @param rootDir canonical root directory
     * @return findings in source order; empty if the file complies
     */
    List<Finding> validate(Path file, String content, Rule rule, Path rootDir);
}
