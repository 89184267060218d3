/**
 * Rule file and root marker loading.
 *
 * <p>
 * YAML is parsed with SnakeYAML into the beans of
 * {@code com.reclint.core.model}, validated fail-fast and converted by
 * {@link com.reclint.core.config.RuleConverter}. The exception hierarchy
 * separates fatal configuration problems
 * ({@link com.reclint.core.config.ConfigurationException}) from problems
 * scoped to one directory
 * ({@link com.reclint.core.config.RuleFileParseException}).
 * </p>
 *
 * @since 1.0.0
 */
package com.reclint.core.config;
