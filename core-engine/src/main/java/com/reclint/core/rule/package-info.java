/**
 * Typed rule model.
 *
 * <p>
 * {@link com.reclint.core.rule.Rule} is a sealed interface with one record
 * per rule variant. Every record validates its own invariants on
 * construction, so a rule that exists is well formed.
 * </p>
 *
 * @since 1.0.0
 */
package com.reclint.core.rule;
