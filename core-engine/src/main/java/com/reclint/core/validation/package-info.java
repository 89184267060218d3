/**
 * Parallel validation driver.
 *
 * <p>
 * {@link com.reclint.core.validation.ValidationDriver} expands input paths,
 * resolves the effective rules of each directory once and validates files
 * concurrently. Kinds that need language-specific analysis are delegated to
 * {@link com.reclint.core.validation.Validator} implementations looked up in
 * a {@link com.reclint.core.validation.ValidatorRegistry}.
 * </p>
 *
 * @since 1.0.0
 */
package com.reclint.core.validation;
