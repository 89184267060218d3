/**
 * Simple per-rule file filters.
 *
 * <p>
 * {@link com.reclint.core.filter.ExcludeFilter} rejects files by name prefix,
 * name suffix or path fragment; {@link com.reclint.core.filter.ExtFilter}
 * restricts a rule to file-name suffixes.
 * </p>
 *
 * @since 1.0.0
 */
package com.reclint.core.filter;
