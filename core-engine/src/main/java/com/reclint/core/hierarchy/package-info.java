/**
 * Directory hierarchy resolution: root discovery and additive merging of
 * per-directory rule files.
 *
 * @since 1.0.0
 */
package com.reclint.core.hierarchy;
