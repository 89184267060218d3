/**
 * Raw, mutable beans populated by SnakeYAML from rule files and the root
 * marker. Converted into the immutable {@code com.reclint.core.rule} model
 * after validation.
 *
 * @since 1.0.0
 */
package com.reclint.core.model;
