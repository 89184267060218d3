/**
 * Executable entry point: environment-driven configuration and report
 * writers.
 *
 * @since 1.0.0
 */
package com.reclint.runner;
