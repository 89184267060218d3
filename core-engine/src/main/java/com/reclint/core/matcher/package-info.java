/**
 * Path predicate language selecting the files a rule applies to.
 *
 * @since 1.0.0
 */
package com.reclint.core.matcher;
