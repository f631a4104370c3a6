/**
 * Configuration loading and validation for built-in filters and the stream
 * registry.
 *
 * <p>
 * Filters and streams are defined in YAML and loaded by
 * {@link com.locusfilter.core.config.FilterConfigLoader} into a
 * {@link com.locusfilter.core.config.FilterConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.config;
