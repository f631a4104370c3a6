/**
 * Built-in, configuration-driven filters.
 *
 * <p>
 * All built-ins implement
 * {@link com.locusfilter.core.filter.ConfiguredFilter} and are instantiated
 * via {@link com.locusfilter.core.filter.FilterFactory}:
 * </p>
 * <ul>
 * <li>{@link com.locusfilter.core.filter.ThresholdFilter}: numeric property
 * beyond a limit</li>
 * <li>{@link com.locusfilter.core.filter.CatalogMatchFilter}: membership in
 * any listed catalog</li>
 * <li>{@link com.locusfilter.core.filter.AmplitudeFilter}: light-curve
 * peak-to-peak spread</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new filter type, implement {@code ConfiguredFilter}, validate its
 * fields in {@code FilterDefinition.validate()} and register the type string
 * in {@code FilterFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.filter;
