/**
 * The per-invocation execution context handed to filters.
 *
 * <p>
 * {@link com.locusfilter.core.context.FilterContext} exposes the locus
 * history as a {@link com.locusfilter.core.context.TimeSeries} and collects
 * the properties and stream requests a filter records. Valid stream names
 * come from a {@link com.locusfilter.core.context.StreamRegistry}.
 * </p>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.context;
