/**
 * Immutable locus data shared between the runner, the filters and the job
 * layer.
 *
 * <ul>
 * <li>{@link com.locusfilter.core.model.Measurement}: one history row</li>
 * <li>{@link com.locusfilter.core.model.FieldValue}: present or missing
 * cell</li>
 * <li>{@link com.locusfilter.core.model.CatalogMatchSet}: precomputed catalog
 * matches</li>
 * <li>{@link com.locusfilter.core.model.LocusData}: the assembled view handed
 * to a filter</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.model;
