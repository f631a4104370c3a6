/**
 * Error kinds raised while assembling and running locus filters.
 *
 * <p>
 * Every type extends the unchecked
 * {@link com.locusfilter.core.exception.FilterException}, so callers can
 * catch the whole family at once.
 * </p>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.exception;
