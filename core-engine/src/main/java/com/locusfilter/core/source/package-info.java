/**
 * Upstream locus data sources.
 *
 * @since 1.0.0
 */
package com.locusfilter.core.source;
