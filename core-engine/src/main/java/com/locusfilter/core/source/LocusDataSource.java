package com.locusfilter.core.source;

import com.locusfilter.core.exception.LocusNotFoundException;
import com.locusfilter.core.model.LocusData;

/**
 * Upstream supplier of assembled locus data.
 *
 * <p>
 * Implementations do all I/O needed to build a {@link LocusData}; filters
 * only ever see the materialised result. Implementations must be safe to call
 * from several threads because batch runs load loci concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public interface LocusDataSource {

    /**
     * Load the history and catalog matches of one locus.
     *
     * @param locusId locus identifier
     * @return assembled data
     * @throws LocusNotFoundException if the source has nothing for the locus
     */
    LocusData load(long locusId);
}
