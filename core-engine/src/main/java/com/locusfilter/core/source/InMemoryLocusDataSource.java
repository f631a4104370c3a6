package com.locusfilter.core.source;

import com.locusfilter.core.exception.LocusNotFoundException;
import com.locusfilter.core.model.LocusData;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link LocusDataSource}.
 *
 * @since 1.0.0
 */
public class InMemoryLocusDataSource implements LocusDataSource {

    private final Map<Long, LocusData> loci = new ConcurrentHashMap<>();

    /**
     * Add or replace a locus.
     *
     * @param locus the data; must not be {@code null}
     * @return this source
     */
    public InMemoryLocusDataSource put(LocusData locus) {
        Objects.requireNonNull(locus, "LocusData must not be null");
        loci.put(locus.getLocusId(), locus);
        return this;
    }

    @Override
    public LocusData load(long locusId) {
        LocusData locus = loci.get(locusId);
        if (locus == null) {
            throw new LocusNotFoundException(locusId);
        }
        return locus;
    }

    public int size() {
        return loci.size();
    }
}
