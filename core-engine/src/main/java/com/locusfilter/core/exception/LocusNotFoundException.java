package com.locusfilter.core.exception;

/**
 * Raised by a data source that has no data for the requested locus.
 *
 * @since 1.0.0
 */
public class LocusNotFoundException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final long locusId;

    public LocusNotFoundException(long locusId) {
        super("No data for locus " + locusId);
        this.locusId = locusId;
    }

    public LocusNotFoundException(long locusId, String message, Throwable cause) {
        super(message, cause);
        this.locusId = locusId;
    }

    public long getLocusId() {
        return locusId;
    }
}
