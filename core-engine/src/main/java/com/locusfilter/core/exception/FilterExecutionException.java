package com.locusfilter.core.exception;

/**
 * Wraps any failure thrown by user filter code. The original failure is kept
 * as the {@linkplain #getCause() cause}.
 *
 * @since 1.0.0
 */
public class FilterExecutionException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final String filterName;
    private final long locusId;

    public FilterExecutionException(String filterName, long locusId, Throwable cause) {
        super("Filter '" + filterName + "' failed on locus " + locusId + ": " + cause, cause);
        this.filterName = filterName;
        this.locusId = locusId;
    }

    public String getFilterName() {
        return filterName;
    }

    public long getLocusId() {
        return locusId;
    }
}
