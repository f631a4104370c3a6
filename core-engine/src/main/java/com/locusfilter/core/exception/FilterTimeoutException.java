package com.locusfilter.core.exception;

import java.time.Duration;

/**
 * Raised when a filter invocation exceeds its wall-clock budget. The
 * invocation is treated as failed; nothing it recorded is reported.
 *
 * @since 1.0.0
 */
public class FilterTimeoutException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final String filterName;
    private final long locusId;
    private final Duration budget;

    public FilterTimeoutException(String filterName, long locusId, Duration budget) {
        super("Filter '" + filterName + "' exceeded its " + budget.toMillis()
                + " ms budget on locus " + locusId);
        this.filterName = filterName;
        this.locusId = locusId;
        this.budget = budget;
    }

    public String getFilterName() {
        return filterName;
    }

    public long getLocusId() {
        return locusId;
    }

    public Duration getBudget() {
        return budget;
    }
}
