package com.locusfilter.core.runner;

import com.locusfilter.core.exception.FilterException;

import java.util.Objects;

/**
 * One slot of a batch run: either a report or the error that prevented it.
 *
 * @since 1.0.0
 */
public final class FilterOutcome {

    private final long locusId;
    private final FilterReport report;
    private final FilterException error;

    private FilterOutcome(long locusId, FilterReport report, FilterException error) {
        this.locusId = locusId;
        this.report = report;
        this.error = error;
    }

    public static FilterOutcome success(FilterReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new FilterOutcome(report.getLocusId(), report, null);
    }

    public static FilterOutcome failure(long locusId, FilterException error) {
        Objects.requireNonNull(error, "error must not be null");
        return new FilterOutcome(locusId, null, error);
    }

    public long getLocusId() {
        return locusId;
    }

    public boolean isSuccess() {
        return report != null;
    }

    /**
     * @return the report
     * @throws IllegalStateException if this outcome is a failure
     */
    public FilterReport getReport() {
        if (report == null) {
            throw new IllegalStateException("Locus " + locusId + " failed: " + error.getMessage(), error);
        }
        return report;
    }

    /**
     * @return the error
     * @throws IllegalStateException if this outcome is a success
     */
    public FilterException getError() {
        if (error == null) {
            throw new IllegalStateException("Locus " + locusId + " succeeded");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FilterOutcome{success, " + report + '}'
                : "FilterOutcome{failure, locusId=" + locusId + ", error=" + error + '}';
    }
}
