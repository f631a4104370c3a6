package com.locusfilter.core.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.locusfilter.core.context.FilterContext;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one successful filter invocation: the properties and stream
 * requests the filter recorded, not yet applied anywhere.
 *
 * <p>
 * The context is kept for inspection but is sealed, and is neither part of
 * the JSON form nor of the serialized form.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"locusId", "alertId", "filterName", "evaluatedAt", "newProperties", "newStreams"})
public final class FilterReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long locusId;
    private final long alertId;
    private final String filterName;
    private final Instant evaluatedAt;
    private final Map<String, Object> newProperties;
    private final Set<String> newStreams;
    private final transient FilterContext context;

    /**
     * Capture the current output of a context.
     *
     * @param filterName  name of the filter that ran
     * @param context     the context it ran with
     * @param evaluatedAt when the invocation started
     */
    public FilterReport(String filterName, FilterContext context, Instant evaluatedAt) {
        this.filterName = Objects.requireNonNull(filterName, "filterName must not be null");
        this.evaluatedAt = Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.locusId = context.getLocusId();
        this.alertId = context.getAlertId();
        this.newProperties = Collections.unmodifiableMap(new LinkedHashMap<>(context.getNewProperties()));
        this.newStreams = Collections.unmodifiableSet(new LinkedHashSet<>(context.getNewStreams()));
    }

    public long getLocusId() {
        return locusId;
    }

    public long getAlertId() {
        return alertId;
    }

    public String getFilterName() {
        return filterName;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public Map<String, Object> getNewProperties() {
        return newProperties;
    }

    public Set<String> getNewStreams() {
        return newStreams;
    }

    /**
     * @return the sealed context, or {@code null} on a deserialized report
     */
    @JsonIgnore
    public FilterContext getContext() {
        return context;
    }

    /**
     * @return {@code true} if the filter recorded nothing
     */
    @JsonIgnore
    public boolean isEmpty() {
        return newProperties.isEmpty() && newStreams.isEmpty();
    }

    @Override
    public String toString() {
        return "FilterReport{" +
                "locusId=" + locusId +
                ", alertId=" + alertId +
                ", filterName='" + filterName + '\'' +
                ", evaluatedAt=" + evaluatedAt +
                ", newProperties=" + newProperties +
                ", newStreams=" + newStreams +
                '}';
    }
}
