package com.locusfilter.core.filter;

import com.locusfilter.core.context.FilterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Threshold filter.
 *
 * <p>
 * Sends the locus to the configured stream when a numeric property of the
 * triggering measurement is strictly above (or below) the threshold. A missing
 * or non-numeric property never passes.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdFilter implements ConfiguredFilter {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ThresholdFilter.class);

    private final String name;
    private final String field;
    private final double threshold;
    private final boolean above;
    private final String stream;

    /**
     * @param definition the filter definition
     * @throws NullPointerException if required fields are {@code null}
     */
    public ThresholdFilter(FilterDefinition definition) {
        Objects.requireNonNull(definition, "FilterDefinition must not be null");
        this.name = Objects.requireNonNull(definition.getName(), "Filter name must not be null");
        this.field = Objects.requireNonNull(definition.getField(),
                "Field must not be null for threshold filter '" + name + "'");
        this.threshold = Objects.requireNonNull(definition.getThreshold(),
                "Threshold must not be null for threshold filter '" + name + "'");
        this.above = !"below".equals(definition.getDirection());
        this.stream = Objects.requireNonNull(definition.getStream(),
                "Stream must not be null for threshold filter '" + name + "'");
    }

    @Override
    public void run(FilterContext context) {
        Object raw = context.getProperties().get(field);
        if (!(raw instanceof Number n)) {
            LOG.trace("Filter [{}]: field '{}' not present or not numeric on locus {} – skipping",
                    name, field, context.getLocusId());
            return;
        }

        double v = n.doubleValue();
        boolean passes = above ? v > threshold : v < threshold;
        if (passes) {
            LOG.debug("Filter [{}] passed on locus {}: {}={} {} {}",
                    name, context.getLocusId(), field, v, above ? ">" : "<", threshold);
            context.sendToStream(stream);
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
