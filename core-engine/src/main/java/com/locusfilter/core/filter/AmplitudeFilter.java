package com.locusfilter.core.filter;

import com.locusfilter.core.context.FilterContext;
import com.locusfilter.core.context.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Light-curve amplitude filter.
 *
 * <p>
 * Projects {@code field} over the locus history, optionally restricted to
 * measurements where {@code groupField} equals {@code groupValue}, and
 * records the peak-to-peak spread (max − min of the present numeric values)
 * under {@code property}. When a threshold is configured and the spread is at
 * least that large, the locus is also sent to the configured stream.
 * </p>
 *
 * <p>
 * Fewer than {@code minPoints} usable values, including a locus that never
 * carried {@code field} or {@code groupField}, means the filter records
 * nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class AmplitudeFilter implements ConfiguredFilter {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AmplitudeFilter.class);

    private final String name;
    private final String field;
    private final String property;
    private final String groupField;
    private final Object groupValue;
    private final int minPoints;
    private final Double threshold;
    private final String stream;

    /**
     * @param definition the filter definition
     * @throws NullPointerException     if required fields are {@code null}
     * @throws IllegalArgumentException if {@code minPoints} is below 2, or the
     *                                  group or threshold settings are incomplete
     */
    public AmplitudeFilter(FilterDefinition definition) {
        Objects.requireNonNull(definition, "FilterDefinition must not be null");
        this.name = Objects.requireNonNull(definition.getName(), "Filter name must not be null");
        this.field = Objects.requireNonNull(definition.getField(),
                "Field must not be null for amplitude filter '" + name + "'");
        this.property = Objects.requireNonNull(definition.getProperty(),
                "Property must not be null for amplitude filter '" + name + "'");
        this.groupField = definition.getGroupField();
        this.groupValue = definition.getGroupValue();
        this.minPoints = definition.getMinPoints();
        this.threshold = definition.getThreshold();
        this.stream = definition.getStream();

        if (minPoints < 2) {
            throw new IllegalArgumentException(
                    "minPoints must be >= 2 for amplitude filter '" + name + "', got: " + minPoints);
        }
        if ((groupField == null) != (groupValue == null)) {
            throw new IllegalArgumentException(
                    "groupField and groupValue must be set together for amplitude filter '" + name + "'");
        }
        if (threshold != null && stream == null) {
            throw new IllegalArgumentException(
                    "A threshold needs a stream for amplitude filter '" + name + "'");
        }
    }

    @Override
    public void run(FilterContext context) {
        Set<String> known = context.getLocusData().getKnownFields();
        if (!known.contains(field) || (groupField != null && !known.contains(groupField))) {
            LOG.trace("Filter [{}]: field '{}' or group field '{}' not present on locus {} – skipping",
                    name, field, groupField, context.getLocusId());
            return;
        }

        Map<String, Object> group = groupField != null ? Map.of(groupField, groupValue) : null;
        TimeSeries series = context.getTimeSeries(List.of(field), group);

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int points = 0;
        for (double v : series.getNumericColumn(field)) {
            if (Double.isNaN(v)) {
                continue;
            }
            min = Math.min(min, v);
            max = Math.max(max, v);
            points++;
        }

        if (points < minPoints) {
            LOG.trace("Filter [{}]: only {} usable point(s) on locus {} – skipping",
                    name, points, context.getLocusId());
            return;
        }

        double amplitude = max - min;
        context.setProperty(property, amplitude);

        if (threshold != null && amplitude >= threshold) {
            LOG.debug("Filter [{}] passed on locus {}: amplitude={} >= threshold={}",
                    name, context.getLocusId(), amplitude, threshold);
            context.sendToStream(stream);
        }
    }

    @Override
    public String getName() {
        return name;
    }
}
