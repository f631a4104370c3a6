package com.locusfilter.core.context;

import com.locusfilter.core.exception.InvalidPropertyTypeException;
import com.locusfilter.core.exception.UnknownFieldException;
import com.locusfilter.core.exception.UnknownStreamException;
import com.locusfilter.core.model.FieldValue;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.model.Measurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read/write view of one locus for exactly one filter invocation.
 *
 * <p>
 * Reads go to the immutable {@link LocusData}. Writes never touch it: new
 * properties and stream requests are collected here and handed back to the
 * caller, who decides whether to commit them.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A fresh context is created per invocation. Once the runner calls
 * {@link #seal()}, further writes fail with {@link IllegalStateException};
 * reads keep working so the context can travel with the report.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A context is confined to its invocation. Write and seal operations are
 * synchronized only so that a runner abandoning a timed-out filter can seal
 * the context while the filter thread is still running.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterContext {

    private static final Logger LOG = LoggerFactory.getLogger(FilterContext.class);

    private final LocusData locus;
    private final StreamRegistry streamRegistry;

    private final Map<String, Object> newProperties = new LinkedHashMap<>();
    private final Set<String> newStreams = new LinkedHashSet<>();
    private boolean sealed;

    /**
     * @param locus          assembled locus data
     * @param streamRegistry streams the filter may publish to
     */
    public FilterContext(LocusData locus, StreamRegistry streamRegistry) {
        this.locus = Objects.requireNonNull(locus, "LocusData must not be null");
        this.streamRegistry = Objects.requireNonNull(streamRegistry, "StreamRegistry must not be null");
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public long getLocusId() {
        return locus.getLocusId();
    }

    public long getAlertId() {
        return locus.getTriggeringMeasurement().getAlertId();
    }

    /**
     * Return the properties of the triggering measurement, overlaid with the
     * properties set so far in this invocation.
     *
     * <p>
     * The returned map is a fresh copy; changing it has no effect on the
     * context.
     * </p>
     *
     * @return mutable snapshot
     */
    public synchronized Map<String, Object> getProperties() {
        Measurement current = locus.getTriggeringMeasurement();
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(Measurement.ALERT_ID, current.getAlertId());
        props.put(Measurement.MJD, current.getMjd());
        props.putAll(current.getFields());
        props.putAll(newProperties);
        return props;
    }

    /**
     * Project the history onto the given fields.
     *
     * @param fields fields to project
     * @return time series with the reserved columns first
     * @throws UnknownFieldException if a field is unknown to this locus
     * @see #getTimeSeries(List, Map)
     */
    public TimeSeries getTimeSeries(List<String> fields) {
        return getTimeSeries(fields, null);
    }

    /**
     * Project the history onto the given fields, keeping only measurements
     * whose cells equal every entry of {@code filters}.
     *
     * <p>
     * Equality is exact on the normalised value: a stored value of a
     * different kind than the requested one never matches, and never
     * throws. Rows are ordered by mjd, then alert id.
     * </p>
     *
     * @param fields  fields to project; {@value Measurement#ALERT_ID} and
     *                {@value Measurement#MJD} are always prepended
     * @param filters required values per field, may be {@code null}
     * @return time series with the reserved columns first
     * @throws UnknownFieldException if a field or filter key is unknown to
     *                               this locus
     */
    public TimeSeries getTimeSeries(List<String> fields, Map<String, ?> filters) {
        Objects.requireNonNull(fields, "Field list must not be null");
        Set<String> known = locus.getKnownFields();

        Set<String> columns = new LinkedHashSet<>();
        columns.add(Measurement.ALERT_ID);
        columns.add(Measurement.MJD);
        for (String field : fields) {
            if (!known.contains(field)) {
                throw new UnknownFieldException(String.valueOf(field));
            }
            columns.add(field);
        }

        Map<String, FieldValue> required = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((field, value) -> {
                if (!known.contains(field)) {
                    throw new UnknownFieldException(String.valueOf(field));
                }
                required.put(field, FieldValue.of(value));
            });
        }

        List<List<FieldValue>> cells = new ArrayList<>();
        for (Measurement m : locus.getMeasurements()) {
            if (!matches(m, required)) {
                continue;
            }
            List<FieldValue> row = new ArrayList<>(columns.size());
            for (String column : columns) {
                row.add(m.get(column));
            }
            cells.add(row);
        }
        LOG.trace("Projected {} of {} measurement(s) onto {}", cells.size(),
                locus.getMeasurements().size(), columns);
        return new TimeSeries(new ArrayList<>(columns), cells);
    }

    /**
     * @return catalog name to match records; catalogs without matches are
     *         absent
     */
    public Map<String, List<Map<String, Object>>> getAstroObjectMatches() {
        return locus.getCatalogMatches().asMap();
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Record a new property. The last value set for a name wins.
     *
     * @param name  property name
     * @param value an integer, float or string
     * @throws InvalidPropertyTypeException if {@code value} is any other kind
     * @throws IllegalArgumentException     if {@code name} is blank
     * @throws IllegalStateException        if the context is sealed
     */
    public synchronized void setProperty(String name, Object value) {
        checkWritable();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name must not be null or blank");
        }
        if (!isScalar(value)) {
            throw new InvalidPropertyTypeException(name, value);
        }
        newProperties.put(name, FieldValue.normalise(value));
    }

    /**
     * Request that this locus be published to a stream. Repeated requests
     * collapse into one.
     *
     * @param streamName registered stream name
     * @throws UnknownStreamException if the stream is not registered
     * @throws IllegalStateException  if the context is sealed
     */
    public synchronized void sendToStream(String streamName) {
        checkWritable();
        newStreams.add(streamRegistry.require(streamName));
    }

    /**
     * @return copy of the properties set in this invocation
     */
    public synchronized Map<String, Object> getNewProperties() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(newProperties));
    }

    /**
     * @return copy of the streams requested in this invocation, in request
     *         order
     */
    public synchronized Set<String> getNewStreams() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(newStreams));
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Reject all further writes.
     */
    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public LocusData getLocusData() {
        return locus;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void checkWritable() {
        if (sealed) {
            throw new IllegalStateException(
                    "Filter context for locus " + locus.getLocusId() + " is sealed");
        }
    }

    private static boolean matches(Measurement m, Map<String, FieldValue> required) {
        for (Map.Entry<String, FieldValue> e : required.entrySet()) {
            if (!m.get(e.getKey()).equals(e.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isScalar(Object value) {
        return value instanceof Byte
                || value instanceof Short
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Float
                || value instanceof Double
                || value instanceof String;
    }
}
