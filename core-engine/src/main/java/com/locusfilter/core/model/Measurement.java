package com.locusfilter.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One immutable row of a locus history.
 *
 * <p>
 * Every measurement carries the two reserved fields {@value #ALERT_ID} and
 * {@value #MJD}; everything else is a free-form mapping of field name to
 * scalar. Measurements of the same locus may carry different field sets.
 * </p>
 *
 * @since 1.0.0
 */
public final class Measurement implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Reserved field holding the originating alert id. */
    public static final String ALERT_ID = "alert_id";

    /** Reserved field holding the observation time (modified Julian date). */
    public static final String MJD = "mjd";

    /** Arrival order: mjd ascending, ties broken by alert id ascending. */
    public static final Comparator<Measurement> ORDER = Comparator
            .comparingDouble(Measurement::getMjd)
            .thenComparingLong(Measurement::getAlertId);

    private final long alertId;
    private final double mjd;
    private final Map<String, Object> fields;

    /**
     * @param alertId originating alert id
     * @param mjd     observation time
     * @param fields  non-reserved fields; {@code null} values are dropped
     * @throws IllegalArgumentException if {@code fields} contains a reserved
     *                                  name
     */
    public Measurement(long alertId, double mjd, Map<String, ?> fields) {
        this.alertId = alertId;
        this.mjd = mjd;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((name, value) -> {
                Objects.requireNonNull(name, "Field name must not be null");
                if (isReserved(name)) {
                    throw new IllegalArgumentException(
                            "Field '" + name + "' is reserved and cannot be set as a data field");
                }
                if (value != null) {
                    copy.put(name, FieldValue.normalise(value));
                }
            });
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * @param name field name
     * @return {@code true} for {@value #ALERT_ID} and {@value #MJD}
     */
    public static boolean isReserved(String name) {
        return ALERT_ID.equals(name) || MJD.equals(name);
    }

    public long getAlertId() {
        return alertId;
    }

    public double getMjd() {
        return mjd;
    }

    /**
     * Look up a cell, reserved fields included.
     *
     * @param name field name
     * @return the cell; {@link FieldValue#missing()} when absent, never
     *         {@code null}
     */
    public FieldValue get(String name) {
        if (ALERT_ID.equals(name)) {
            return FieldValue.of(alertId);
        }
        if (MJD.equals(name)) {
            return FieldValue.of(mjd);
        }
        return FieldValue.of(fields.get(name));
    }

    /**
     * @return non-reserved field names in insertion order
     */
    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    /**
     * @return unmodifiable map of the non-reserved fields
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Measurement that))
            return false;
        return alertId == that.alertId
                && Double.compare(mjd, that.mjd) == 0
                && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, mjd, fields);
    }

    @Override
    public String toString() {
        return "Measurement{alertId=" + alertId + ", mjd=" + mjd + ", fields=" + fields + '}';
    }
}
