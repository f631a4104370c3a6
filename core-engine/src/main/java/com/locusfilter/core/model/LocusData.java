package com.locusfilter.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a filter may see about one locus: its measurement history, its
 * catalog matches and the measurement that triggered the current run.
 *
 * <p>
 * The history is sorted by {@link Measurement#ORDER} at construction and is
 * never empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class LocusData implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long locusId;
    private final List<Measurement> measurements;
    private final CatalogMatchSet catalogMatches;
    private final Measurement triggering;
    private final Set<String> knownFields;

    /**
     * Create locus data triggered by the latest measurement.
     *
     * @param locusId        locus identifier
     * @param measurements   measurement history in any order
     * @param catalogMatches catalog matches; {@code null} means none
     * @throws IllegalArgumentException if the history is empty or holds a
     *                                  duplicate alert id
     */
    public LocusData(long locusId, List<Measurement> measurements, CatalogMatchSet catalogMatches) {
        this(locusId, sorted(locusId, measurements), catalogMatches, null);
    }

    private LocusData(long locusId, List<Measurement> sortedMeasurements,
            CatalogMatchSet catalogMatches, Measurement triggering) {
        this.locusId = locusId;
        this.measurements = sortedMeasurements;
        this.catalogMatches = catalogMatches != null ? catalogMatches : CatalogMatchSet.empty();
        this.triggering = triggering != null
                ? triggering
                : sortedMeasurements.get(sortedMeasurements.size() - 1);

        Set<String> fields = new LinkedHashSet<>();
        fields.add(Measurement.ALERT_ID);
        fields.add(Measurement.MJD);
        for (Measurement m : sortedMeasurements) {
            fields.addAll(m.getFieldNames());
        }
        this.knownFields = Collections.unmodifiableSet(fields);
    }

    /**
     * Return a copy whose triggering measurement is the given alert.
     *
     * @param alertId an alert id from {@link #getAlertIds()}
     * @return new locus data sharing the same history
     * @throws IllegalArgumentException if the alert is not in the history
     */
    public LocusData withTriggeringAlert(long alertId) {
        for (Measurement m : measurements) {
            if (m.getAlertId() == alertId) {
                return new LocusData(locusId, measurements, catalogMatches, m);
            }
        }
        throw new IllegalArgumentException(
                "Alert " + alertId + " is not part of locus " + locusId + "; known alerts: " + getAlertIds());
    }

    public long getLocusId() {
        return locusId;
    }

    /**
     * @return unmodifiable history in arrival order
     */
    public List<Measurement> getMeasurements() {
        return measurements;
    }

    public CatalogMatchSet getCatalogMatches() {
        return catalogMatches;
    }

    public Measurement getTriggeringMeasurement() {
        return triggering;
    }

    /**
     * @return alert ids in arrival order
     */
    public List<Long> getAlertIds() {
        List<Long> ids = new ArrayList<>(measurements.size());
        for (Measurement m : measurements) {
            ids.add(m.getAlertId());
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * @return reserved field names followed by every field seen in the history
     */
    public Set<String> getKnownFields() {
        return knownFields;
    }

    private static List<Measurement> sorted(long locusId, List<Measurement> measurements) {
        Objects.requireNonNull(measurements, "Measurements must not be null");
        if (measurements.isEmpty()) {
            throw new IllegalArgumentException("Locus " + locusId + " has no measurements");
        }
        Set<Long> seen = new HashSet<>();
        for (Measurement m : measurements) {
            Objects.requireNonNull(m, "Measurement must not be null");
            if (!seen.add(m.getAlertId())) {
                throw new IllegalArgumentException(
                        "Locus " + locusId + " has duplicate alert id " + m.getAlertId());
            }
        }
        List<Measurement> copy = new ArrayList<>(measurements);
        copy.sort(Measurement.ORDER);
        return Collections.unmodifiableList(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LocusData that))
            return false;
        return locusId == that.locusId
                && measurements.equals(that.measurements)
                && catalogMatches.equals(that.catalogMatches)
                && triggering.getAlertId() == that.triggering.getAlertId();
    }

    @Override
    public int hashCode() {
        return Objects.hash(locusId, measurements, catalogMatches, triggering.getAlertId());
    }

    @Override
    public String toString() {
        return "LocusData{" +
                "locusId=" + locusId +
                ", measurements=" + measurements.size() +
                ", catalogs=" + catalogMatches.getCatalogNames() +
                ", triggeringAlert=" + triggering.getAlertId() +
                '}';
    }
}
