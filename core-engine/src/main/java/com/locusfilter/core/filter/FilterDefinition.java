package com.locusfilter.core.filter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single built-in filter loaded from configuration.
 *
 * <p>
 * Supported filter types:
 * </p>
 * <ul>
 * <li>{@code threshold}: numeric property of the triggering measurement
 * above or below a limit</li>
 * <li>{@code catalog}: locus matched in any of a list of catalogs</li>
 * <li>{@code amplitude}: peak-to-peak spread of a light-curve field</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique filter name used in reports and metrics. */
    private String name;

    /** Filter type: "threshold", "catalog" or "amplitude". */
    private String type;

    /** Measurement field the filter reads. */
    private String field;

    /** Limit; required for threshold filters, optional for amplitude filters. */
    private Double threshold;

    /** "above" or "below"; threshold filters only. */
    private String direction = "above";

    /** Stream the locus is sent to when the filter passes. */
    private String stream;

    // --- Catalog fields ---
    /** Catalogs that count as a match. */
    private List<String> catalogs = new ArrayList<>();

    /** Property the filter records its result under. */
    private String property;

    // --- Amplitude fields ---
    /** Restrict the light curve to measurements where this field ... */
    private String groupField;

    /** ... equals this value (e.g. a photometric band id). */
    private Object groupValue;

    /** Fewest light-curve points needed before an amplitude is computed. */
    private int minPoints = 2;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Filter 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Filter 'type' is required");
        }

        if (type != null) {
            switch (type) {
                case "threshold" -> {
                    if (isBlank(field)) {
                        errors.add("Threshold filter '" + name + "' requires 'field'");
                    }
                    if (threshold == null) {
                        errors.add("Threshold filter '" + name + "' requires 'threshold'");
                    }
                    if (!"above".equals(direction) && !"below".equals(direction)) {
                        errors.add("Threshold filter '" + name
                                + "' requires 'direction' to be 'above' or 'below', got: '" + direction + "'");
                    }
                    if (isBlank(stream)) {
                        errors.add("Threshold filter '" + name + "' requires 'stream'");
                    }
                }
                case "catalog" -> {
                    if (catalogs == null || catalogs.isEmpty()) {
                        errors.add("Catalog filter '" + name + "' requires at least one entry in 'catalogs'");
                    }
                    if (isBlank(stream)) {
                        errors.add("Catalog filter '" + name + "' requires 'stream'");
                    }
                }
                case "amplitude" -> {
                    if (isBlank(field)) {
                        errors.add("Amplitude filter '" + name + "' requires 'field'");
                    }
                    if (isBlank(property)) {
                        errors.add("Amplitude filter '" + name + "' requires 'property'");
                    }
                    if (minPoints < 2) {
                        errors.add("Amplitude filter '" + name + "' requires 'minPoints' >= 2");
                    }
                    if ((threshold == null) != isBlank(stream)) {
                        errors.add("Amplitude filter '" + name
                                + "' requires 'threshold' and 'stream' together");
                    }
                    if (isBlank(groupField) != (groupValue == null)) {
                        errors.add("Amplitude filter '" + name
                                + "' requires 'groupField' and 'groupValue' together");
                    }
                }
                default -> errors.add("Unknown filter type: '" + type
                        + "'. Supported: threshold, catalog, amplitude");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid FilterDefinition: " + String.join("; ", errors));
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the filter type, normalised to lowercase.
     *
     * @param type filter type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getDirection() {
        return direction;
    }

    /**
     * Set the comparison direction, normalised to lowercase.
     *
     * @param direction "above" or "below"
     */
    public void setDirection(String direction) {
        this.direction = direction != null ? direction.toLowerCase(Locale.ROOT) : null;
    }

    public String getStream() {
        return stream;
    }

    public void setStream(String stream) {
        this.stream = stream;
    }

    public List<String> getCatalogs() {
        return catalogs;
    }

    public void setCatalogs(List<String> catalogs) {
        this.catalogs = catalogs != null ? new ArrayList<>(catalogs) : new ArrayList<>();
    }

    public String getProperty() {
        return property;
    }

    public void setProperty(String property) {
        this.property = property;
    }

    public String getGroupField() {
        return groupField;
    }

    public void setGroupField(String groupField) {
        this.groupField = groupField;
    }

    public Object getGroupValue() {
        return groupValue;
    }

    public void setGroupValue(Object groupValue) {
        this.groupValue = groupValue;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public void setMinPoints(int minPoints) {
        this.minPoints = minPoints;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FilterDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "FilterDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", field='" + field + '\'' +
                ", threshold=" + threshold +
                ", direction='" + direction + '\'' +
                ", stream='" + stream + '\'' +
                ", catalogs=" + catalogs +
                ", property='" + property + '\'' +
                ", groupField='" + groupField + '\'' +
                ", groupValue=" + groupValue +
                ", minPoints=" + minPoints +
                '}';
    }
}
