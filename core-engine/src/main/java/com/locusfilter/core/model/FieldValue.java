package com.locusfilter.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A single cell of a measurement: either a present scalar value or the
 * explicit missing marker.
 *
 * <p>
 * Values are normalised on construction so that equality does not depend on
 * the boxed type a producer happened to use: integral numbers become
 * {@link Long}, floating-point numbers become {@link Double}. No coercion
 * happens across kinds, so {@code 1L}, {@code 1.0} and {@code "1"} are three
 * different values.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldValue implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final FieldValue MISSING = new FieldValue(null);

    private final Object value;

    private FieldValue(Object value) {
        this.value = value;
    }

    /**
     * Wrap a raw value.
     *
     * @param raw the value; {@code null} yields {@link #missing()}
     * @return normalised cell
     */
    public static FieldValue of(Object raw) {
        Object normalised = normalise(raw);
        return normalised == null ? MISSING : new FieldValue(normalised);
    }

    /**
     * @return the shared missing marker
     */
    public static FieldValue missing() {
        return MISSING;
    }

    /**
     * Normalise a raw scalar the same way {@link #of(Object)} does.
     *
     * @param raw the raw value, may be {@code null}
     * @return {@code Long} for integral numbers, {@code Double} for floating
     *         numbers, otherwise {@code raw} unchanged
     */
    public static Object normalise(Object raw) {
        if (raw instanceof Byte || raw instanceof Short || raw instanceof Integer) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Float f) {
            return f.doubleValue();
        }
        return raw;
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isMissing() {
        return value == null;
    }

    /**
     * @return the normalised value, or {@code null} when missing
     */
    public Object getValue() {
        return value;
    }

    /**
     * @return the value as a double when it is numeric, empty otherwise
     */
    public OptionalDouble asDouble() {
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        return OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldValue that))
            return false;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "--" : value.toString();
    }
}
