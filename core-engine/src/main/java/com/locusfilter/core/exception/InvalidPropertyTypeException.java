package com.locusfilter.core.exception;

/**
 * Raised when a filter sets a property whose value is not an integer, a float
 * or a string.
 *
 * @since 1.0.0
 */
public class InvalidPropertyTypeException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final String propertyName;

    public InvalidPropertyTypeException(String propertyName, Object value) {
        super("Property '" + propertyName + "' must be an integer, float or string, got: "
                + (value == null ? "null" : value.getClass().getName()));
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
