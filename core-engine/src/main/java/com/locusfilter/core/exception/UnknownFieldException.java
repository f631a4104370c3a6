package com.locusfilter.core.exception;

import java.util.Objects;

/**
 * Raised when a time-series projection names a field that no measurement of
 * the locus carries.
 *
 * @since 1.0.0
 */
public class UnknownFieldException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public UnknownFieldException(String fieldName) {
        super("Unknown field: '" + fieldName + "'");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
    }

    public String getFieldName() {
        return fieldName;
    }
}
