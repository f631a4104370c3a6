package com.locusfilter.core.exception;

/**
 * Base type for every error raised while assembling or running a filter.
 *
 * <p>
 * All subclasses are unchecked. They are local to a single invocation: the
 * runner reports them to its caller and never lets one invocation's failure
 * leak into another.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
