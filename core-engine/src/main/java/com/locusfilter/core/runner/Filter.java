package com.locusfilter.core.runner;

import com.locusfilter.core.context.FilterContext;

import java.util.Objects;

/**
 * A user-supplied filter.
 *
 * <p>
 * A filter inspects the locus through its {@link FilterContext} and records
 * properties or stream requests there. It must be a pure computation over the
 * context: no I/O, no blocking, and no reference to the context kept after
 * {@link #run(FilterContext)} returns.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Filter {

    /**
     * Run against one locus.
     *
     * @param context per-invocation context
     * @throws Exception any failure; the runner reports it as a
     *                   {@link com.locusfilter.core.exception.FilterExecutionException}
     */
    void run(FilterContext context) throws Exception;

    /** Name reported for lambdas and anonymous classes that are not {@link #named named}. */
    String ANONYMOUS = "anonymous";

    /**
     * @return name used in reports and logs; the simple class name, or
     *         {@link #ANONYMOUS} for lambdas and anonymous classes
     */
    default String getName() {
        Class<?> type = getClass();
        if (type.isSynthetic() || type.isAnonymousClass()) {
            return ANONYMOUS;
        }
        return type.getSimpleName();
    }

    /**
     * Attach a display name to a filter, typically a lambda.
     *
     * @param name     display name
     * @param delegate the filter
     * @return named filter
     */
    static Filter named(String name, Filter delegate) {
        Objects.requireNonNull(name, "Filter name must not be null");
        Objects.requireNonNull(delegate, "Filter must not be null");
        return new Filter() {
            @Override
            public void run(FilterContext context) throws Exception {
                delegate.run(context);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public String toString() {
                return "Filter[" + name + "]";
            }
        };
    }
}
