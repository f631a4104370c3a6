package com.locusfilter.core.filter;

import com.locusfilter.core.runner.Filter;

import java.io.Serializable;

/**
 * A {@link Filter} built from a {@link FilterDefinition}.
 *
 * <p>
 * Configured filters are stateless and {@link Serializable}, so a single
 * instance can be shared by every task of a streaming job.
 * </p>
 */
public interface ConfiguredFilter extends Filter, Serializable {

    /**
     * @return the name from the filter definition
     */
    @Override
    String getName();
}
