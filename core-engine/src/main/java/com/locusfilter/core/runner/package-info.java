/**
 * Filter invocation driver.
 *
 * <p>
 * {@link com.locusfilter.core.runner.FilterRunner} assembles a
 * {@link com.locusfilter.core.context.FilterContext}, invokes a
 * {@link com.locusfilter.core.runner.Filter} and returns a
 * {@link com.locusfilter.core.runner.FilterReport}. Batch runs return one
 * {@link com.locusfilter.core.runner.FilterOutcome} per input locus.
 * </p>
 *
 * @since 1.0.0
 */
package com.locusfilter.core.runner;
