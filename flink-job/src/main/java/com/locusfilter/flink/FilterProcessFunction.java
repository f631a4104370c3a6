package com.locusfilter.flink;

import com.locusfilter.core.exception.FilterException;
import com.locusfilter.core.filter.ConfiguredFilter;
import com.locusfilter.core.filter.FilterDefinition;
import com.locusfilter.core.filter.FilterFactory;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.runner.FilterReport;
import com.locusfilter.core.runner.FilterRunner;
import com.locusfilter.core.runner.RunnerConfig;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs every configured filter
 * against each incoming locus.
 *
 * <p>
 * Filters are stateless between loci, so no keyed state is kept: each
 * invocation gets a fresh context from the {@link FilterRunner}. Keying by
 * locus id only pins all updates of one locus to the same subtask.
 * </p>
 *
 * <p>
 * A failing or timed-out filter is logged and counted; the remaining filters
 * still run on the same locus. Reports without new properties or streams are
 * not emitted.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterProcessFunction
        extends KeyedProcessFunction<Long, LocusData, FilterReport> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FilterProcessFunction.class);

    private final List<FilterDefinition> definitions;
    private final RunnerConfig runnerConfig;

    private transient List<ConfiguredFilter> filters;
    private transient FilterRunner runner;
    private transient FilterMetrics metrics;

    /**
     * @param definitions  the filters to run; must not be {@code null} or empty
     * @param runnerConfig stream registry and invocation budget for the runner
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if {@code definitions} is empty
     */
    public FilterProcessFunction(List<FilterDefinition> definitions, RunnerConfig runnerConfig) {
        Objects.requireNonNull(definitions, "Filter definitions must not be null");
        if (definitions.isEmpty()) {
            throw new IllegalArgumentException("Filter definitions must not be empty");
        }
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.runnerConfig = Objects.requireNonNull(runnerConfig, "RunnerConfig must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        filters = FilterFactory.createAll(definitions);
        runner = new FilterRunner(runnerConfig);
        metrics = new FilterMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("FilterProcessFunction opened with {} filter(s), config={}",
                filters.size(), runnerConfig);
    }

    @Override
    public void close() {
        LOG.info("FilterProcessFunction closing");
        if (runner != null) {
            runner.close();
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(LocusData locus,
            KeyedProcessFunction<Long, LocusData, FilterReport>.Context ctx,
            Collector<FilterReport> out) {
        long startNanos = System.nanoTime();

        for (ConfiguredFilter filter : filters) {
            try {
                FilterReport report = runner.run(locus, filter);
                if (!report.isEmpty()) {
                    out.collect(report);
                    metrics.incrementReportsEmitted();
                    LOG.debug("Report emitted: filter={} locus={} streams={}",
                            report.getFilterName(), report.getLocusId(), report.getNewStreams());
                }
            } catch (FilterException e) {
                metrics.incrementFilterFailures();
                LOG.error("Filter [{}] failed on locus {} – continuing with next filter",
                        filter.getName(), locus.getLocusId(), e);
            }
        }

        metrics.incrementLociProcessed();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }
}
