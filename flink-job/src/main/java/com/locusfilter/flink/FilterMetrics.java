package com.locusfilter.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for the filter job.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus);
 * the reporter itself is configured at cluster level.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code loci_processed_total} – loci run through every filter</li>
 *   <li>{@code reports_emitted_total} – non-empty reports published</li>
 *   <li>{@code filter_failures_total} – failed or timed-out invocations</li>
 *   <li>{@code filter_latency_ms} – histogram of per-locus latency</li>
 * </ul>
 */
public class FilterMetrics {

    private final Counter lociProcessed;
    private final Counter reportsEmitted;
    private final Counter filterFailures;
    private final Histogram filterLatency;

    public FilterMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("locus_filter");

        this.lociProcessed = group.counter("loci_processed_total");
        this.reportsEmitted = group.counter("reports_emitted_total");
        this.filterFailures = group.counter("filter_failures_total");
        this.filterLatency = group
                .histogram("filter_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementLociProcessed() {
        lociProcessed.inc();
    }

    public void incrementReportsEmitted() {
        reportsEmitted.inc();
    }

    public void incrementFilterFailures() {
        filterFailures.inc();
    }

    public void recordLatency(long milliseconds) {
        filterLatency.update(milliseconds);
    }
}
