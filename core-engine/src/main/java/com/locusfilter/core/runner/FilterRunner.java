package com.locusfilter.core.runner;

import com.locusfilter.core.context.FilterContext;
import com.locusfilter.core.exception.FilterException;
import com.locusfilter.core.exception.FilterExecutionException;
import com.locusfilter.core.exception.FilterTimeoutException;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.source.LocusDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs filters against loci and reports what they recorded.
 *
 * <h3>Single invocation</h3>
 * <p>
 * {@link #run(LocusData, Filter)} builds a fresh {@link FilterContext},
 * invokes the filter exactly once, seals the context and returns a
 * {@link FilterReport}. Nothing is persisted or published; the caller commits
 * the report.
 * </p>
 *
 * <h3>Time budget</h3>
 * <p>
 * When {@link RunnerConfig#hasInvocationTimeout()} is set, the filter runs on
 * a worker thread and the caller blocks for at most the budget. A filter that
 * overruns is interrupted and reported as {@link FilterTimeoutException}.
 * Without a budget the filter runs inline on the caller thread.
 * </p>
 *
 * <h3>Batches</h3>
 * <p>
 * {@link #runBatch(List, Filter)} runs every locus independently on a pool of
 * {@link RunnerConfig#getBatchParallelism()} threads. The result is aligned
 * with the input: slot {@code i} holds the outcome for {@code locusIds[i]},
 * including any failure.
 * </p>
 *
 * <p>
 * Instances are thread-safe. Close the runner to release its threads.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FilterRunner.class);

    private final RunnerConfig config;
    private final LocusDataSource dataSource;
    private final ExecutorService invocationPool;
    private ExecutorService batchPool;

    /**
     * Create a runner that only accepts preassembled {@link LocusData}.
     *
     * @param config runner configuration
     */
    public FilterRunner(RunnerConfig config) {
        this(config, null);
    }

    /**
     * @param config     runner configuration
     * @param dataSource source used by the id-based methods; may be
     *                   {@code null}
     */
    public FilterRunner(RunnerConfig config, LocusDataSource dataSource) {
        this.config = Objects.requireNonNull(config, "RunnerConfig must not be null");
        this.dataSource = dataSource;
        this.invocationPool = Executors.newCachedThreadPool(daemonThreads("filter-invocation"));
        LOG.info("FilterRunner created with {}", config);
    }

    // ---------------------------------------------------------------
    // Single invocation
    // ---------------------------------------------------------------

    /**
     * Run a filter against preassembled locus data.
     *
     * @param locus  locus data
     * @param filter the filter
     * @return report of recorded properties and streams
     * @throws FilterExecutionException if the filter threw
     * @throws FilterTimeoutException   if the filter exceeded its budget
     */
    public FilterReport run(LocusData locus, Filter filter) {
        Objects.requireNonNull(locus, "LocusData must not be null");
        Objects.requireNonNull(filter, "Filter must not be null");

        String name = filter.getName();
        FilterContext context = new FilterContext(locus, config.getStreamRegistry());
        Instant evaluatedAt = Instant.now();
        long startNanos = System.nanoTime();
        try {
            invoke(filter, name, context);
        } finally {
            context.seal();
        }

        FilterReport report = new FilterReport(name, context, evaluatedAt);
        LOG.debug("Filter [{}] ran on locus {} alert {} in {} us: properties={} streams={}",
                name, report.getLocusId(), report.getAlertId(),
                (System.nanoTime() - startNanos) / 1_000,
                report.getNewProperties().keySet(), report.getNewStreams());
        return report;
    }

    /**
     * Load a locus from the data source and run a filter against it.
     *
     * @param locusId locus identifier
     * @param filter  the filter
     * @return report of recorded properties and streams
     * @throws FilterException       if loading or running fails
     * @throws IllegalStateException if the runner has no data source
     */
    public FilterReport run(long locusId, Filter filter) {
        return run(requireDataSource().load(locusId), filter);
    }

    /**
     * Load a locus and run a filter as if the given alert had just arrived.
     *
     * @param locusId locus identifier
     * @param alertId triggering alert; must belong to the locus
     * @param filter  the filter
     * @return report of recorded properties and streams
     * @throws FilterException          if loading or running fails
     * @throws IllegalArgumentException if the alert is not part of the locus
     * @throws IllegalStateException    if the runner has no data source
     */
    public FilterReport run(long locusId, long alertId, Filter filter) {
        return run(requireDataSource().load(locusId).withTriggeringAlert(alertId), filter);
    }

    // ---------------------------------------------------------------
    // Batch
    // ---------------------------------------------------------------

    /**
     * Run a filter against many loci.
     *
     * @param locusIds loci to run against; may contain repeats
     * @param filter   the filter
     * @return one outcome per input id, in input order
     * @throws IllegalStateException if the runner has no data source or is
     *                               closed
     * @throws FilterException       if the calling thread is interrupted
     */
    public List<FilterOutcome> runBatch(List<Long> locusIds, Filter filter) {
        Objects.requireNonNull(locusIds, "Locus ids must not be null");
        Objects.requireNonNull(filter, "Filter must not be null");
        requireDataSource();
        ExecutorService pool = batchPool();

        List<Future<FilterOutcome>> futures = new ArrayList<>(locusIds.size());
        for (Long id : locusIds) {
            long locusId = Objects.requireNonNull(id, "Locus id must not be null");
            futures.add(pool.submit(() -> runIsolated(locusId, filter)));
        }

        List<FilterOutcome> outcomes = new ArrayList<>(futures.size());
        int failures = 0;
        for (int i = 0; i < futures.size(); i++) {
            FilterOutcome outcome = await(futures, i, locusIds.get(i));
            if (!outcome.isSuccess()) {
                failures++;
            }
            outcomes.add(outcome);
        }
        LOG.info("Batch of {} locus/loci finished with filter [{}]: {} failure(s)",
                outcomes.size(), filter.getName(), failures);
        return Collections.unmodifiableList(outcomes);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Release worker threads. Filters still running past their budget are
     * interrupted.
     */
    @Override
    public synchronized void close() {
        invocationPool.shutdownNow();
        if (batchPool != null) {
            batchPool.shutdown();
        }
        LOG.debug("FilterRunner closed");
    }

    public RunnerConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void invoke(Filter filter, String name, FilterContext context) {
        long locusId = context.getLocusId();
        if (!config.hasInvocationTimeout()) {
            try {
                filter.run(context);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                throw failed(name, locusId, e);
            }
            return;
        }

        Future<Object> future = invocationPool.submit(() -> {
            filter.run(context);
            return null;
        });
        try {
            future.get(config.getInvocationTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VirtualMachineError error) {
                throw error;
            }
            throw failed(name, locusId, cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            context.seal();
            LOG.warn("Filter [{}] timed out on locus {} after {} ms",
                    name, locusId, config.getInvocationTimeout().toMillis());
            throw new FilterTimeoutException(name, locusId, config.getInvocationTimeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FilterException("Interrupted while running filter '" + name
                    + "' on locus " + locusId, e);
        }
    }

    private FilterOutcome runIsolated(long locusId, Filter filter) {
        try {
            return FilterOutcome.success(run(locusId, filter));
        } catch (FilterException e) {
            return FilterOutcome.failure(locusId, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            LOG.warn("Unexpected failure on locus {}", locusId, e);
            return FilterOutcome.failure(locusId,
                    new FilterException("Unexpected failure on locus " + locusId + ": " + e, e));
        }
    }

    private static FilterExecutionException failed(String name, long locusId, Throwable cause) {
        LOG.warn("Filter [{}] failed on locus {}: {}", name, locusId, cause.toString());
        return new FilterExecutionException(name, locusId, cause);
    }

    private FilterOutcome await(List<Future<FilterOutcome>> futures, int index, long locusId) {
        try {
            return futures.get(index).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VirtualMachineError error) {
                cancelFrom(futures, index + 1);
                throw error;
            }
            return FilterOutcome.failure(locusId,
                    new FilterException("Unexpected failure on locus " + locusId + ": " + cause, cause));
        } catch (InterruptedException e) {
            cancelFrom(futures, index);
            Thread.currentThread().interrupt();
            throw new FilterException("Interrupted while waiting for batch results", e);
        }
    }

    private static void cancelFrom(List<Future<FilterOutcome>> futures, int index) {
        for (int i = index; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    // Created on first batch; single-locus callers never pay for it.
    private synchronized ExecutorService batchPool() {
        if (invocationPool.isShutdown()) {
            throw new IllegalStateException("FilterRunner is closed");
        }
        if (batchPool == null) {
            batchPool = Executors.newFixedThreadPool(config.getBatchParallelism(), daemonThreads("filter-batch"));
        }
        return batchPool;
    }

    private LocusDataSource requireDataSource() {
        if (dataSource == null) {
            throw new IllegalStateException("FilterRunner has no LocusDataSource configured");
        }
        return dataSource;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
