package com.locusfilter.core.runner;

import com.locusfilter.core.context.FilterContext;
import com.locusfilter.core.context.StreamRegistry;
import com.locusfilter.core.exception.FilterExecutionException;
import com.locusfilter.core.exception.FilterTimeoutException;
import com.locusfilter.core.exception.LocusNotFoundException;
import com.locusfilter.core.exception.UnknownStreamException;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.model.Measurement;
import com.locusfilter.core.source.InMemoryLocusDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FilterRunner}.
 */
class FilterRunnerTest {

    private static final StreamRegistry STREAMS = StreamRegistry.of("high_snr", "extragalactic");

    private InMemoryLocusDataSource source;
    private FilterRunner runner;

    @BeforeEach
    void setUp() {
        source = new InMemoryLocusDataSource()
                .put(locus(1, 18.0))
                .put(locus(2, 17.0))
                .put(locus(3, 16.0));
        runner = new FilterRunner(config(Duration.ofSeconds(5)), source);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    @DisplayName("Should report properties and streams recorded by the filter")
    void shouldReportRecordedOutput() {
        Filter filter = Filter.named("bright", ctx -> {
            ctx.setProperty("peak_mag", 16.5);
            ctx.sendToStream("high_snr");
            ctx.sendToStream("high_snr");
        });

        FilterReport report = runner.run(1, filter);

        assertThat(report.getLocusId()).isEqualTo(1);
        assertThat(report.getAlertId()).isEqualTo(12);
        assertThat(report.getFilterName()).isEqualTo("bright");
        assertThat(report.getNewProperties()).containsExactly(Map.entry("peak_mag", 16.5));
        assertThat(report.getNewStreams()).containsExactly("high_snr");
        assertThat(report.getContext().isSealed()).isTrue();
    }

    @Test
    @DisplayName("Should invoke the filter exactly once")
    void shouldInvokeOnce() {
        int[] calls = {0};

        runner.run(1, ctx -> calls[0]++);

        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    @DisplayName("Should run against the requested triggering alert")
    void shouldRunAgainstRequestedAlert() {
        FilterReport report = runner.run(1, 11, ctx -> ctx.setProperty("seen", ctx.getProperties().get("mag")));

        assertThat(report.getAlertId()).isEqualTo(11);
        assertThat(report.getNewProperties()).containsEntry("seen", 18.5);
    }

    @Test
    @DisplayName("Should wrap filter failures with the cause attached")
    void shouldWrapFilterFailures() {
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> runner.run(1, Filter.named("broken", ctx -> {
            throw boom;
        })))
                .isInstanceOf(FilterExecutionException.class)
                .hasMessageContaining("broken")
                .hasCause(boom);
    }

    @Test
    @DisplayName("Should keep the original error kind as cause of a usage error")
    void shouldWrapUsageErrors() {
        assertThatThrownBy(() -> runner.run(1, ctx -> ctx.sendToStream("nonexistent_stream")))
                .isInstanceOf(FilterExecutionException.class)
                .hasCauseInstanceOf(UnknownStreamException.class);
    }

    @Test
    @DisplayName("Should time out a filter that exceeds its budget")
    void shouldTimeOutSlowFilter() {
        AtomicReference<FilterContext> escaped = new AtomicReference<>();
        CountDownLatch never = new CountDownLatch(1);
        try (FilterRunner strict = new FilterRunner(config(Duration.ofMillis(100)), source)) {
            assertThatThrownBy(() -> strict.run(1, ctx -> {
                escaped.set(ctx);
                never.await(10, TimeUnit.SECONDS);
            }))
                    .isInstanceOf(FilterTimeoutException.class)
                    .hasMessageContaining("100 ms");
        }
        assertThat(escaped.get().isSealed()).isTrue();
    }

    @Test
    @DisplayName("Should run inline when no budget is configured")
    void shouldRunInlineWithoutBudget() {
        Thread caller = Thread.currentThread();
        AtomicReference<Thread> seen = new AtomicReference<>();
        try (FilterRunner inline = new FilterRunner(config(Duration.ZERO), source)) {
            inline.run(1, ctx -> seen.set(Thread.currentThread()));
        }
        assertThat(seen.get()).isSameAs(caller);
    }

    @Test
    @DisplayName("Should surface a missing locus")
    void shouldSurfaceMissingLocus() {
        assertThatThrownBy(() -> runner.run(404, ctx -> { }))
                .isInstanceOf(LocusNotFoundException.class);
    }

    @Test
    @DisplayName("Should require a data source for id-based runs")
    void shouldRequireDataSource() {
        try (FilterRunner noSource = new FilterRunner(config(Duration.ZERO))) {
            assertThat(noSource.run(locus(9, 15.0), ctx -> { }).getLocusId()).isEqualTo(9);
            assertThatThrownBy(() -> noSource.run(9, ctx -> { }))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    // ------------------------------------------------------------------
    // Batch
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should isolate a failing locus in an index-aligned batch")
    void shouldIsolateBatchFailure() {
        Filter filter = ctx -> {
            if (ctx.getLocusId() == 2) {
                throw new IllegalArgumentException("bad locus");
            }
            ctx.sendToStream("extragalactic");
        };

        List<FilterOutcome> outcomes = runner.runBatch(List.of(1L, 2L, 3L), filter);

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(0).getReport().getLocusId()).isEqualTo(1);
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).getLocusId()).isEqualTo(2);
        assertThat(outcomes.get(1).getError()).isInstanceOf(FilterExecutionException.class);
        assertThat(outcomes.get(2).getReport().getNewStreams()).containsExactly("extragalactic");
    }

    @Test
    @DisplayName("An Error thrown inline should fail only its own batch slot")
    void shouldIsolateErrorInline() {
        try (FilterRunner inline = new FilterRunner(config(Duration.ZERO), source)) {
            assertErrorIsolated(inline.runBatch(List.of(1L, 2L, 3L), failingWithErrorOn(2)));
        }
    }

    @Test
    @DisplayName("An Error thrown under a budget should fail only its own batch slot")
    void shouldIsolateErrorWithBudget() {
        assertErrorIsolated(runner.runBatch(List.of(1L, 2L, 3L), failingWithErrorOn(2)));
    }

    @Test
    @DisplayName("A single run should wrap an Error from the filter")
    void shouldWrapErrorOnSingleRun() {
        assertThatThrownBy(() -> runner.run(1, failingWithErrorOn(1)))
                .isInstanceOf(FilterExecutionException.class)
                .hasCauseInstanceOf(AssertionError.class);
    }

    @Test
    @DisplayName("Should preserve input order and report missing loci")
    void shouldPreserveOrder() {
        List<FilterOutcome> outcomes = runner.runBatch(List.of(3L, 404L, 1L, 3L),
                ctx -> ctx.setProperty("id", ctx.getLocusId()));

        assertThat(outcomes).extracting(FilterOutcome::getLocusId).containsExactly(3L, 404L, 1L, 3L);
        assertThat(outcomes.get(1).getError()).isInstanceOf(LocusNotFoundException.class);
        assertThat(outcomes.get(3).getReport().getNewProperties()).containsEntry("id", 3L);
    }

    @Test
    @DisplayName("Should not expose a report on a failed outcome")
    void shouldGuardOutcomeAccessors() {
        List<FilterOutcome> outcomes = runner.runBatch(List.of(404L, 1L), ctx -> { });

        assertThatThrownBy(() -> outcomes.get(0).getReport()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> outcomes.get(1).getError()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A sub-millisecond budget should still be waited for")
    void shouldHonourSubMillisecondBudget() {
        Duration budget = Duration.ofNanos(500_000);
        CountDownLatch never = new CountDownLatch(1);
        try (FilterRunner tight = new FilterRunner(config(budget), source)) {
            long start = System.nanoTime();
            assertThatThrownBy(() -> tight.run(1, ctx -> never.await()))
                    .isInstanceOf(FilterTimeoutException.class);
            assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(budget.toNanos());
        }
    }

    @Test
    @DisplayName("Should stamp the report with the invocation start time")
    void shouldStampEvaluationTime() {
        Instant before = Instant.now();
        FilterReport report = runner.run(1, ctx -> { });
        Instant after = Instant.now();

        assertThat(report.getEvaluatedAt()).isBetween(before, after);
    }

    @Test
    @DisplayName("Lambdas should report a stable name")
    void shouldNameLambdasAnonymous() {
        FilterReport report = runner.run(1, ctx -> { });

        assertThat(report.getFilterName()).isEqualTo(Filter.ANONYMOUS);
    }

    @Test
    @DisplayName("Should reject batches once closed")
    void shouldRejectBatchAfterClose() {
        FilterRunner closed = new FilterRunner(config(Duration.ZERO), source);
        closed.close();

        assertThatThrownBy(() -> closed.runBatch(List.of(1L), ctx -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Filter failingWithErrorOn(long locusId) {
        return ctx -> {
            if (ctx.getLocusId() == locusId) {
                throw new AssertionError("assertion failed in filter");
            }
            ctx.sendToStream("high_snr");
        };
    }

    private static void assertErrorIsolated(List<FilterOutcome> outcomes) {
        assertThat(outcomes).hasSize(3);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).getError())
                .isInstanceOf(FilterExecutionException.class)
                .hasCauseInstanceOf(AssertionError.class);
        assertThat(outcomes.get(2).getReport().getNewStreams()).containsExactly("high_snr");
    }

    private static RunnerConfig config(Duration timeout) {
        return RunnerConfig.builder()
                .streamRegistry(STREAMS)
                .invocationTimeout(timeout)
                .batchParallelism(2)
                .build();
    }

    private static LocusData locus(long id, double latestMag) {
        return new LocusData(id, List.of(
                new Measurement(10, 100.0, Map.of("fid", 1, "mag", 19.0)),
                new Measurement(11, 101.0, Map.of("fid", 2, "mag", 18.5)),
                new Measurement(12, 102.0, Map.of("fid", 1, "mag", latestMag))), null);
    }
}
