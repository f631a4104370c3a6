package com.locusfilter.core.filter;

import com.locusfilter.core.context.FilterContext;
import com.locusfilter.core.context.StreamRegistry;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.model.Measurement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ThresholdFilter}.
 */
class ThresholdFilterTest {

    private ThresholdFilter filter;

    @BeforeEach
    void setUp() {
        FilterDefinition definition = new FilterDefinition();
        definition.setName("high_snr");
        definition.setType("threshold");
        definition.setField("snr");
        definition.setThreshold(50.0);
        definition.setStream("high_snr");
        filter = new ThresholdFilter(definition);
    }

    @Test
    @DisplayName("Should send to stream when value exceeds threshold")
    void shouldPassWhenAboveThreshold() {
        FilterContext ctx = contextWith(Map.of("snr", 80.0));

        filter.run(ctx);

        assertThat(ctx.getNewStreams()).containsExactly("high_snr");
    }

    @Test
    @DisplayName("Should NOT pass when value equals threshold exactly")
    void shouldNotPassAtExactThreshold() {
        FilterContext ctx = contextWith(Map.of("snr", 50));

        filter.run(ctx);

        assertThat(ctx.getNewStreams()).isEmpty();
    }

    @Test
    @DisplayName("Should NOT pass when field is missing or not numeric")
    void shouldSkipMissingOrNonNumericField() {
        FilterContext missing = contextWith(Map.of("mag", 18.0));
        FilterContext text = contextWith(Map.of("snr", "high"));

        filter.run(missing);
        filter.run(text);

        assertThat(missing.getNewStreams()).isEmpty();
        assertThat(text.getNewStreams()).isEmpty();
    }

    @Test
    @DisplayName("Should compare downwards when direction is below")
    void shouldSupportBelowDirection() {
        FilterDefinition definition = new FilterDefinition();
        definition.setName("faint");
        definition.setType("threshold");
        definition.setField("snr");
        definition.setThreshold(5.0);
        definition.setDirection("BELOW");
        definition.setStream("high_snr");
        ThresholdFilter below = new ThresholdFilter(definition);
        FilterContext ctx = contextWith(Map.of("snr", 3));

        below.run(ctx);

        assertThat(ctx.getNewStreams()).containsExactly("high_snr");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private FilterContext contextWith(Map<String, ?> latestFields) {
        LocusData locus = new LocusData(1, List.of(
                new Measurement(1, 100.0, Map.of("snr", 1000.0)),
                new Measurement(2, 101.0, latestFields)), null);
        return new FilterContext(locus, StreamRegistry.of("high_snr"));
    }
}
