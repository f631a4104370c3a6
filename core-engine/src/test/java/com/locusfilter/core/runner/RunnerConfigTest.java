package com.locusfilter.core.runner;

import com.locusfilter.core.context.StreamRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunnerConfig}.
 */
class RunnerConfigTest {

    @Test
    @DisplayName("Should apply defaults")
    void shouldApplyDefaults() {
        RunnerConfig config = RunnerConfig.builder().streamRegistry(StreamRegistry.of("s")).build();

        assertThat(config.getInvocationTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.hasInvocationTimeout()).isTrue();
        assertThat(config.getBatchParallelism()).isPositive();
    }

    @Test
    @DisplayName("Should treat a zero timeout as no budget")
    void shouldTreatZeroAsUnlimited() {
        RunnerConfig config = RunnerConfig.builder()
                .streamRegistry(StreamRegistry.of("s"))
                .invocationTimeout(Duration.ZERO)
                .build();

        assertThat(config.hasInvocationTimeout()).isFalse();
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> RunnerConfig.builder().build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> RunnerConfig.builder()
                .streamRegistry(StreamRegistry.of("s"))
                .batchParallelism(0)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunnerConfig.builder()
                .streamRegistry(StreamRegistry.of("s"))
                .invocationTimeout(Duration.ofMillis(-1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
