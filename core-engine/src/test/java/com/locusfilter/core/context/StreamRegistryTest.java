package com.locusfilter.core.context;

import com.locusfilter.core.exception.UnknownStreamException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StreamRegistry}.
 */
class StreamRegistryTest {

    @Test
    @DisplayName("Should accept registered streams and reject others")
    void shouldRequireRegisteredStreams() {
        StreamRegistry registry = StreamRegistry.of("high_snr", "extragalactic");

        assertThat(registry.require("high_snr")).isEqualTo("high_snr");
        assertThatThrownBy(() -> registry.require("nonexistent_stream"))
                .isInstanceOf(UnknownStreamException.class)
                .satisfies(e -> assertThat(((UnknownStreamException) e).getStreamName())
                        .isEqualTo("nonexistent_stream"));
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    @DisplayName("Should sort stream names")
    void shouldSortStreamNames() {
        assertThat(StreamRegistry.of(List.of("b", "a", "b")).getStreamNames()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should reject blank stream names")
    void shouldRejectBlankNames() {
        assertThatThrownBy(() -> StreamRegistry.of("ok", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
