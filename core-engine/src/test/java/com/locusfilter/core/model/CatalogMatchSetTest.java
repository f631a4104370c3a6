package com.locusfilter.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CatalogMatchSet}.
 */
class CatalogMatchSetTest {

    @Test
    @DisplayName("Should drop catalogs without matches")
    void shouldDropEmptyCatalogs() {
        Map<String, List<Map<String, Object>>> raw = new HashMap<>();
        raw.put("ned", List.of(Map.of("name", "NGC 1")));
        raw.put("gaia_dr3", List.of());
        raw.put("sdss", null);

        CatalogMatchSet matches = new CatalogMatchSet(raw);

        assertThat(matches.getCatalogNames()).containsExactly("ned");
        assertThat(matches.hasMatch("gaia_dr3")).isFalse();
        assertThat(matches.asMap().values()).allSatisfy(records -> assertThat(records).isNotEmpty());
    }

    @Test
    @DisplayName("Should be unmodifiable")
    void shouldBeUnmodifiable() {
        CatalogMatchSet matches = new CatalogMatchSet(Map.of("ned", List.of(Map.of("name", "NGC 1"))));

        assertThatThrownBy(() -> matches.asMap().put("x", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> matches.asMap().get("ned").get(0).put("name", "other"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should treat null input as no matches")
    void shouldTreatNullAsEmpty() {
        assertThat(new CatalogMatchSet(null).isEmpty()).isTrue();
    }
}
