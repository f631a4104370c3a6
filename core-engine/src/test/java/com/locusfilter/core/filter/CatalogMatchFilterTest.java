package com.locusfilter.core.filter;

import com.locusfilter.core.context.FilterContext;
import com.locusfilter.core.context.StreamRegistry;
import com.locusfilter.core.model.CatalogMatchSet;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.model.Measurement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CatalogMatchFilter}.
 */
class CatalogMatchFilterTest {

    private CatalogMatchFilter filter;

    @BeforeEach
    void setUp() {
        FilterDefinition definition = new FilterDefinition();
        definition.setName("extragalactic");
        definition.setType("catalog");
        definition.setCatalogs(List.of("2mass_xsc", "ned"));
        definition.setProperty("galaxy_matches");
        definition.setStream("extragalactic");
        filter = new CatalogMatchFilter(definition);
    }

    @Test
    @DisplayName("Should send to stream and count matched catalogs")
    void shouldPassOnListedCatalogMatch() {
        FilterContext ctx = contextWith(Map.of(
                "ned", List.of(Map.of("name", "NGC 1")),
                "2mass_xsc", List.of(Map.of("designation", "2MASX J1")),
                "gaia_dr3", List.of(Map.of("source_id", 7))));

        filter.run(ctx);

        assertThat(ctx.getNewStreams()).containsExactly("extragalactic");
        assertThat(ctx.getNewProperties()).containsEntry("galaxy_matches", 2L);
    }

    @Test
    @DisplayName("Should NOT pass when only unlisted catalogs match")
    void shouldNotPassOnUnlistedCatalogs() {
        FilterContext ctx = contextWith(Map.of("gaia_dr3", List.of(Map.of("source_id", 7))));

        filter.run(ctx);

        assertThat(ctx.getNewStreams()).isEmpty();
        assertThat(ctx.getNewProperties()).isEmpty();
    }

    @Test
    @DisplayName("Should NOT pass when a listed catalog has no matches")
    void shouldNotPassOnEmptyCatalog() {
        FilterContext ctx = contextWith(Map.of("ned", List.of()));

        filter.run(ctx);

        assertThat(ctx.getNewStreams()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a definition without catalogs")
    void shouldRejectEmptyCatalogList() {
        FilterDefinition definition = new FilterDefinition();
        definition.setName("nothing");
        definition.setType("catalog");
        definition.setStream("extragalactic");

        assertThatThrownBy(() -> new CatalogMatchFilter(definition))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private FilterContext contextWith(Map<String, List<Map<String, Object>>> matches) {
        LocusData locus = new LocusData(1, List.of(
                new Measurement(1, 100.0, Map.of()),
                new Measurement(2, 101.0, Map.of())), new CatalogMatchSet(matches));
        return new FilterContext(locus, StreamRegistry.of("extragalactic"));
    }
}
