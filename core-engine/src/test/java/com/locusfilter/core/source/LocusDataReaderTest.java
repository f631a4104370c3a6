package com.locusfilter.core.source;

import com.locusfilter.core.model.LocusData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LocusDataReader}.
 */
class LocusDataReaderTest {

    private final LocusDataReader reader = new LocusDataReader();

    @Test
    @DisplayName("Should parse measurements, matches and triggering alert")
    void shouldParseDocument() throws IOException {
        LocusData locus = read("{\"locus_id\": 7, \"alert_id\": 1,"
                + " \"measurements\": ["
                + "  {\"alert_id\": 2, \"mjd\": 101, \"fid\": 2, \"mag\": 17.5, \"band\": \"r\"},"
                + "  {\"alert_id\": 1, \"mjd\": 100.0, \"fid\": 1, \"mag\": null}],"
                + " \"catalog_matches\": {\"ned\": [{\"name\": \"NGC 1\", \"z\": 0.01}], \"sdss\": []}}");

        assertThat(locus.getLocusId()).isEqualTo(7);
        assertThat(locus.getAlertIds()).containsExactly(1L, 2L);
        assertThat(locus.getTriggeringMeasurement().getAlertId()).isEqualTo(1);
        assertThat(locus.getMeasurements().get(0).get("mag").isMissing()).isTrue();
        assertThat(locus.getMeasurements().get(1).get("fid").getValue()).isEqualTo(2L);
        assertThat(locus.getMeasurements().get(1).get("band").getValue()).isEqualTo("r");
        assertThat(locus.getCatalogMatches().getCatalogNames()).containsExactly("ned");
        assertThat(locus.getCatalogMatches().asMap().get("ned").get(0)).containsEntry("name", "NGC 1");
    }

    @Test
    @DisplayName("Should reject non-scalar measurement fields")
    void shouldRejectNonScalarFields() {
        assertThatThrownBy(() -> read("{\"locus_id\": 1, \"measurements\": ["
                + "{\"alert_id\": 1, \"mjd\": 1.0, \"cutout\": [1, 2]}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cutout");
    }

    @Test
    @DisplayName("Should reject a document without measurements")
    void shouldRejectMissingMeasurements() {
        assertThatThrownBy(() -> read("{\"locus_id\": 1}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("measurements");
        assertThatThrownBy(() -> read("{\"locus_id\": 1, \"measurements\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no measurements");
    }

    @Test
    @DisplayName("Should reject a measurement without a numeric mjd")
    void shouldRejectMissingMjd() {
        assertThatThrownBy(() -> read("{\"locus_id\": 1, \"measurements\": [{\"alert_id\": 1}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mjd");
    }

    private LocusData read(String json) throws IOException {
        return reader.read(json.getBytes(StandardCharsets.UTF_8));
    }
}
