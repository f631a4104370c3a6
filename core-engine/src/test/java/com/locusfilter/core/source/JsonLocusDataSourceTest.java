package com.locusfilter.core.source;

import com.locusfilter.core.exception.LocusNotFoundException;
import com.locusfilter.core.model.LocusData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLocusDataSource}.
 */
class JsonLocusDataSourceTest {

    private final JsonLocusDataSource source = JsonLocusDataSource.fromClasspath("loci");

    @Test
    @DisplayName("Should load a sample locus from the classpath")
    void shouldLoadFromClasspath() {
        LocusData locus = source.load(1);

        assertThat(locus.getAlertIds()).containsExactly(1L, 2L);
        assertThat(locus.getTriggeringMeasurement().getAlertId()).isEqualTo(2);
        assertThat(locus.getCatalogMatches().getCatalogNames()).containsExactly("ned");
    }

    @Test
    @DisplayName("Should honour an explicit triggering alert")
    void shouldHonourTriggeringAlert() {
        assertThat(source.load(2).getTriggeringMeasurement().getAlertId()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should report an unknown locus")
    void shouldReportUnknownLocus() {
        assertThatThrownBy(() -> source.load(404))
                .isInstanceOf(LocusNotFoundException.class)
                .satisfies(e -> assertThat(((LocusNotFoundException) e).getLocusId()).isEqualTo(404));
    }

    @Test
    @DisplayName("Should reject a document holding another locus")
    void shouldRejectMismatchedLocusId() {
        assertThatThrownBy(() -> source.load(99))
                .isInstanceOf(LocusNotFoundException.class)
                .hasMessageContaining("holds locus 42");
    }

    @Test
    @DisplayName("Should load from a directory")
    void shouldLoadFromDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("5.json"),
                "{\"locus_id\": 5, \"measurements\": [{\"alert_id\": 1, \"mjd\": 1.0, \"mag\": 20}]}");
        JsonLocusDataSource fromDir = JsonLocusDataSource.fromDirectory(dir);

        assertThat(fromDir.load(5).getMeasurements()).hasSize(1);
        assertThatThrownBy(() -> fromDir.load(6)).isInstanceOf(LocusNotFoundException.class);
    }
}
