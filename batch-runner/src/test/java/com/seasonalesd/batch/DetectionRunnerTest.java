package com.seasonalesd.batch;

import com.seasonalesd.core.detection.AnomalyDetector;
import com.seasonalesd.core.model.Anomaly;
import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionRunner}.
 */
class DetectionRunnerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("Should keep running the remaining detectors when one throws")
    void shouldIsolateFailingDetector() {
        DetectionRunner runner = new DetectionRunner(
                List.of(failing("broken"), fixed("ok", 3L)), CLOCK);

        BatchResult result = runner.run("series.json", TimeSeries.ofValues(1, 2, 3, 4));

        assertThat(result.getGeneratedAt()).isEqualTo(NOW);
        assertThat(result.getInput()).isEqualTo("series.json");
        assertThat(result.getObservations()).isEqualTo(4);
        assertThat(result.getReports()).extracting(AnomalyReport::getDetectorName).containsExactly("ok");
        assertThat(result.getReports().get(0).anomalyTimestamps()).containsExactly(3L);
        assertThat(result.getFailures()).containsExactly(new DetectorFailure("broken", "boom"));
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    @DisplayName("Should succeed when every detector reports")
    void shouldSucceedWhenAllDetectorsReport() {
        DetectionRunner runner = new DetectionRunner(List.of(fixed("a", 1L), fixed("b", 2L)), CLOCK);

        BatchResult result = runner.run("-", TimeSeries.ofValues(1, 2));

        assertThat(runner.detectorCount()).isEqualTo(2);
        assertThat(result.getReports()).hasSize(2);
        assertThat(result.isSuccessful()).isTrue();
    }

    @Test
    @DisplayName("Should build detectors from configuration")
    void shouldCreateDetectorsFromConfig() {
        DetectorConfig config = new DetectorConfig();
        config.setName("vec");
        config.setType("vector");
        config.setPeriod(24);

        assertThat(new DetectionRunner(List.of(config)).detectorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a missing or empty detector list")
    void shouldRejectEmptyConfiguration() {
        assertThatThrownBy(() -> new DetectionRunner(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> new DetectionRunner(null))
                .isInstanceOf(NullPointerException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnomalyDetector failing(String name) {
        return new AnomalyDetector() {
            @Override
            public AnomalyReport detect(TimeSeries series) {
                throw new IllegalStateException("boom");
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    private static AnomalyDetector fixed(String name, long timestamp) {
        return new AnomalyDetector() {
            @Override
            public AnomalyReport detect(TimeSeries series) {
                return AnomalyReport.builder()
                        .detectorName(name)
                        .anomalies(List.of(new Anomaly(timestamp, null, 9.0, null)))
                        .build();
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }
}
