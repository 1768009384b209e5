package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    private final DetectorFactory factory = new DetectorFactory();

    @Test
    @DisplayName("Should create VectorAnomalyDetector for type=vector")
    void shouldCreateVectorDetector() {
        DetectorConfig config = configOfType("test_detector", "vector");
        config.setPeriod(24);
        AnomalyDetector detector = factory.create(config);
        assertThat(detector).isInstanceOf(VectorAnomalyDetector.class);
        assertThat(detector.getName()).isEqualTo("test_detector");
    }

    @Test
    @DisplayName("Should create TimeSeriesAnomalyDetector for type=timeseries")
    void shouldCreateTimeSeriesDetector() {
        AnomalyDetector detector = factory.create(configOfType("test_detector", "TimeSeries"));
        assertThat(detector).isInstanceOf(TimeSeriesAnomalyDetector.class);
    }

    @Test
    @DisplayName("Should throw for unknown type and list the supported ones")
    void shouldThrowForUnknownType() {
        DetectorConfig config = configOfType("test_detector", "magic");
        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown detector type: 'magic'")
                .hasMessageContaining("vector, timeseries");
    }

    @Test
    @DisplayName("Should reject a vector profile without a period before building it")
    void shouldRequirePeriodForVector() {
        DetectorConfig config = configOfType("no_period", "vector");
        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("no_period")
                .hasMessageContaining("'period'");
    }

    @Test
    @DisplayName("Should reject a timeseries profile with a one-week median window")
    void shouldRequireTwoWeeksForTimeSeries() {
        DetectorConfig config = configOfType("short_window", "timeseries");
        config.setPiecewiseMedianPeriodWeeks(1);
        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("piecewiseMedianPeriodWeeks");
    }

    @Test
    @DisplayName("Should create one detector per configuration in an unmodifiable list")
    void shouldCreateAll() {
        DetectorConfig vector = configOfType("a", "vector");
        vector.setPeriod(7);
        List<AnomalyDetector> detectors = factory.createAll(List.of(vector, configOfType("b", "timeseries")));

        assertThat(detectors).extracting(AnomalyDetector::getName).containsExactly("a", "b");
        assertThatThrownBy(() -> detectors.add(detectors.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject two profiles with the same name")
    void shouldRejectDuplicateNames() {
        DetectorConfig vector = configOfType("same", "vector");
        vector.setPeriod(7);
        List<DetectorConfig> configs = List.of(configOfType("same", "timeseries"), vector);

        assertThatThrownBy(() -> factory.createAll(configs))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Duplicate detector name: 'same'");
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private DetectorConfig configOfType(String name, String type) {
        DetectorConfig config = new DetectorConfig();
        config.setName(name);
        config.setType(type);
        return config;
    }
}
