package com.seasonalesd.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfig#validate()}.
 */
class DetectorConfigTest {

    @Test
    @DisplayName("Should accept a complete vector detector")
    void shouldAcceptVector() {
        DetectorConfig config = vector("v", 24);
        config.setLongtermPeriod(168);
        config.setOnlyLast("period");

        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should require a period for vector detectors")
    void shouldRequirePeriod() {
        DetectorConfig config = vector("v", null);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'period'");
    }

    @Test
    @DisplayName("Should reject a longterm period shorter than two periods")
    void shouldRejectShortLongtermPeriod() {
        DetectorConfig config = vector("v", 24);
        config.setLongtermPeriod(30);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("longtermPeriod");
    }

    @Test
    @DisplayName("Should reject maxAnoms above 0.49")
    void shouldRejectLargeMaxAnoms() {
        DetectorConfig config = vector("v", 24);
        config.setMaxAnoms(0.5);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxAnoms");
    }

    @Test
    @DisplayName("Should collect every problem into one message")
    void shouldCollectAllErrors() {
        DetectorConfig config = new DetectorConfig();
        config.setType("timeseries");
        config.setDirection("up");
        config.setThreshold("p50");
        config.setOnlyLast("period");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'name' is required")
                .hasMessageContaining("direction")
                .hasMessageContaining("threshold")
                .hasMessageContaining("onlyLast");
    }

    @Test
    @DisplayName("Should reject an unknown type")
    void shouldRejectUnknownType() {
        DetectorConfig config = new DetectorConfig();
        config.setName("x");
        config.setType("Prophet");

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown detector type: 'prophet'");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorConfig vector(String name, Integer period) {
        DetectorConfig config = new DetectorConfig();
        config.setName(name);
        config.setType("vector");
        config.setPeriod(period);
        return config;
    }
}
