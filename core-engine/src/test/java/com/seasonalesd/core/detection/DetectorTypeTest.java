package com.seasonalesd.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorType}.
 */
class DetectorTypeTest {

    @Test
    @DisplayName("Should resolve labels ignoring case and surrounding blanks")
    void shouldResolveLabels() {
        assertThat(DetectorType.parse("vector")).isEqualTo(DetectorType.VECTOR);
        assertThat(DetectorType.parse(" TimeSeries ")).isEqualTo(DetectorType.TIMESERIES);
        assertThat(DetectorType.TIMESERIES.label()).isEqualTo("timeseries");
    }

    @Test
    @DisplayName("Should reject unknown and missing labels")
    void shouldRejectUnknownLabels() {
        assertThatThrownBy(() -> DetectorType.parse("hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Supported types: vector, timeseries");
        assertThatThrownBy(() -> DetectorType.parse(null))
                .isInstanceOf(NullPointerException.class);
    }
}
