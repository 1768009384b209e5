package com.seasonalesd.core.time;

import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.model.TimestampType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Granularity}.
 */
class GranularityTest {

    @Test
    @DisplayName("Should detect granularity from the first gap")
    void shouldDetectFromFirstGap() {
        assertThat(Granularity.detect(withGap(86_400_000L))).isEqualTo(Granularity.DAY);
        assertThat(Granularity.detect(withGap(3_600_000L))).isEqualTo(Granularity.HOUR);
        assertThat(Granularity.detect(withGap(300_000L))).isEqualTo(Granularity.MINUTE);
        assertThat(Granularity.detect(withGap(1_000L))).isEqualTo(Granularity.SECOND);
        assertThat(Granularity.detect(withGap(250L))).isEqualTo(Granularity.MILLISECOND);
    }

    @Test
    @DisplayName("Should map granularities to seasonal periods")
    void shouldMapPeriods() {
        assertThat(Granularity.MINUTE.period()).isEqualTo(1440);
        assertThat(Granularity.HOUR.period()).isEqualTo(24);
        assertThat(Granularity.DAY.period()).isEqualTo(7);
        assertThat(Granularity.HOUR).hasToString("hr");
    }

    @Test
    @DisplayName("Should have no period for millisecond data")
    void shouldRejectMillisecondPeriod() {
        assertThatThrownBy(Granularity.MILLISECOND::period)
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("'ms'");
    }

    @Test
    @DisplayName("Should require a date/time series with two observations")
    void shouldRejectUnsuitableSeries() {
        TimeSeries single = TimeSeries.builder(TimestampType.EPOCH_MILLIS).add(0L, 1.0).build();

        assertThatThrownBy(() -> Granularity.detect(TimeSeries.ofValues(1, 2, 3)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Granularity.detect(single))
                .isInstanceOf(InvalidInputException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static TimeSeries withGap(long gapMillis) {
        return TimeSeries.builder(TimestampType.EPOCH_MILLIS)
                .add(1_700_000_000_000L, 1.0)
                .add(1_700_000_000_000L + gapMillis, 2.0)
                .build();
    }
}
