package com.seasonalesd.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeries}.
 */
class TimeSeriesTest {

    @Test
    @DisplayName("Should index plain values from 1")
    void shouldIndexValuesFromOne() {
        TimeSeries series = TimeSeries.ofValues(3.0, 4.0, 5.0);

        assertThat(series.getTimestampType()).isEqualTo(TimestampType.INDEX);
        assertThat(series.isDateTime()).isFalse();
        assertThat(series.timestamps()).containsExactly(1L, 2L, 3L);
        assertThat(series.values()).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    @DisplayName("Should keep epoch milliseconds for instants")
    void shouldKeepEpochMillis() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        TimeSeries series = TimeSeries.ofInstants(List.of(start, start.plusSeconds(3600)), new double[] { 1, 2 });

        assertThat(series.isDateTime()).isTrue();
        assertThat(series.get(1).getTimestamp()).isEqualTo(start.toEpochMilli() + 3_600_000L);
    }

    @Test
    @DisplayName("Should reject duplicate and decreasing timestamps")
    void shouldRejectUnorderedTimestamps() {
        TimeSeries.Builder duplicate = TimeSeries.builder(TimestampType.INDEX).add(1, 1.0).add(1, 2.0);
        TimeSeries.Builder decreasing = TimeSeries.builder(TimestampType.INDEX).add(2, 1.0).add(1, 2.0);

        assertThatThrownBy(duplicate::build)
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("strictly increasing");
        assertThatThrownBy(decreasing::build).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should reject instants and values of different lengths")
    void shouldRejectLengthMismatch() {
        assertThatThrownBy(() -> TimeSeries.ofInstants(List.of(Instant.EPOCH), new double[] { 1, 2 }))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should drop missing observations and keep the timestamps of the rest")
    void shouldDropMissing() {
        TimeSeries series = TimeSeries.ofValues(Double.NaN, 1.0, 2.0, Double.NaN);

        TimeSeries present = series.withoutMissing();

        assertThat(present.timestamps()).containsExactly(2L, 3L);
        assertThat(present.getTimestampType()).isEqualTo(TimestampType.INDEX);
        assertThat(series.get(0).isMissing()).isTrue();
    }

    @Test
    @DisplayName("Should slice a contiguous range")
    void shouldSlice() {
        TimeSeries series = TimeSeries.ofValues(1, 2, 3, 4, 5);

        assertThat(series.slice(1, 4).values()).containsExactly(2.0, 3.0, 4.0);
    }
}
