package com.seasonalesd.core.time;

import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;

import java.util.Objects;

/**
 * Sampling granularity of a date/time series, detected from the gap between
 * its first two observations.
 *
 * @since 1.0.0
 */
public enum Granularity {

    MILLISECOND("ms", 0),
    SECOND("sec", 0),
    MINUTE("min", 1440),
    HOUR("hr", 24),
    DAY("day", 7);

    private static final long SECOND_MILLIS = 1_000L;
    private static final long MINUTE_MILLIS = 60 * SECOND_MILLIS;
    private static final long HOUR_MILLIS = 60 * MINUTE_MILLIS;
    private static final long DAY_MILLIS = 24 * HOUR_MILLIS;

    private final String label;
    private final int period;

    Granularity(String label, int period) {
        this.label = label;
        this.period = period;
    }

    /**
     * @return short name used in reports ({@code min}, {@code hr}, ...)
     */
    public String getLabel() {
        return label;
    }

    /**
     * Observations per seasonal cycle: a day of minutes or hours, a week of
     * days.
     *
     * @throws InvalidInputException for sub-minute granularities, which have
     *                               no seasonal period of their own
     */
    public int period() {
        if (period == 0) {
            throw new InvalidInputException("No seasonal period is defined for '" + label
                    + "' granularity");
        }
        return period;
    }

    /**
     * Detect the granularity of a date/time series.
     *
     * @param series a date/time series with at least two observations
     * @return the granularity
     * @throws InvalidInputException if the series is ordinal or too short
     */
    public static Granularity detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (!series.isDateTime()) {
            throw new InvalidInputException("Granularity is only defined for date/time series");
        }
        if (series.size() < 2) {
            throw new InvalidInputException("At least two observations are needed to detect granularity");
        }
        long gap = series.get(1).getTimestamp() - series.get(0).getTimestamp();
        if (gap >= DAY_MILLIS) {
            return DAY;
        }
        if (gap >= HOUR_MILLIS) {
            return HOUR;
        }
        if (gap >= MINUTE_MILLIS) {
            return MINUTE;
        }
        if (gap >= SECOND_MILLIS) {
            return SECOND;
        }
        return MILLISECOND;
    }

    @Override
    public String toString() {
        return label;
    }
}
