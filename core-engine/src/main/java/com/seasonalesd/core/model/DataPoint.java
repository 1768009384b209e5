package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single (timestamp, value) observation.
 *
 * <p>
 * The timestamp is either a plain ordinal index or epoch milliseconds,
 * depending on the {@link TimestampType} of the owning {@link TimeSeries}.
 * A value of {@link Double#NaN} marks a missing observation.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final double value;

    public DataPoint(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Create a point with no observation at the given timestamp.
     *
     * @param timestamp the timestamp
     * @return a missing point
     */
    public static DataPoint missing(long timestamp) {
        return new DataPoint(timestamp, Double.NaN);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    /**
     * @return {@code true} if this point carries no observation
     */
    public boolean isMissing() {
        return Double.isNaN(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "DataPoint{" + timestamp + "=" + value + '}';
    }
}
