package com.seasonalesd.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered sequence of {@link DataPoint}s.
 *
 * <p>
 * Timestamps are strictly increasing; construction fails with
 * {@link InvalidInputException} on duplicates or out-of-order points.
 * Missing observations ({@link Double#NaN} values) are allowed here and are
 * dealt with by the detection pipeline.
 * </p>
 *
 * <h3>Construction</h3>
 * <ul>
 * <li>{@link #ofValues(double...)}: ordinal series indexed 1..n</li>
 * <li>{@link #ofInstants(List, double[])}: date/time series</li>
 * <li>{@link #builder(TimestampType)}: point by point</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final TimestampType timestampType;
    private final List<DataPoint> points;

    private TimeSeries(TimestampType timestampType, List<DataPoint> points) {
        this.timestampType = Objects.requireNonNull(timestampType, "timestampType must not be null");
        Objects.requireNonNull(points, "points must not be null");
        for (int i = 1; i < points.size(); i++) {
            long previous = points.get(i - 1).getTimestamp();
            long current = points.get(i).getTimestamp();
            if (current <= previous) {
                throw new InvalidInputException(
                        "Timestamps must be strictly increasing, got " + previous + " followed by "
                                + current + " at position " + i);
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * Create an ordinal series whose timestamps are the 1-based positions of
     * the values.
     *
     * @param values observations, {@code NaN} for missing
     * @return a new series
     */
    public static TimeSeries ofValues(double... values) {
        Objects.requireNonNull(values, "values must not be null");
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(i + 1L, values[i]));
        }
        return new TimeSeries(TimestampType.INDEX, points);
    }

    /**
     * Create a date/time series.
     *
     * @param instants observation times, strictly increasing
     * @param values   observations, {@code NaN} for missing
     * @return a new series
     * @throws InvalidInputException if the two inputs differ in length
     */
    public static TimeSeries ofInstants(List<Instant> instants, double[] values) {
        Objects.requireNonNull(instants, "instants must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (instants.size() != values.length) {
            throw new InvalidInputException("Got " + instants.size() + " timestamps but "
                    + values.length + " values");
        }
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(instants.get(i).toEpochMilli(), values[i]));
        }
        return new TimeSeries(TimestampType.EPOCH_MILLIS, points);
    }

    public static Builder builder(TimestampType timestampType) {
        return new Builder(timestampType);
    }

    /**
     * Fluent builder appending points in timestamp order.
     */
    public static class Builder {
        private final TimestampType timestampType;
        private final List<DataPoint> points = new ArrayList<>();

        private Builder(TimestampType timestampType) {
            this.timestampType = timestampType;
        }

        public Builder add(long timestamp, double value) {
            points.add(new DataPoint(timestamp, value));
            return this;
        }

        public Builder add(Instant timestamp, double value) {
            return add(timestamp.toEpochMilli(), value);
        }

        public Builder add(DataPoint point) {
            points.add(Objects.requireNonNull(point, "point must not be null"));
            return this;
        }

        /**
         * @return the series
         * @throws InvalidInputException if timestamps are not strictly increasing
         */
        public TimeSeries build() {
            return new TimeSeries(timestampType, points);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public TimestampType getTimestampType() {
        return timestampType;
    }

    public boolean isDateTime() {
        return timestampType.isDateTime();
    }

    /**
     * @return unmodifiable view of the points
     */
    public List<DataPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public DataPoint get(int index) {
        return points.get(index);
    }

    public long[] timestamps() {
        long[] result = new long[points.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = points.get(i).getTimestamp();
        }
        return result;
    }

    public double[] values() {
        double[] result = new double[points.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = points.get(i).getValue();
        }
        return result;
    }

    /**
     * Positional slice {@code [fromIndex, toIndex)} with the same timestamp type.
     */
    public TimeSeries slice(int fromIndex, int toIndex) {
        return new TimeSeries(timestampType, points.subList(fromIndex, toIndex));
    }

    /**
     * A copy of this series without its missing observations.
     */
    public TimeSeries withoutMissing() {
        return new TimeSeries(timestampType, points.stream()
                .filter(p -> !p.isMissing())
                .toList());
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return timestampType == that.timestampType && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampType, points);
    }

    @Override
    public String toString() {
        return "TimeSeries{" +
                "type=" + timestampType +
                ", size=" + points.size() +
                '}';
    }
}
