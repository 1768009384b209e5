package com.seasonalesd.core.detection;

import java.util.Objects;

/**
 * Immutable (timestamp, residual) sequence examined by the ESD test.
 *
 * <p>
 * Removing a point yields a new instance one element shorter with the
 * remaining points in their original order; the receiver is left untouched.
 * </p>
 *
 * <p>
 * {@code resolution} is the smallest spread of residuals considered real:
 * a scale at or below it counts as zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkingSeries {

    private final long[] timestamps;
    private final double[] values;
    private final double resolution;

    private WorkingSeries(long[] timestamps, double[] values, double resolution) {
        this.timestamps = timestamps;
        this.values = values;
        this.resolution = resolution;
    }

    /**
     * @throws IllegalArgumentException if the arrays differ in length or the
     *                                  resolution is negative
     */
    public static WorkingSeries of(long[] timestamps, double[] values, double resolution) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("Got " + timestamps.length + " timestamps but "
                    + values.length + " values");
        }
        if (!(resolution >= 0)) {
            throw new IllegalArgumentException("resolution must be >= 0, got: " + resolution);
        }
        return new WorkingSeries(timestamps.clone(), values.clone(), resolution);
    }

    public static WorkingSeries of(long[] timestamps, double[] values) {
        return of(timestamps, values, 0);
    }

    public int size() {
        return values.length;
    }

    public long timestampAt(int index) {
        return timestamps[index];
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    public double getResolution() {
        return resolution;
    }

    /**
     * @return a copy of this series without the point at {@code index}
     */
    public WorkingSeries without(int index) {
        Objects.checkIndex(index, values.length);
        int n = values.length;
        long[] keptTimestamps = new long[n - 1];
        double[] keptValues = new double[n - 1];
        System.arraycopy(timestamps, 0, keptTimestamps, 0, index);
        System.arraycopy(timestamps, index + 1, keptTimestamps, index, n - index - 1);
        System.arraycopy(values, 0, keptValues, 0, index);
        System.arraycopy(values, index + 1, keptValues, index, n - index - 1);
        return new WorkingSeries(keptTimestamps, keptValues, resolution);
    }

    @Override
    public String toString() {
        return "WorkingSeries{size=" + values.length + ", resolution=" + resolution + '}';
    }
}
