package com.seasonalesd.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Additive seasonal-trend decomposition of a series:
 * {@code value[i] = seasonal[i] + trend[i] + remainder[i]}.
 *
 * <p>
 * The three components are aligned and of equal length. Arrays are copied
 * on the way in and on the way out.
 * </p>
 *
 * @since 1.0.0
 */
public final class DecompositionResult {

    private final double[] seasonal;
    private final double[] trend;
    private final double[] remainder;

    /**
     * @throws IllegalArgumentException if the components differ in length
     */
    public DecompositionResult(double[] seasonal, double[] trend, double[] remainder) {
        Objects.requireNonNull(seasonal, "seasonal must not be null");
        Objects.requireNonNull(trend, "trend must not be null");
        Objects.requireNonNull(remainder, "remainder must not be null");
        if (seasonal.length != trend.length || trend.length != remainder.length) {
            throw new IllegalArgumentException("Decomposition components must be aligned, got lengths "
                    + seasonal.length + ", " + trend.length + ", " + remainder.length);
        }
        this.seasonal = seasonal.clone();
        this.trend = trend.clone();
        this.remainder = remainder.clone();
    }

    public int size() {
        return seasonal.length;
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getRemainder() {
        return remainder.clone();
    }

    public double seasonalAt(int index) {
        return seasonal[index];
    }

    public double trendAt(int index) {
        return trend[index];
    }

    public double remainderAt(int index) {
        return remainder[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DecompositionResult that))
            return false;
        return Arrays.equals(seasonal, that.seasonal)
                && Arrays.equals(trend, that.trend)
                && Arrays.equals(remainder, that.remainder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(seasonal), Arrays.hashCode(trend), Arrays.hashCode(remainder));
    }

    @Override
    public String toString() {
        return "DecompositionResult{size=" + seasonal.length + '}';
    }
}
