package com.seasonalesd.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Location and scale estimators used by the ESD test.
 *
 * <p>
 * None of the methods modify their argument.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustStatistics {

    /**
     * Consistency constant making the MAD an estimator of the standard
     * deviation for normally distributed data.
     */
    public static final double MAD_SCALE = 1.4826;

    private RobustStatistics() {
        // utility class, not instantiable
    }

    /**
     * Median; the mean of the two middle values for an even count.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double median(double[] values) {
        requireNonEmpty(values);
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        return n % 2 == 0
                ? (sorted[n / 2 - 1] + sorted[n / 2]) / 2
                : sorted[n / 2];
    }

    /**
     * Median absolute deviation around the median, scaled by
     * {@value #MAD_SCALE}.
     *
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mad(double[] values) {
        double center = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return MAD_SCALE * median(deviations);
    }

    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator); zero for a single value.
     */
    public static double standardDeviation(double[] values) {
        double mean = mean(values);
        if (values.length < 2) {
            return 0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    /**
     * Sample quantile by linear interpolation between order statistics
     * ({@code h = (n - 1) p}).
     *
     * @param values     the sample
     * @param probability in [0, 1]
     * @throws IllegalArgumentException if the sample is empty or the
     *                                  probability is out of range
     */
    public static double quantile(double[] values, double probability) {
        requireNonEmpty(values);
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("probability must be in [0, 1], got: " + probability);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double h = (sorted.length - 1) * probability;
        int lower = (int) Math.floor(h);
        if (lower + 1 >= sorted.length) {
            return sorted[sorted.length - 1];
        }
        return sorted[lower] + (h - lower) * (sorted[lower + 1] - sorted[lower]);
    }

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
