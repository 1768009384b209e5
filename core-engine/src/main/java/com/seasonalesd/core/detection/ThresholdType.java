package com.seasonalesd.core.detection;

import com.seasonalesd.core.stats.RobustStatistics;

import java.util.Locale;

/**
 * Post-filter keeping only anomalies at least as large as a statistic of the
 * per-period maxima of the series.
 *
 * @since 1.0.0
 */
public enum ThresholdType {

    NONE,
    MED_MAX,
    P95,
    P99;

    /**
     * @param periodicMaxima maximum value of each period (day or cycle)
     * @return the smallest value an anomaly may have, or negative infinity for
     *         {@link #NONE}
     */
    public double cutoff(double[] periodicMaxima) {
        return switch (this) {
            case NONE -> Double.NEGATIVE_INFINITY;
            case MED_MAX -> RobustStatistics.median(periodicMaxima);
            case P95 -> RobustStatistics.quantile(periodicMaxima, 0.95);
            case P99 -> RobustStatistics.quantile(periodicMaxima, 0.99);
        };
    }

    /**
     * Parse {@code none}, {@code med_max}, {@code p95} or {@code p99},
     * ignoring case; {@code null} means {@link #NONE}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ThresholdType parse(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "med_max" -> MED_MAX;
            case "p95" -> P95;
            case "p99" -> P99;
            default -> throw new IllegalArgumentException(
                    "Unknown threshold: '" + value + "'. Supported: none, med_max, p95, p99");
        };
    }
}
