package com.seasonalesd.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a single anomaly detector loaded from configuration.
 *
 * <p>
 * Supported detector types:
 * </p>
 * <ul>
 * <li>{@code vector}: ordinal series with an explicit {@code period}</li>
 * <li>{@code timeseries}: date/time series; the period follows from the
 * sampling granularity</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all settings for the declared type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Largest fraction of the data that may be flagged. */
    public static final double MAX_ANOMS_LIMIT = 0.49;

    private static final Set<String> DIRECTIONS = Set.of("pos", "neg", "both");
    private static final Set<String> THRESHOLDS = Set.of("none", "med_max", "p95", "p99");

    /** Unique detector name used in reports and logs. */
    private String name;

    /** Detector type: "vector" or "timeseries". */
    private String type;

    // --- Test settings ---
    /** Maximum fraction of observations reported as anomalous. */
    private double maxAnoms = 0.10;

    /** "pos", "neg" or "both". */
    private String direction = "pos";

    /** Significance level. */
    private double alpha = 0.05;

    // --- Vector fields ---
    /** Observations per seasonal cycle. */
    private Integer period;

    /** Observations per independently tested chunk; whole series when unset. */
    private Integer longtermPeriod;

    // --- Time series fields ---
    /** Test the series in chunks of {@link #piecewiseMedianPeriodWeeks} weeks. */
    private boolean longterm;

    private int piecewiseMedianPeriodWeeks = 2;

    // --- Reporting ---
    /** "period" (vector), "day" or "hr" (timeseries); report everything when unset. */
    private String onlyLast;

    /** "none", "med_max", "p95" or "p99". */
    private String threshold = "none";

    /** Attach the expected value to every anomaly. */
    private boolean expectedValues;

    private boolean verbose;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all settings for the declared type are present and
     * contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Detector 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Detector 'type' is required");
        }
        if (maxAnoms < 0 || maxAnoms > MAX_ANOMS_LIMIT) {
            errors.add("Detector '" + name + "' requires 'maxAnoms' in [0, " + MAX_ANOMS_LIMIT + "], got: "
                    + maxAnoms);
        }
        if (!(alpha > 0 && alpha < 1)) {
            errors.add("Detector '" + name + "' requires 'alpha' in (0, 1), got: " + alpha);
        }
        if (direction == null || !DIRECTIONS.contains(direction.toLowerCase(Locale.ROOT))) {
            errors.add("Detector '" + name + "' has unknown 'direction': '" + direction
                    + "'. Supported: pos, neg, both");
        }
        if (threshold != null && !THRESHOLDS.contains(threshold.toLowerCase(Locale.ROOT))) {
            errors.add("Detector '" + name + "' has unknown 'threshold': '" + threshold
                    + "'. Supported: none, med_max, p95, p99");
        }

        if (type != null) {
            String last = onlyLast != null ? onlyLast.toLowerCase(Locale.ROOT) : null;
            switch (type.toLowerCase(Locale.ROOT)) {
                case "vector" -> {
                    if (period == null || period < 2) {
                        errors.add("Vector detector '" + name + "' requires 'period' >= 2");
                    }
                    if (longtermPeriod != null && period != null && longtermPeriod < 2 * period) {
                        errors.add("Vector detector '" + name
                                + "' requires 'longtermPeriod' >= 2 * period, got: " + longtermPeriod);
                    }
                    if (last != null && !last.equals("none") && !last.equals("period")) {
                        errors.add("Vector detector '" + name + "' supports 'onlyLast: period' only");
                    }
                }
                case "timeseries" -> {
                    if (piecewiseMedianPeriodWeeks < 2) {
                        errors.add("Timeseries detector '" + name
                                + "' requires 'piecewiseMedianPeriodWeeks' >= 2");
                    }
                    if (last != null && !last.equals("none") && !last.equals("day") && !last.equals("hr")) {
                        errors.add("Timeseries detector '" + name + "' supports 'onlyLast' of day or hr");
                    }
                }
                default -> errors.add("Unknown detector type: '" + type
                        + "'. Supported: vector, timeseries");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the detector type, normalised to lowercase.
     *
     * @param type detector type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getMaxAnoms() {
        return maxAnoms;
    }

    public void setMaxAnoms(double maxAnoms) {
        this.maxAnoms = maxAnoms;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public Integer getPeriod() {
        return period;
    }

    public void setPeriod(Integer period) {
        this.period = period;
    }

    public Integer getLongtermPeriod() {
        return longtermPeriod;
    }

    public void setLongtermPeriod(Integer longtermPeriod) {
        this.longtermPeriod = longtermPeriod;
    }

    public boolean isLongterm() {
        return longterm;
    }

    public void setLongterm(boolean longterm) {
        this.longterm = longterm;
    }

    public int getPiecewiseMedianPeriodWeeks() {
        return piecewiseMedianPeriodWeeks;
    }

    public void setPiecewiseMedianPeriodWeeks(int piecewiseMedianPeriodWeeks) {
        this.piecewiseMedianPeriodWeeks = piecewiseMedianPeriodWeeks;
    }

    public String getOnlyLast() {
        return onlyLast;
    }

    public void setOnlyLast(String onlyLast) {
        this.onlyLast = onlyLast;
    }

    public String getThreshold() {
        return threshold;
    }

    public void setThreshold(String threshold) {
        this.threshold = threshold;
    }

    public boolean isExpectedValues() {
        return expectedValues;
    }

    public void setExpectedValues(boolean expectedValues) {
        this.expectedValues = expectedValues;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", maxAnoms=" + maxAnoms +
                ", direction='" + direction + '\'' +
                ", alpha=" + alpha +
                ", period=" + period +
                ", longtermPeriod=" + longtermPeriod +
                ", longterm=" + longterm +
                ", piecewiseMedianPeriodWeeks=" + piecewiseMedianPeriodWeeks +
                ", onlyLast='" + onlyLast + '\'' +
                ", threshold='" + threshold + '\'' +
                ", expectedValues=" + expectedValues +
                '}';
    }
}
