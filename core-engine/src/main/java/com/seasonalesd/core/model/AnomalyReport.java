package com.seasonalesd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of running one configured detector over a series.
 *
 * <p>
 * Anomalies are ordered by timestamp. The expected series covers every
 * observation that went through the test.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code detectorName} is required; omitting it
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String detectorName;
    private final int period;
    private final String granularity;
    private final List<Anomaly> anomalies;
    private final List<ExpectedValue> expected;

    private AnomalyReport(Builder builder) {
        this.detectorName = Objects.requireNonNull(builder.detectorName, "detectorName must not be null");
        this.period = builder.period;
        this.granularity = builder.granularity;
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(builder.anomalies));
        this.expected = Collections.unmodifiableList(new ArrayList<>(builder.expected));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyReport} instances.
     */
    public static class Builder {
        private String detectorName;
        private int period;
        private String granularity;
        private List<Anomaly> anomalies = List.of();
        private List<ExpectedValue> expected = List.of();

        public Builder detectorName(String detectorName) {
            this.detectorName = detectorName;
            return this;
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder granularity(String granularity) {
            this.granularity = granularity;
            return this;
        }

        public Builder anomalies(List<Anomaly> anomalies) {
            this.anomalies = Objects.requireNonNull(anomalies, "anomalies must not be null");
            return this;
        }

        public Builder expected(List<ExpectedValue> expected) {
            this.expected = Objects.requireNonNull(expected, "expected must not be null");
            return this;
        }

        /**
         * @return a new {@link AnomalyReport}
         * @throws NullPointerException if {@code detectorName} is {@code null}
         */
        public AnomalyReport build() {
            return new AnomalyReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDetectorName() {
        return detectorName;
    }

    /**
     * @return observations per seasonal cycle used for the decomposition
     */
    public int getPeriod() {
        return period;
    }

    /**
     * @return detected granularity of a date/time series, {@code null} for
     *         ordinal series
     */
    public String getGranularity() {
        return granularity;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public List<ExpectedValue> getExpected() {
        return expected;
    }

    /**
     * @return anomalous timestamps in report order
     */
    public List<Long> anomalyTimestamps() {
        return anomalies.stream().map(Anomaly::getTimestamp).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return period == that.period
                && detectorName.equals(that.detectorName)
                && Objects.equals(granularity, that.granularity)
                && anomalies.equals(that.anomalies)
                && expected.equals(that.expected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorName, period, granularity, anomalies, expected);
    }

    @Override
    public String toString() {
        return "AnomalyReport{" +
                "detectorName='" + detectorName + '\'' +
                ", period=" + period +
                ", granularity=" + granularity +
                ", anomalies=" + anomalies +
                '}';
    }
}
