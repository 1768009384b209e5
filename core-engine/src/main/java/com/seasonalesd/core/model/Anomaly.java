package com.seasonalesd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single point flagged by a detector.
 *
 * <p>
 * {@code expectedValue} is only populated when the detector was asked to
 * report expected values.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final String label;
    private final double value;
    private final Double expectedValue;

    public Anomaly(long timestamp, String label, double value, Double expectedValue) {
        this.timestamp = timestamp;
        this.label = label;
        this.value = value;
        this.expectedValue = expectedValue;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * @return formatted timestamp, or {@code null} for ordinal series
     */
    public String getLabel() {
        return label;
    }

    public double getValue() {
        return value;
    }

    public Double getExpectedValue() {
        return expectedValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && Objects.equals(label, that.label)
                && Objects.equals(expectedValue, that.expectedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, label, value, expectedValue);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "timestamp=" + timestamp +
                (label != null ? ", label='" + label + '\'' : "") +
                ", value=" + value +
                (expectedValue != null ? ", expected=" + expectedValue : "") +
                '}';
    }
}
