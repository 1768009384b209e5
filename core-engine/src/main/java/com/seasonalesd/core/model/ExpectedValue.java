package com.seasonalesd.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Objects;

/**
 * Expected value (truncated trend plus seasonal) of the series at one
 * timestamp.
 *
 * <p>
 * {@code label} is the formatted timestamp for date/time series and
 * {@code null} for ordinal series.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExpectedValue implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final String label;
    private final double value;

    public ExpectedValue(long timestamp, String label, double value) {
        this.timestamp = timestamp;
        this.label = label;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getLabel() {
        return label;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ExpectedValue that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, label, value);
    }

    @Override
    public String toString() {
        return "ExpectedValue{" +
                "timestamp=" + timestamp +
                (label != null ? ", label='" + label + '\'' : "") +
                ", value=" + value +
                '}';
    }
}
