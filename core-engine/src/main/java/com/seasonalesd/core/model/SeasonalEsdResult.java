package com.seasonalesd.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one S-H-ESD run: the anomalous timestamps, in the order the
 * test removed them, and the expected series.
 *
 * @since 1.0.0
 */
public final class SeasonalEsdResult {

    private final List<Long> anomalies;
    private final List<ExpectedValue> expected;

    public SeasonalEsdResult(List<Long> anomalies, List<ExpectedValue> expected) {
        this.anomalies = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(anomalies, "anomalies must not be null")));
        this.expected = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(expected, "expected must not be null")));
    }

    /**
     * @return unmodifiable list of anomalous timestamps, no duplicates
     */
    public List<Long> getAnomalies() {
        return anomalies;
    }

    /**
     * @return unmodifiable expected series, one entry per non-missing input point
     */
    public List<ExpectedValue> getExpected() {
        return expected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalEsdResult that))
            return false;
        return anomalies.equals(that.anomalies) && expected.equals(that.expected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalies, expected);
    }

    @Override
    public String toString() {
        return "SeasonalEsdResult{anomalies=" + anomalies + ", expected=" + expected.size() + " point(s)}";
    }
}
