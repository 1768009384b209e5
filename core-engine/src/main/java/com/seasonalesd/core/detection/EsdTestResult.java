package com.seasonalesd.core.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link IterativeEsdTester#test}: every iteration that ran and
 * the number of confirmed anomalies.
 *
 * <p>
 * The anomalies are the first {@code confirmedCount} candidates in removal
 * order, where {@code confirmedCount} is the largest iteration whose
 * statistic exceeded its critical value.
 * </p>
 *
 * @since 1.0.0
 */
public final class EsdTestResult {

    private final List<EsdIteration> iterations;
    private final int confirmedCount;
    private final int maxOutliers;

    public EsdTestResult(List<EsdIteration> iterations, int confirmedCount, int maxOutliers) {
        Objects.requireNonNull(iterations, "iterations must not be null");
        if (confirmedCount < 0 || confirmedCount > iterations.size()) {
            throw new IllegalArgumentException("confirmedCount must be in [0, " + iterations.size()
                    + "], got: " + confirmedCount);
        }
        this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        this.confirmedCount = confirmedCount;
        this.maxOutliers = maxOutliers;
    }

    public List<EsdIteration> getIterations() {
        return iterations;
    }

    public int getConfirmedCount() {
        return confirmedCount;
    }

    /** Upper bound {@code floor(n * k)} the test ran with. */
    public int getMaxOutliers() {
        return maxOutliers;
    }

    /**
     * @return anomalous timestamps in removal order
     */
    public List<Long> anomalies() {
        return iterations.subList(0, confirmedCount).stream()
                .map(EsdIteration::getCandidate)
                .toList();
    }

    @Override
    public String toString() {
        return "EsdTestResult{" +
                "iterations=" + iterations.size() +
                ", confirmed=" + confirmedCount +
                ", maxOutliers=" + maxOutliers +
                '}';
    }
}
