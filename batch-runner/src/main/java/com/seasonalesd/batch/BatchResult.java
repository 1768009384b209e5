package com.seasonalesd.batch;

import com.seasonalesd.core.model.AnomalyReport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything one batch run produced: a report per successful detector and a
 * failure entry per detector that threw.
 *
 * @since 1.0.0
 */
public final class BatchResult {

    private final Instant generatedAt;
    private final String input;
    private final int observations;
    private final List<AnomalyReport> reports;
    private final List<DetectorFailure> failures;

    public BatchResult(Instant generatedAt, String input, int observations,
            List<AnomalyReport> reports, List<DetectorFailure> failures) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.observations = observations;
        this.reports = Collections.unmodifiableList(new ArrayList<>(reports));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public String getInput() {
        return input;
    }

    public int getObservations() {
        return observations;
    }

    public List<AnomalyReport> getReports() {
        return reports;
    }

    public List<DetectorFailure> getFailures() {
        return failures;
    }

    /**
     * @return {@code true} when at least one detector ran and none failed
     */
    public boolean isSuccessful() {
        return failures.isEmpty() && !reports.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "generatedAt=" + generatedAt +
                ", input='" + input + '\'' +
                ", observations=" + observations +
                ", reports=" + reports.size() +
                ", failures=" + failures.size() +
                '}';
    }
}
