package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.ExpectedValue;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of {@link SeasonalPreprocessor}: the residual series handed to the
 * ESD test and the expected series handed back to the caller.
 *
 * @since 1.0.0
 */
public final class PreprocessedSeries {

    private final WorkingSeries residuals;
    private final List<ExpectedValue> expected;

    public PreprocessedSeries(WorkingSeries residuals, List<ExpectedValue> expected) {
        this.residuals = Objects.requireNonNull(residuals, "residuals must not be null");
        this.expected = Collections.unmodifiableList(Objects.requireNonNull(expected, "expected must not be null"));
    }

    public WorkingSeries getResiduals() {
        return residuals;
    }

    public List<ExpectedValue> getExpected() {
        return expected;
    }
}
