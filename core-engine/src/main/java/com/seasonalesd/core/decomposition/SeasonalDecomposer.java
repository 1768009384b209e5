package com.seasonalesd.core.decomposition;

import com.seasonalesd.core.model.DecompositionResult;

/**
 * Additive seasonal-trend decomposition of an evenly spaced series.
 *
 * <p>
 * Implementations must be reentrant: the detection pipeline calls them
 * concurrently from independent invocations without locking.
 * </p>
 *
 * @since 1.0.0
 */
public interface SeasonalDecomposer {

    /**
     * Decompose {@code values} into seasonal, trend and remainder components.
     *
     * @param values observations, all finite
     * @param period observations per seasonal cycle
     * @return aligned components with {@code values = seasonal + trend + remainder}
     * @throws IllegalArgumentException if the series cannot be decomposed
     */
    DecompositionResult decompose(double[] values, int period);
}
