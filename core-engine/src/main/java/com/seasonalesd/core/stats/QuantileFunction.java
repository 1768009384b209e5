package com.seasonalesd.core.stats;

/**
 * Inverse cumulative distribution function of a one-parameter family
 * (Student's t in practice).
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface QuantileFunction {

    /**
     * @param probability       in (0, 1)
     * @param degreesOfFreedom  strictly positive
     * @return the quantile
     */
    double quantile(double probability, double degreesOfFreedom);
}
