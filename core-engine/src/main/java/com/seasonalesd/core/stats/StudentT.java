package com.seasonalesd.core.stats;

import org.apache.commons.math3.distribution.TDistribution;

/**
 * Student's t quantiles backed by Commons Math.
 *
 * <p>
 * Invalid arguments surface as the Commons Math exceptions unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class StudentT implements QuantileFunction {

    public static final StudentT INSTANCE = new StudentT();

    private StudentT() {
    }

    @Override
    public double quantile(double probability, double degreesOfFreedom) {
        return new TDistribution(degreesOfFreedom).inverseCumulativeProbability(probability);
    }
}
