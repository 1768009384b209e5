package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.model.InvalidInputException;

/**
 * Immutable settings of one S-H-ESD run.
 *
 * <p>
 * Defaults: {@code k = 0.49}, {@code alpha = 0.05}, seasonal decomposition
 * on, median/MAD statistics, one-tailed upper test, quiet. The period length
 * has no default and must be supplied before detection.
 * </p>
 *
 * @since 1.0.0
 */
public final class EsdOptions {

    public static final double DEFAULT_K = 0.49;
    public static final double DEFAULT_ALPHA = 0.05;

    private final double k;
    private final double alpha;
    private final Integer periodLength;
    private final boolean useDecomp;
    private final boolean useEsd;
    private final boolean oneTail;
    private final boolean upperTail;
    private final boolean verbose;

    private EsdOptions(Builder b) {
        this.k = b.k;
        this.alpha = b.alpha;
        this.periodLength = b.periodLength;
        this.useDecomp = b.useDecomp;
        this.useEsd = b.useEsd;
        this.oneTail = b.oneTail;
        this.upperTail = b.upperTail;
        this.verbose = b.verbose;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this instance's values
     */
    public Builder toBuilder() {
        return new Builder()
                .k(k)
                .alpha(alpha)
                .periodLength(periodLength)
                .useDecomp(useDecomp)
                .useEsd(useEsd)
                .oneTail(oneTail)
                .upperTail(upperTail)
                .verbose(verbose);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** Maximum fraction of the data that may be flagged. */
    public double getK() {
        return k;
    }

    /** Significance level of each test. */
    public double getAlpha() {
        return alpha;
    }

    /**
     * @return observations per seasonal cycle, or {@code null} when not set
     */
    public Integer getPeriodLength() {
        return periodLength;
    }

    public boolean isUseDecomp() {
        return useDecomp;
    }

    /**
     * @return {@code true} to test with mean and standard deviation instead
     *         of median and MAD
     */
    public boolean isUseEsd() {
        return useEsd;
    }

    public boolean isOneTail() {
        return oneTail;
    }

    public boolean isUpperTail() {
        return upperTail;
    }

    public boolean isVerbose() {
        return verbose;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EsdOptions}.
     *
     * <p>
     * {@link #build()} rejects {@code k} outside (0, 1], {@code alpha}
     * outside (0, 1) and a non-positive period length.
     * </p>
     */
    public static class Builder {
        private double k = DEFAULT_K;
        private double alpha = DEFAULT_ALPHA;
        private Integer periodLength;
        private boolean useDecomp = true;
        private boolean useEsd = false;
        private boolean oneTail = true;
        private boolean upperTail = true;
        private boolean verbose = false;

        public Builder k(double v) {
            this.k = v;
            return this;
        }

        public Builder alpha(double v) {
            this.alpha = v;
            return this;
        }

        public Builder periodLength(Integer v) {
            this.periodLength = v;
            return this;
        }

        public Builder useDecomp(boolean v) {
            this.useDecomp = v;
            return this;
        }

        public Builder useEsd(boolean v) {
            this.useEsd = v;
            return this;
        }

        public Builder oneTail(boolean v) {
            this.oneTail = v;
            return this;
        }

        public Builder upperTail(boolean v) {
            this.upperTail = v;
            return this;
        }

        /**
         * Set both tail flags from a {@link Direction}.
         */
        public Builder direction(Direction direction) {
            this.oneTail = direction.isOneTail();
            this.upperTail = direction.isUpperTail();
            return this;
        }

        public Builder verbose(boolean v) {
            this.verbose = v;
            return this;
        }

        /**
         * @return validated options
         * @throws InvalidConfigurationException if {@code k} or {@code alpha} is
         *                                       out of range
         * @throws InvalidInputException         if the period length is not positive
         */
        public EsdOptions build() {
            if (!(k > 0 && k <= 1)) {
                throw new InvalidConfigurationException("k must be in (0, 1], got: " + k);
            }
            if (!(alpha > 0 && alpha < 1)) {
                throw new InvalidConfigurationException("alpha must be in (0, 1), got: " + alpha);
            }
            if (periodLength != null && periodLength < 1) {
                throw new InvalidInputException("periodLength must be a positive integer, got: " + periodLength);
            }
            return new EsdOptions(this);
        }
    }

    @Override
    public String toString() {
        return "EsdOptions{" +
                "k=" + k +
                ", alpha=" + alpha +
                ", periodLength=" + periodLength +
                ", useDecomp=" + useDecomp +
                ", useEsd=" + useEsd +
                ", oneTail=" + oneTail +
                ", upperTail=" + upperTail +
                ", verbose=" + verbose +
                '}';
    }
}
