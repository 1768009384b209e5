package com.seasonalesd.core.detection;

/**
 * Trace of one iteration of the generalized ESD test.
 *
 * @since 1.0.0
 */
public final class EsdIteration {

    private final int index;
    private final long candidate;
    private final double statistic;
    private final double criticalValue;

    public EsdIteration(int index, long candidate, double statistic, double criticalValue) {
        this.index = index;
        this.candidate = candidate;
        this.statistic = statistic;
        this.criticalValue = criticalValue;
    }

    /** 1-based iteration number. */
    public int getIndex() {
        return index;
    }

    /** Timestamp removed in this iteration. */
    public long getCandidate() {
        return candidate;
    }

    /** Largest normalized deviation R. */
    public double getStatistic() {
        return statistic;
    }

    /** Critical value lambda. */
    public double getCriticalValue() {
        return criticalValue;
    }

    /**
     * @return {@code true} if {@code R > lambda}
     */
    public boolean exceedsCriticalValue() {
        return statistic > criticalValue;
    }

    @Override
    public String toString() {
        return "EsdIteration{" +
                "i=" + index +
                ", candidate=" + candidate +
                ", R=" + statistic +
                ", lambda=" + criticalValue +
                '}';
    }
}
