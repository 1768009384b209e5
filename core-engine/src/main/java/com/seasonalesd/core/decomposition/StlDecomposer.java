package com.seasonalesd.core.decomposition;

import com.seasonalesd.core.model.DecompositionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Seasonal-trend decomposition by loess (STL) with a periodic seasonal
 * window.
 *
 * <p>
 * R. B. Cleveland, W. S. Cleveland, J. E. McRae and I. Terpenning (1990),
 * <i>STL: A Seasonal-Trend Decomposition Procedure Based on Loess</i>,
 * Journal of Official Statistics 6, 3–73.
 * </p>
 *
 * <h3>Procedure</h3>
 * <p>
 * Each inner pass detrends the series, smooths every cycle-subseries
 * (degree 0 over the whole subseries, extended by one cycle at each end),
 * removes the low-frequency part of the result with moving averages of
 * length {@code period}, {@code period}, 3 and a loess pass, and finally
 * re-estimates the trend by loess on the deseasonalized series. The outer
 * passes down-weight points with large remainders (bisquare weights) so that
 * outliers do not leak into the seasonal and trend components.
 * </p>
 *
 * <p>
 * Since the seasonal window is periodic, the final seasonal component is
 * replaced by its mean at each position of the cycle.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable; all working storage is allocated per call.
 * </p>
 *
 * @since 1.0.0
 */
public class StlDecomposer implements SeasonalDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(StlDecomposer.class);

    /** Default number of passes of the inner loop when fitting robustly. */
    public static final int DEFAULT_INNER_ITERATIONS = 1;

    /** Default number of robustness passes. */
    public static final int DEFAULT_ROBUST_ITERATIONS = 15;

    private final int innerIterations;
    private final int robustIterations;

    /**
     * Robust decomposition with the default iteration counts.
     */
    public StlDecomposer() {
        this(DEFAULT_INNER_ITERATIONS, DEFAULT_ROBUST_ITERATIONS);
    }

    /**
     * @param innerIterations  passes of the inner loop, at least 1
     * @param robustIterations robustness passes, 0 for a non-robust fit
     * @throws IllegalArgumentException if either count is out of range
     */
    public StlDecomposer(int innerIterations, int robustIterations) {
        if (innerIterations < 1) {
            throw new IllegalArgumentException("innerIterations must be >= 1, got: " + innerIterations);
        }
        if (robustIterations < 0) {
            throw new IllegalArgumentException("robustIterations must be >= 0, got: " + robustIterations);
        }
        this.innerIterations = innerIterations;
        this.robustIterations = robustIterations;
    }

    @Override
    public DecompositionResult decompose(double[] values, int period) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (period < 2) {
            throw new IllegalArgumentException("Series is not periodic: period must be >= 2, got: " + period);
        }
        if (n < 2 * period) {
            throw new IllegalArgumentException("Series has less than two periods: " + n
                    + " observation(s) for period " + period);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("Series contains a non-finite value at position " + i);
            }
        }

        int seasonalSpan = nextOdd(10 * n + 1);
        int trendSpan = nextOdd((int) Math.ceil(1.5 * period / (1 - 1.5 / seasonalSpan)));
        int lowPassSpan = nextOdd(period);
        LOG.debug("STL: n={} period={} spans seasonal={} trend={} lowPass={}",
                n, period, seasonalSpan, trendSpan, lowPassSpan);

        double[] seasonal = new double[n];
        double[] trend = new double[n];
        double[] weights = null;

        for (int pass = 0;; pass++) {
            for (int inner = 0; inner < innerIterations; inner++) {
                innerPass(values, period, seasonalSpan, trendSpan, lowPassSpan, weights, seasonal, trend);
            }
            if (pass >= robustIterations) {
                break;
            }
            weights = robustnessWeights(values, seasonal, trend);
        }

        double[] periodicSeasonal = cycleMeans(seasonal, period);
        double[] remainder = new double[n];
        for (int i = 0; i < n; i++) {
            remainder[i] = values[i] - periodicSeasonal[i] - trend[i];
        }
        return new DecompositionResult(periodicSeasonal, trend, remainder);
    }

    // ---------------------------------------------------------------
    // Inner loop
    // ---------------------------------------------------------------

    private static void innerPass(double[] y, int period, int seasonalSpan, int trendSpan,
            int lowPassSpan, double[] weights, double[] seasonal, double[] trend) {
        int n = y.length;

        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = y[i] - trend[i];
        }

        double[] cycle = smoothCycleSubseries(detrended, period, seasonalSpan, weights);

        double[] lowPass = movingAverage(movingAverage(movingAverage(cycle, period), period), 3);
        double[] smoothedLowPass = new double[n];
        Loess.smooth(lowPass, n, lowPassSpan, 1, null, smoothedLowPass, 0);

        for (int i = 0; i < n; i++) {
            seasonal[i] = cycle[period + i] - smoothedLowPass[i];
        }

        double[] deseasonalized = new double[n];
        for (int i = 0; i < n; i++) {
            deseasonalized[i] = y[i] - seasonal[i];
        }
        Loess.smooth(deseasonalized, n, trendSpan, 1, weights, trend, 0);
    }

    /**
     * Smooth each cycle-subseries and extend it by one value at both ends.
     *
     * @return array of length {@code n + 2 * period}; position {@code period + i}
     *         holds the smoothed value for observation {@code i}
     */
    private static double[] smoothCycleSubseries(double[] y, int period, int span, double[] weights) {
        int n = y.length;
        double[] cycle = new double[n + 2 * period];

        for (int j = 0; j < period; j++) {
            int k = (n - j - 1) / period + 1;
            double[] sub = new double[k];
            double[] subWeights = weights != null ? new double[k] : null;
            for (int i = 0; i < k; i++) {
                sub[i] = y[j + i * period];
                if (subWeights != null) {
                    subWeights[i] = weights[j + i * period];
                }
            }

            double[] smoothed = new double[k + 2];
            Loess.smooth(sub, k, span, 0, subWeights, smoothed, 1);

            double[] scratch = new double[k];
            double first = Loess.estimate(sub, k, span, 0, 0, 1, Math.min(span, k), scratch, subWeights);
            smoothed[0] = Double.isNaN(first) ? smoothed[1] : first;
            double last = Loess.estimate(sub, k, span, 0, k + 1, Math.max(1, k - span + 1), k, scratch,
                    subWeights);
            smoothed[k + 1] = Double.isNaN(last) ? smoothed[k] : last;

            for (int m = 0; m < k + 2; m++) {
                cycle[j + m * period] = smoothed[m];
            }
        }
        return cycle;
    }

    private static double[] movingAverage(double[] x, int length) {
        double[] out = new double[x.length - length + 1];
        double sum = 0;
        for (int i = 0; i < length; i++) {
            sum += x[i];
        }
        out[0] = sum / length;
        for (int i = 1; i < out.length; i++) {
            sum += x[i + length - 1] - x[i - 1];
            out[i] = sum / length;
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Robustness and finishing
    // ---------------------------------------------------------------

    private static double[] robustnessWeights(double[] y, double[] seasonal, double[] trend) {
        int n = y.length;
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = Math.abs(y[i] - seasonal[i] - trend[i]);
        }
        double[] sorted = residuals.clone();
        Arrays.sort(sorted);
        double cutoff = 3 * (sorted[n / 2] + sorted[n - n / 2 - 1]);
        double upper = 0.999 * cutoff;
        double lower = 0.001 * cutoff;

        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            double r = residuals[i];
            if (r <= lower) {
                weights[i] = 1;
            } else if (r <= upper) {
                double ratio = r / cutoff;
                double c = 1 - ratio * ratio;
                weights[i] = c * c;
            } else {
                weights[i] = 0;
            }
        }
        return weights;
    }

    private static double[] cycleMeans(double[] seasonal, int period) {
        int n = seasonal.length;
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < n; i++) {
            sums[i % period] += seasonal[i];
            counts[i % period]++;
        }
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            result[i] = sums[i % period] / counts[i % period];
        }
        return result;
    }

    private static int nextOdd(int x) {
        return x % 2 == 0 ? x + 1 : x;
    }

    @Override
    public String toString() {
        return "StlDecomposer{inner=" + innerIterations + ", robust=" + robustIterations + '}';
    }
}
