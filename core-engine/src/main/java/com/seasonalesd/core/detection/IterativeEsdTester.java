package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.stats.QuantileFunction;
import com.seasonalesd.core.stats.RobustStatistics;
import com.seasonalesd.core.stats.StudentT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generalized ESD test (Rosner, 1983) for up to {@code floor(numObs * k)}
 * outliers, with median and MAD in place of mean and standard deviation.
 * {@code numObs} is the length of the raw series, missing observations
 * included; {@code n} below is the number of residuals actually tested.
 *
 * <h3>Iteration i</h3>
 * <ol>
 * <li>Centre the working series on its median and take the directional
 * deviation of every point (upper tail, lower tail or absolute).</li>
 * <li>Stop if the MAD is zero: nothing is left to separate. A MAD at or
 * below {@link WorkingSeries#getResolution()} is decomposition round-off and
 * counts as zero.</li>
 * <li>The point with the largest normalized deviation R is the candidate
 * (first one in series order on ties); remove it.</li>
 * <li>Compare R with the critical value
 * {@code lambda = t (n-i) / sqrt((n-i-1+t^2)(n-i+1))}, where {@code t} is
 * the Student's t quantile at {@code 1 - alpha/(n-i+1)} (one-tailed) or
 * {@code 1 - alpha/(2(n-i+1))} (two-tailed) with {@code n-i-1} degrees of
 * freedom.</li>
 * </ol>
 *
 * <p>
 * The number of anomalies is the <strong>largest</strong> {@code i} with
 * {@code R > lambda}; all candidates removed up to that iteration are
 * anomalies, including those whose own statistic fell short. The loop never
 * stops early on {@code R <= lambda}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless apart from the quantile function; safe for concurrent use when
 * the quantile function is.
 * </p>
 *
 * @since 1.0.0
 */
public class IterativeEsdTester {

    private static final Logger LOG = LoggerFactory.getLogger(IterativeEsdTester.class);

    private final QuantileFunction quantileFunction;

    public IterativeEsdTester() {
        this(StudentT.INSTANCE);
    }

    public IterativeEsdTester(QuantileFunction quantileFunction) {
        this.quantileFunction = Objects.requireNonNull(quantileFunction, "quantileFunction must not be null");
    }

    /**
     * Maximum number of anomalies for {@code n} observations.
     *
     * @throws InvalidConfigurationException if it rounds down to zero
     */
    public static int maxOutliers(int n, double k) {
        int maxOutliers = (int) Math.floor(n * k);
        if (maxOutliers == 0) {
            throw new InvalidConfigurationException("Maximum number of anomalies is 0 for " + n
                    + " observation(s) and k=" + k + "; more data or a larger k is needed");
        }
        return maxOutliers;
    }

    /**
     * Run the test over a residual series with no observations dropped.
     *
     * @see #test(WorkingSeries, int, EsdOptions)
     */
    public EsdTestResult test(WorkingSeries residuals, EsdOptions options) {
        Objects.requireNonNull(residuals, "residuals must not be null");
        return test(residuals, residuals.size(), options);
    }

    /**
     * Run the test over a residual series.
     *
     * @param residuals the residual series; not modified
     * @param numObs    length of the series the residuals came from, before
     *                  missing observations were dropped; sets the anomaly budget
     * @param options   significance level, anomaly fraction and direction
     * @return iteration trace and confirmed count
     * @throws InvalidConfigurationException if {@code floor(numObs * k)} is zero
     * @throws IllegalArgumentException      if {@code numObs} is smaller than the
     *                                       residual series
     */
    public EsdTestResult test(WorkingSeries residuals, int numObs, EsdOptions options) {
        Objects.requireNonNull(residuals, "residuals must not be null");
        Objects.requireNonNull(options, "options must not be null");

        int n = residuals.size();
        if (numObs < n) {
            throw new IllegalArgumentException("numObs must be >= the " + n + " residual(s), got: " + numObs);
        }
        int maxOutliers = maxOutliers(numObs, options.getK());
        double alpha = options.getAlpha();
        boolean verbose = options.isVerbose();

        List<EsdIteration> iterations = new ArrayList<>(maxOutliers);
        int confirmed = 0;
        WorkingSeries working = residuals;

        for (int i = 1; i <= maxOutliers; i++) {
            if (n - i - 1 < 1) {
                LOG.debug("Stopping at iteration {}: no degrees of freedom left", i);
                break;
            }

            double[] values = working.values();
            double center = options.isUseEsd() ? RobustStatistics.mean(values) : RobustStatistics.median(values);
            double scale = options.isUseEsd()
                    ? RobustStatistics.standardDeviation(values)
                    : RobustStatistics.mad(values);
            if (scale <= working.getResolution()) {
                LOG.debug("Stopping at iteration {}: residual scale {} is zero", i, scale);
                break;
            }

            int candidateIndex = 0;
            double statistic = Double.NEGATIVE_INFINITY;
            for (int j = 0; j < values.length; j++) {
                double deviation = deviation(values[j], center, options) / scale;
                if (deviation > statistic) {
                    statistic = deviation;
                    candidateIndex = j;
                }
            }
            long candidate = working.timestampAt(candidateIndex);
            working = working.without(candidateIndex);

            int remaining = n - i + 1;
            double p = options.isOneTail()
                    ? 1 - alpha / remaining
                    : 1 - alpha / (2.0 * remaining);
            double t = quantileFunction.quantile(p, n - i - 1);
            double lambda = t * (n - i) / Math.sqrt((n - i - 1 + t * t) * remaining);

            iterations.add(new EsdIteration(i, candidate, statistic, lambda));
            if (statistic > lambda) {
                confirmed = i;
            }
            progress(verbose, "ESD iteration {}/{}: candidate={} R={} lambda={}",
                    i, maxOutliers, candidate, statistic, lambda);
        }

        progress(verbose, "ESD test confirmed {} anomaly(ies) out of at most {}", confirmed, maxOutliers);
        return new EsdTestResult(iterations, confirmed, maxOutliers);
    }

    private static double deviation(double value, double center, EsdOptions options) {
        if (!options.isOneTail()) {
            return Math.abs(value - center);
        }
        return options.isUpperTail() ? value - center : center - value;
    }

    private static void progress(boolean verbose, String format, Object... args) {
        if (verbose) {
            LOG.info(format, args);
        } else {
            LOG.debug(format, args);
        }
    }
}
