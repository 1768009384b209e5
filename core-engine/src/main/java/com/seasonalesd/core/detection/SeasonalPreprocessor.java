package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.SeasonalDecomposer;
import com.seasonalesd.core.model.DataPoint;
import com.seasonalesd.core.model.DecompositionResult;
import com.seasonalesd.core.model.ExpectedValue;
import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.stats.RobustStatistics;
import com.seasonalesd.core.time.TimestampFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw series into the deseasonalized residual series tested by
 * {@link IterativeEsdTester}.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Validate the period length and the number of observations (at least
 * two full periods).</li>
 * <li>Accept missing observations only as a leading and/or trailing run and
 * drop them.</li>
 * <li>Subtract the global median from every value, decompose the centred
 * values and subtract their seasonal component.</li>
 * <li>Build the expected series {@code trunc(trend + seasonal)}, labelled
 * with formatted timestamps for date/time series.</li>
 * </ol>
 *
 * <p>
 * Decomposition is shift-equivariant, so centring first leaves residuals and
 * expected values unchanged while keeping the decomposition's round-off
 * proportional to the spread of the series rather than to its level.
 * </p>
 *
 * <p>
 * Without decomposition the residual is the value minus the global median
 * and the expected value is the truncated median.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalPreprocessor.class);

    /**
     * Residual spread below this fraction of the largest absolute deviation
     * from the median is floating-point round-off of the decomposition, not
     * signal.
     */
    static final double RESOLUTION_RATIO = 1e-10;

    /** Runs of missing/present flags allowed once bracketed by missing sentinels. */
    private static final int MAX_MISSING_RUNS = 3;

    private final SeasonalDecomposer decomposer;
    private final TimestampFormatter formatter;

    public SeasonalPreprocessor(SeasonalDecomposer decomposer, TimestampFormatter formatter) {
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * @param series       the raw series
     * @param periodLength observations per seasonal cycle
     * @param useDecomp    whether to remove the seasonal component
     * @return residuals and expected values of the non-missing observations
     * @throws InvalidInputException    if the period length is absent or not
     *                                  positive, the series is shorter than two
     *                                  periods, or values are missing in its
     *                                  interior
     * @throws IllegalArgumentException if the decomposition fails
     */
    public PreprocessedSeries preprocess(TimeSeries series, Integer periodLength, boolean useDecomp) {
        Objects.requireNonNull(series, "series must not be null");
        if (periodLength == null) {
            throw new InvalidInputException("periodLength must be set to the number of observations per seasonal cycle");
        }
        if (periodLength < 1) {
            throw new InvalidInputException("periodLength must be a positive integer, got: " + periodLength);
        }
        int numObs = series.size();
        if (numObs < 2 * periodLength) {
            throw new InvalidInputException("Anomaly detection needs at least 2 periods worth of data: got "
                    + numObs + " observation(s) for period " + periodLength);
        }

        TimeSeries present = dropEdgeMissing(series);
        if (present.isEmpty()) {
            throw new InvalidInputException("Series contains no observations");
        }

        long[] timestamps = present.timestamps();
        double[] values = present.values();
        int n = values.length;
        double median = RobustStatistics.median(values);

        double[] centred = new double[n];
        for (int i = 0; i < n; i++) {
            centred[i] = values[i] - median;
        }

        double[] residuals = new double[n];
        double[] expected = new double[n];
        double resolution = 0;
        if (useDecomp) {
            DecompositionResult decomposition = decomposer.decompose(centred, periodLength);
            for (int i = 0; i < n; i++) {
                residuals[i] = centred[i] - decomposition.seasonalAt(i);
                expected[i] = truncate(decomposition.trendAt(i) + median + decomposition.seasonalAt(i));
            }
            resolution = RESOLUTION_RATIO * maxAbs(centred);
        } else {
            double truncatedMedian = truncate(median);
            for (int i = 0; i < n; i++) {
                residuals[i] = centred[i];
                expected[i] = truncatedMedian;
            }
        }

        List<ExpectedValue> expectedSeries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String label = series.isDateTime() ? formatter.format(timestamps[i]) : null;
            expectedSeries.add(new ExpectedValue(timestamps[i], label, expected[i]));
        }

        LOG.debug("Preprocessed {} observation(s): period={} median={} decomposed={} resolution={}",
                n, periodLength, median, useDecomp, resolution);
        return new PreprocessedSeries(WorkingSeries.of(timestamps, residuals, resolution), expectedSeries);
    }

    // ---------------------------------------------------------------
    // Missing values
    // ---------------------------------------------------------------

    /**
     * Count runs of missing/present flags over the series bracketed by a
     * missing sentinel at each end. One run means nothing is present, three
     * runs means missing values at most at the edges; anything more has a gap
     * in the interior.
     */
    static int missingRuns(TimeSeries series) {
        int runs = 1;
        boolean previousMissing = true;
        for (DataPoint point : series.getPoints()) {
            if (point.isMissing() != previousMissing) {
                runs++;
                previousMissing = point.isMissing();
            }
        }
        if (!previousMissing) {
            runs++;
        }
        return runs;
    }

    private static TimeSeries dropEdgeMissing(TimeSeries series) {
        int runs = missingRuns(series);
        if (runs > MAX_MISSING_RUNS) {
            throw new InvalidInputException("Series contains non-leading/trailing missing values; "
                    + "interpolate interior gaps before running detection");
        }
        TimeSeries present = series.withoutMissing();
        if (present.size() < series.size()) {
            LOG.debug("Dropped {} leading/trailing missing observation(s)", series.size() - present.size());
        }
        return present;
    }

    private static double truncate(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static double maxAbs(double[] values) {
        double max = 0;
        for (double v : values) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }
}
