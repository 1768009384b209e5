package com.seasonalesd.core.detection;

import com.seasonalesd.core.decomposition.StlDecomposer;
import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.SeasonalEsdResult;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.time.UtcTimestampFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Seasonal-Hybrid ESD: seasonal decomposition followed by the generalized
 * ESD test on the residual.
 *
 * <pre>
 *   TimeSeries
 *     → SeasonalPreprocessor  (validate, drop edge gaps, remove seasonality and median)
 *     → IterativeEsdTester    (remove the most extreme residual up to floor(numObs * k) times)
 *     → SeasonalEsdResult     (anomalous timestamps + expected series)
 * </pre>
 *
 * <p>
 * Each call is independent; the instance holds no mutable state.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalHybridEsd {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalHybridEsd.class);

    private final SeasonalPreprocessor preprocessor;
    private final IterativeEsdTester tester;

    /**
     * Robust STL decomposition, UTC timestamp labels, Student's t quantiles.
     */
    public SeasonalHybridEsd() {
        this(new SeasonalPreprocessor(new StlDecomposer(), UtcTimestampFormatter.INSTANCE),
                new IterativeEsdTester());
    }

    public SeasonalHybridEsd(SeasonalPreprocessor preprocessor, IterativeEsdTester tester) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.tester = Objects.requireNonNull(tester, "tester must not be null");
    }

    /**
     * Detect anomalies in {@code series}.
     *
     * @param series  the series to test
     * @param options detection settings; the period length is required
     * @return anomalous timestamps in the order they were found, plus the
     *         expected series
     * @throws InvalidInputException         if the period length is missing,
     *                                       the series is too short or has
     *                                       interior gaps
     * @throws InvalidConfigurationException if no anomaly can be flagged for
     *                                       the series length (missing
     *                                       observations included) and {@code k}
     */
    public SeasonalEsdResult detectAnoms(TimeSeries series, EsdOptions options) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (options.isVerbose()) {
            LOG.info("Running S-H-ESD over {} observation(s) with {}", series.size(), options);
        }
        PreprocessedSeries preprocessed = preprocessor.preprocess(
                series, options.getPeriodLength(), options.isUseDecomp());
        EsdTestResult result = tester.test(preprocessed.getResiduals(), series.size(), options);

        LOG.debug("S-H-ESD flagged {} of {} observation(s)",
                result.getConfirmedCount(), preprocessed.getResiduals().size());
        return new SeasonalEsdResult(result.anomalies(), preprocessed.getExpected());
    }
}
