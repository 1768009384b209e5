package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.Anomaly;
import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.DataPoint;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.ExpectedValue;
import com.seasonalesd.core.model.SeasonalEsdResult;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.time.TimestampFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntToLongFunction;
import java.util.function.LongPredicate;

/**
 * Shared plumbing of the configured detectors: runs S-H-ESD over one or
 * more chunks of a series, merges the chunk results and turns the
 * anomalous timestamps into an {@link AnomalyReport}.
 *
 * <p>
 * Subclasses decide how a series is split into chunks, which period it
 * has and how the per-period maxima for thresholding are formed.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractSeasonalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSeasonalDetector.class);

    private final String name;
    private final double maxAnoms;
    private final Direction direction;
    private final double alpha;
    private final ThresholdType threshold;
    private final OnlyLast onlyLast;
    private final boolean expectedValues;
    private final boolean verbose;
    private final SeasonalHybridEsd engine;
    private final TimestampFormatter formatter;

    /**
     * @throws NullPointerException     if {@code config} or required settings are
     *                                  {@code null}
     * @throws IllegalArgumentException if a setting cannot be parsed
     */
    protected AbstractSeasonalDetector(DetectorConfig config, SeasonalHybridEsd engine,
            TimestampFormatter formatter) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.maxAnoms = config.getMaxAnoms();
        this.direction = Direction.parse(config.getDirection());
        this.alpha = config.getAlpha();
        this.threshold = ThresholdType.parse(config.getThreshold());
        this.onlyLast = OnlyLast.parse(config.getOnlyLast());
        this.expectedValues = config.isExpectedValues();
        this.verbose = config.isVerbose();
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");

        if (maxAnoms < 0 || maxAnoms > DetectorConfig.MAX_ANOMS_LIMIT) {
            throw new IllegalArgumentException("maxAnoms must be in [0, " + DetectorConfig.MAX_ANOMS_LIMIT
                    + "] for detector '" + name + "', got: " + maxAnoms);
        }
        if (alpha < 0.01 || alpha > 0.1) {
            LOG.warn("Detector [{}]: alpha={} is the statistical significance and is usually between 0.01 and 0.1",
                    name, alpha);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    protected OnlyLast getOnlyLast() {
        return onlyLast;
    }

    protected boolean isVerbose() {
        return verbose;
    }

    // ---------------------------------------------------------------
    // Template
    // ---------------------------------------------------------------

    /**
     * Test every chunk, merge, filter and report.
     *
     * @param series          the (possibly aggregated) series the chunks come from
     * @param chunks          sub-series tested independently
     * @param period          observations per seasonal cycle
     * @param granularity     granularity label for the report, may be {@code null}
     * @param periodicMaxima  maxima per period for the threshold filter
     * @param recent          predicate selecting timestamps kept by the only-last
     *                        filter
     */
    protected AnomalyReport run(TimeSeries series, List<TimeSeries> chunks, int period, String granularity,
            double[] periodicMaxima, LongPredicate recent) {
        AnomalyReport.Builder report = AnomalyReport.builder()
                .detectorName(name)
                .period(period)
                .granularity(granularity);

        if (maxAnoms == 0) {
            LOG.warn("Detector [{}]: maxAnoms=0 leaves no room for anomalies", name);
            return report.build();
        }

        Set<Long> anomalies = new LinkedHashSet<>();
        Map<Long, ExpectedValue> expected = new LinkedHashMap<>();
        for (TimeSeries chunk : chunks) {
            SeasonalEsdResult result = engine.detectAnoms(chunk, options(chunk.size(), period));
            anomalies.addAll(result.getAnomalies());
            for (ExpectedValue value : result.getExpected()) {
                expected.putIfAbsent(value.getTimestamp(), value);
            }
        }

        double cutoff = threshold.cutoff(periodicMaxima);
        Map<Long, Double> values = new HashMap<>();
        for (DataPoint point : series.getPoints()) {
            values.put(point.getTimestamp(), point.getValue());
        }

        List<Anomaly> kept = new ArrayList<>();
        for (long timestamp : anomalies.stream().sorted().toList()) {
            double value = values.get(timestamp);
            if (value < cutoff || !recent.test(timestamp)) {
                continue;
            }
            String label = series.isDateTime() ? formatter.format(timestamp) : null;
            Double expectedValue = expectedValues ? expected.get(timestamp).getValue() : null;
            kept.add(new Anomaly(timestamp, label, value, expectedValue));
        }

        LOG.info("Detector [{}] flagged {} anomaly(ies) in {} observation(s) across {} chunk(s)",
                name, kept.size(), series.size(), chunks.size());
        return report
                .anomalies(kept)
                .expected(new ArrayList<>(expected.values()))
                .build();
    }

    /**
     * S-H-ESD options for a chunk of {@code size} observations. The anomaly
     * fraction is raised to one observation when it would allow none.
     */
    EsdOptions options(int size, int period) {
        double k = maxAnoms;
        if (Math.floor(size * k) == 0) {
            k = Math.nextUp(1.0 / size);
            LOG.debug("Detector [{}]: raising maxAnoms to {} to allow one anomaly in {} observation(s)",
                    name, k, size);
        }
        return EsdOptions.builder()
                .k(k)
                .alpha(alpha)
                .periodLength(period)
                .direction(direction)
                .verbose(verbose)
                .build();
    }

    /**
     * Maximum of the non-missing values in each group of consecutive points
     * sharing a key; groups with no observation are skipped.
     */
    protected static double[] groupMaxima(TimeSeries series, IntToLongFunction key) {
        List<Double> maxima = new ArrayList<>();
        long currentKey = 0;
        double currentMax = Double.NaN;
        boolean open = false;
        for (int i = 0; i < series.size(); i++) {
            long groupKey = key.applyAsLong(i);
            double v = series.get(i).getValue();
            if (!open || groupKey != currentKey) {
                if (open && !Double.isNaN(currentMax)) {
                    maxima.add(currentMax);
                }
                currentKey = groupKey;
                currentMax = Double.NaN;
                open = true;
            }
            if (!Double.isNaN(v)) {
                currentMax = Double.isNaN(currentMax) ? v : Math.max(currentMax, v);
            }
        }
        if (open && !Double.isNaN(currentMax)) {
            maxima.add(currentMax);
        }
        return maxima.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
