package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.time.TimestampFormatter;
import com.seasonalesd.core.time.UtcTimestampFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongPredicate;

/**
 * Detector for series without calendar semantics: the period is given
 * explicitly in observations.
 *
 * <h3>Longterm chunks</h3>
 * <p>
 * With {@code longtermPeriod} set, the series is tested in consecutive
 * chunks of that many observations so that a slowly moving level does not
 * dominate the residual. A short final chunk is replaced by the last
 * {@code longtermPeriod} observations of the series.
 * </p>
 *
 * <h3>Filters</h3>
 * <p>
 * Thresholds compare anomalies against the maxima of consecutive blocks of
 * {@code period} observations; {@code onlyLast: period} keeps anomalies in
 * the final block only.
 * </p>
 *
 * @since 1.0.0
 */
public class VectorAnomalyDetector extends AbstractSeasonalDetector {

    private final int period;
    private final Integer longtermPeriod;

    public VectorAnomalyDetector(DetectorConfig config) {
        this(config, new SeasonalHybridEsd(), UtcTimestampFormatter.INSTANCE);
    }

    /**
     * @throws NullPointerException     if {@code config} or its period is
     *                                  {@code null}
     * @throws IllegalArgumentException if the period or longterm period is out of
     *                                  range
     */
    public VectorAnomalyDetector(DetectorConfig config, SeasonalHybridEsd engine, TimestampFormatter formatter) {
        super(config, engine, formatter);
        this.period = Objects.requireNonNull(config.getPeriod(),
                "Period must not be null for vector detector '" + config.getName() + "'");
        this.longtermPeriod = config.getLongtermPeriod();

        if (period < 2) {
            throw new IllegalArgumentException(
                    "period must be >= 2 for detector '" + getName() + "', got: " + period);
        }
        if (longtermPeriod != null && longtermPeriod < 2 * period) {
            throw new IllegalArgumentException("longtermPeriod must be >= 2 * period for detector '"
                    + getName() + "', got: " + longtermPeriod);
        }
        if (getOnlyLast() != OnlyLast.NONE && getOnlyLast() != OnlyLast.PERIOD) {
            throw new IllegalArgumentException("onlyLast must be 'period' for vector detector '" + getName() + "'");
        }
    }

    @Override
    public AnomalyReport detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.isEmpty()) {
            throw new InvalidInputException("Series is empty");
        }

        int n = series.size();
        List<TimeSeries> chunks = chunks(series);
        double[] maxima = groupMaxima(series, i -> i / period);

        LongPredicate recent = timestamp -> true;
        if (getOnlyLast() == OnlyLast.PERIOD && n >= period) {
            long firstOfLastPeriod = series.get(n - period).getTimestamp();
            recent = timestamp -> timestamp >= firstOfLastPeriod;
        }
        return run(series, chunks, period, null, maxima, recent);
    }

    List<TimeSeries> chunks(TimeSeries series) {
        int n = series.size();
        int chunkSize = longtermPeriod != null ? Math.min(longtermPeriod, n) : n;
        List<TimeSeries> chunks = new ArrayList<>();
        for (int start = 0; start < n; start += chunkSize) {
            if (start + chunkSize <= n) {
                chunks.add(series.slice(start, start + chunkSize));
            } else {
                chunks.add(series.slice(n - chunkSize, n));
            }
        }
        return chunks;
    }
}
