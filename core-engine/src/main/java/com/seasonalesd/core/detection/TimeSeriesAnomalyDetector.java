package com.seasonalesd.core.detection;

import com.seasonalesd.core.model.AnomalyReport;
import com.seasonalesd.core.model.DetectorConfig;
import com.seasonalesd.core.model.InvalidConfigurationException;
import com.seasonalesd.core.model.InvalidInputException;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.time.Granularity;
import com.seasonalesd.core.time.SeriesAggregator;
import com.seasonalesd.core.time.TimestampFormatter;
import com.seasonalesd.core.time.UtcTimestampFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongPredicate;

/**
 * Detector for date/time series.
 *
 * <p>
 * The sampling granularity is read from the gap between the first two
 * observations and fixes the seasonal period: a day of minutes (1440), a
 * day of hours (24) or a week of days (7). Second-level data is summed into
 * minutes first.
 * </p>
 *
 * <h3>Longterm chunks</h3>
 * <p>
 * With {@code longterm} enabled the series is tested in chunks of
 * {@code piecewiseMedianPeriodWeeks} weeks (one extra day for daily data).
 * A chunk that would run past the end is replaced by the final chunk-length
 * of the series.
 * </p>
 *
 * <h3>Filters</h3>
 * <p>
 * Thresholds compare anomalies against daily maxima (UTC days);
 * {@code onlyLast} keeps anomalies within the last day or hour.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesAnomalyDetector extends AbstractSeasonalDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesAnomalyDetector.class);

    static final long HOUR_MILLIS = 3_600_000L;
    static final long DAY_MILLIS = 24 * HOUR_MILLIS;

    private final boolean longterm;
    private final int piecewiseMedianPeriodWeeks;

    public TimeSeriesAnomalyDetector(DetectorConfig config) {
        this(config, new SeasonalHybridEsd(), UtcTimestampFormatter.INSTANCE);
    }

    /**
     * @throws NullPointerException     if {@code config} is {@code null}
     * @throws IllegalArgumentException if a setting is out of range
     */
    public TimeSeriesAnomalyDetector(DetectorConfig config, SeasonalHybridEsd engine,
            TimestampFormatter formatter) {
        super(config, engine, formatter);
        this.longterm = config.isLongterm();
        this.piecewiseMedianPeriodWeeks = config.getPiecewiseMedianPeriodWeeks();

        if (piecewiseMedianPeriodWeeks < 2) {
            throw new IllegalArgumentException("piecewiseMedianPeriodWeeks must be >= 2 for detector '"
                    + getName() + "', got: " + piecewiseMedianPeriodWeeks);
        }
        if (getOnlyLast() == OnlyLast.PERIOD) {
            throw new IllegalArgumentException("onlyLast must be 'day' or 'hr' for timeseries detector '"
                    + getName() + "'");
        }
    }

    @Override
    public AnomalyReport detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (!series.isDateTime()) {
            throw new InvalidInputException("Detector '" + getName() + "' requires a date/time series");
        }

        Granularity detected = Granularity.detect(series);
        TimeSeries data = detected == Granularity.SECOND ? SeriesAggregator.sumByMinute(series) : series;
        Granularity granularity = detected == Granularity.SECOND ? Granularity.MINUTE : detected;
        if (detected != granularity) {
            LOG.debug("Detector [{}]: aggregated {} second-level point(s) into {} minute(s)",
                    getName(), series.size(), data.size());
        }
        int period = granularity.period();

        if (getOnlyLast() == OnlyLast.HOUR && granularity == Granularity.DAY) {
            throw new InvalidConfigurationException("onlyLast 'hr' is not supported for daily data");
        }

        List<TimeSeries> chunks = longterm ? chunks(data, granularity, period) : List.of(data);
        double[] maxima = groupMaxima(data, i -> Math.floorDiv(data.get(i).getTimestamp(), DAY_MILLIS));

        long last = data.get(data.size() - 1).getTimestamp();
        LongPredicate recent = switch (getOnlyLast()) {
            case DAY -> timestamp -> timestamp > last - DAY_MILLIS;
            case HOUR -> timestamp -> timestamp > last - HOUR_MILLIS;
            default -> timestamp -> true;
        };
        return run(data, chunks, period, granularity.getLabel(), maxima, recent);
    }

    List<TimeSeries> chunks(TimeSeries data, Granularity granularity, int period) {
        int observations;
        long span;
        if (granularity == Granularity.DAY) {
            observations = period * piecewiseMedianPeriodWeeks + 1;
            span = (7L * piecewiseMedianPeriodWeeks + 1) * DAY_MILLIS;
        } else {
            observations = period * 7 * piecewiseMedianPeriodWeeks;
            span = 7L * piecewiseMedianPeriodWeeks * DAY_MILLIS;
        }

        long[] timestamps = data.timestamps();
        int n = timestamps.length;
        long last = timestamps[n - 1];
        List<TimeSeries> chunks = new ArrayList<>();
        for (int j = 0; j < n; j += observations) {
            long start = timestamps[j];
            long end = Math.min(start + span, last);
            if (end - start == span) {
                chunks.add(data.slice(firstIndexAtOrAfter(timestamps, start),
                        firstIndexAtOrAfter(timestamps, end)));
            } else {
                chunks.add(data.slice(firstIndexAtOrAfter(timestamps, last - span + 1), n));
            }
        }
        return chunks;
    }

    private static int firstIndexAtOrAfter(long[] timestamps, long timestamp) {
        int index = 0;
        while (index < timestamps.length && timestamps[index] < timestamp) {
            index++;
        }
        return index;
    }
}
