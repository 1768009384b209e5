package com.seasonalesd.core.time;

import com.seasonalesd.core.model.DataPoint;
import com.seasonalesd.core.model.TimeSeries;
import com.seasonalesd.core.model.TimestampType;

import java.util.Objects;

/**
 * Rolls a date/time series up to coarser time buckets.
 *
 * @since 1.0.0
 */
public final class SeriesAggregator {

    private static final long MINUTE_MILLIS = 60_000L;

    private SeriesAggregator() {
        // utility class, not instantiable
    }

    /**
     * Sum observations into whole-minute buckets, each stamped with the start
     * of its minute. Missing observations contribute nothing; a minute with no
     * observation at all is missing.
     *
     * @param series date/time series
     * @return the minute-level series
     */
    public static TimeSeries sumByMinute(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        TimeSeries.Builder builder = TimeSeries.builder(TimestampType.EPOCH_MILLIS);
        long bucket = Long.MIN_VALUE;
        double sum = Double.NaN;
        for (DataPoint point : series.getPoints()) {
            long start = Math.floorDiv(point.getTimestamp(), MINUTE_MILLIS) * MINUTE_MILLIS;
            if (start != bucket) {
                if (bucket != Long.MIN_VALUE) {
                    builder.add(bucket, sum);
                }
                bucket = start;
                sum = Double.NaN;
            }
            if (!point.isMissing()) {
                sum = Double.isNaN(sum) ? point.getValue() : sum + point.getValue();
            }
        }
        if (bucket != Long.MIN_VALUE) {
            builder.add(bucket, sum);
        }
        return builder.build();
    }
}
