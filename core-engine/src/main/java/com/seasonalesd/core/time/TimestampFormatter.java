package com.seasonalesd.core.time;

/**
 * Renders date/time timestamps for reports and expected-value series.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimestampFormatter {

    /**
     * @param epochMillis milliseconds since the epoch
     * @return displayable form of the timestamp
     */
    String format(long epochMillis);
}
