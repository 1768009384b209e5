package com.seasonalesd.core.model;

/**
 * How the timestamps of a {@link TimeSeries} are to be interpreted.
 *
 * @since 1.0.0
 */
public enum TimestampType {

    /** Plain ordinal positions (1, 2, 3, ...). */
    INDEX,

    /** Date/time values expressed as milliseconds since the epoch (UTC). */
    EPOCH_MILLIS;

    public boolean isDateTime() {
        return this == EPOCH_MILLIS;
    }
}
