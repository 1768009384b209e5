package com.seasonalesd.core.detection;

import java.util.Locale;

/**
 * Restricts reported anomalies to the most recent part of the series.
 *
 * @since 1.0.0
 */
public enum OnlyLast {

    /** Report anomalies anywhere in the series. */
    NONE,

    /** Last seasonal period (ordinal series). */
    PERIOD,

    /** Last day (date/time series). */
    DAY,

    /** Last hour (date/time series). */
    HOUR;

    /**
     * Parse {@code none}, {@code period}, {@code day} or {@code hr}, ignoring
     * case; {@code null} means {@link #NONE}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OnlyLast parse(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "period" -> PERIOD;
            case "day" -> DAY;
            case "hr", "hour" -> HOUR;
            default -> throw new IllegalArgumentException(
                    "Unknown onlyLast: '" + value + "'. Supported: none, period, day, hr");
        };
    }
}
