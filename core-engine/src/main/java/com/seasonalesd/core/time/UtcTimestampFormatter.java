package com.seasonalesd.core.time;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Formats timestamps as {@code yyyy-MM-dd HH:mm:ss} in UTC.
 *
 * @since 1.0.0
 */
public final class UtcTimestampFormatter implements TimestampFormatter {

    public static final UtcTimestampFormatter INSTANCE = new UtcTimestampFormatter();

    public static final DateTimeFormatter PATTERN =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private UtcTimestampFormatter() {
    }

    @Override
    public String format(long epochMillis) {
        return PATTERN.format(Instant.ofEpochMilli(epochMillis));
    }
}
