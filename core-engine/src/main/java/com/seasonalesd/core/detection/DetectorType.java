package com.seasonalesd.core.detection;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The detector kinds a profile can name in its {@code type} key.
 *
 * @since 1.0.0
 */
public enum DetectorType {

    /** Ordinal series with an explicit {@code period}. */
    VECTOR("vector"),

    /** Timestamped series whose period follows from the granularity. */
    TIMESERIES("timeseries");

    private final String label;

    DetectorType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolve a profile's {@code type} value, ignoring case.
     *
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if no type has that label
     */
    public static DetectorType parse(String value) {
        if (value == null) {
            throw new NullPointerException("Detector type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DetectorType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown detector type: '" + value
                + "'. Supported types: " + supported());
    }

    static String supported() {
        return Arrays.stream(values()).map(DetectorType::label).collect(Collectors.joining(", "));
    }
}
