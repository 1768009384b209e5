package com.seasonalesd.core.detection;

import java.util.Locale;

/**
 * Which deviations count as anomalies.
 *
 * @since 1.0.0
 */
public enum Direction {

    /** Only values above the expected level (one-tailed, upper). */
    POS(true, true),

    /** Only values below the expected level (one-tailed, lower). */
    NEG(true, false),

    /** Deviations in either direction (two-tailed). */
    BOTH(false, true);

    private final boolean oneTail;
    private final boolean upperTail;

    Direction(boolean oneTail, boolean upperTail) {
        this.oneTail = oneTail;
        this.upperTail = upperTail;
    }

    public boolean isOneTail() {
        return oneTail;
    }

    public boolean isUpperTail() {
        return upperTail;
    }

    /**
     * Parse {@code pos}, {@code neg} or {@code both}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Direction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pos" -> POS;
            case "neg" -> NEG;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Unknown direction: '" + value + "'. Supported: pos, neg, both");
        };
    }
}
