package com.seasonalesd.core.model;

/**
 * Thrown when a series or a required setting cannot be used for detection:
 * missing period length, too few observations, interior missing values,
 * unordered timestamps.
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
