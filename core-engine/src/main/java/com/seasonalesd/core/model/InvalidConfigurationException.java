package com.seasonalesd.core.model;

/**
 * Thrown when detection settings are out of range or leave no room for a
 * single outlier (for example when {@code floor(numObs * k)} is zero).
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
